package com.purchasingpower.toolagent.agent.impl;

import com.purchasingpower.toolagent.agent.ToolNotification;
import com.purchasingpower.toolagent.agent.ToolNotificationSink;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Publishes tool notifications as Spring application events, so any
 * {@code @EventListener} for {@link ToolNotification} receives them.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class SpringEventNotificationSink implements ToolNotificationSink {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void publish(ToolNotification notification) {
        eventPublisher.publishEvent(notification);
    }
}
