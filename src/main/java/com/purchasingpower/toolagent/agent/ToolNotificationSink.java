package com.purchasingpower.toolagent.agent;

/**
 * Where tool agents publish their notifications.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ToolNotificationSink {

    void publish(ToolNotification notification);
}
