package com.purchasingpower.toolagent.agent.impl;

import com.purchasingpower.toolagent.agent.ToolNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Logs every tool notification published through the application context.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolNotificationLogger {

    @EventListener
    public void onNotification(ToolNotification notification) {
        switch (notification.getType()) {
            case ERROR -> log.warn("[{}] {} {}: {}", notification.getAgentName(), notification.getType(),
                notification.getRequestId(), notification.getError());
            case RATE_LIMITED -> log.warn("[{}] {} {} (retry after {}s)", notification.getAgentName(),
                notification.getType(), notification.getRequestId(), notification.getRetryAfterSeconds());
            case RESULT -> log.info("[{}] {} {} (fromCache={}, {}ms)", notification.getAgentName(),
                notification.getType(), notification.getRequestId(), notification.isFromCache(),
                notification.getExecutionTimeMs());
            case METRICS_REPORT -> log.info("[{}] Metrics: {}", notification.getAgentName(), notification.getMetrics());
            default -> log.debug("[{}] {} {}", notification.getAgentName(), notification.getType(),
                notification.getRequestId());
        }
    }
}
