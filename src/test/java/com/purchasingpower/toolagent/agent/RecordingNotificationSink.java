package com.purchasingpower.toolagent.agent;

import com.purchasingpower.toolagent.agent.ToolNotification.EventType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thread-safe sink that keeps every notification for later assertions.
 */
public final class RecordingNotificationSink implements ToolNotificationSink {

    private final List<ToolNotification> notifications = new ArrayList<>();

    @Override
    public synchronized void publish(ToolNotification notification) {
        notifications.add(notification);
    }

    public synchronized List<ToolNotification> all() {
        return List.copyOf(notifications);
    }

    public synchronized List<ToolNotification> forRequest(String requestId) {
        return notifications.stream()
            .filter(n -> requestId.equals(n.getRequestId()))
            .collect(Collectors.toList());
    }

    public synchronized List<ToolNotification> terminalFor(String requestId) {
        return forRequest(requestId).stream()
            .filter(ToolNotification::isTerminal)
            .collect(Collectors.toList());
    }

    public synchronized List<ToolNotification> ofType(EventType type) {
        return notifications.stream()
            .filter(n -> n.getType() == type)
            .collect(Collectors.toList());
    }

    /**
     * Request ids in the order their STARTED notifications were published.
     */
    public synchronized List<String> dispatchOrder() {
        return ofType(EventType.STARTED).stream()
            .map(ToolNotification::getRequestId)
            .collect(Collectors.toList());
    }

    public synchronized void clear() {
        notifications.clear();
    }
}
