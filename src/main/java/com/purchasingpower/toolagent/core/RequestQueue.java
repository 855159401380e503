package com.purchasingpower.toolagent.core;

import com.google.common.base.Preconditions;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Pending requests ordered by priority rank, then by insertion order.
 *
 * <p>Inserting after the last entry of equal or better rank is equivalent to a
 * stable sort of the whole queue on every insert.
 *
 * <p>Not thread-safe; owned by a single lifecycle manager.
 *
 * @since 1.0.0
 */
public final class RequestQueue {

    private final List<ToolRequest> pending = new ArrayList<>();

    public void enqueue(ToolRequest request) {
        Preconditions.checkNotNull(request, "Request cannot be null");
        int rank = request.getPriority().getRank();
        int index = pending.size();
        while (index > 0 && pending.get(index - 1).getPriority().getRank() > rank) {
            index--;
        }
        pending.add(index, request);
    }

    public Optional<ToolRequest> dequeue() {
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pending.remove(0));
    }

    /**
     * Remove a pending request.
     *
     * @return false if the id is not queued (already dispatched, completed or unknown)
     */
    public boolean remove(String requestId) {
        Iterator<ToolRequest> it = pending.iterator();
        while (it.hasNext()) {
            if (it.next().getId().equals(requestId)) {
                it.remove();
                return true;
            }
        }
        return false;
    }

    public boolean contains(String requestId) {
        return pending.stream().anyMatch(r -> r.getId().equals(requestId));
    }

    public int size() {
        return pending.size();
    }

    public boolean isEmpty() {
        return pending.isEmpty();
    }

    /**
     * Copy of the queue in dispatch order.
     */
    public List<ToolRequest> snapshot() {
        return List.copyOf(pending);
    }
}
