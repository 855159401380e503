package com.purchasingpower.toolagent.core;

import com.google.common.base.Preconditions;

import java.util.Optional;

/**
 * Single in-flight execution per agent. Dispatch is strictly sequential:
 * a new request may occupy the slot only after the previous one is released.
 *
 * <p>Cancelling the occupant only sets a flag; the running invocation is
 * never interrupted.
 *
 * <p>Not thread-safe; owned by a single lifecycle manager.
 *
 * @since 1.0.0
 */
public final class ExecutionSlot {

    private ActiveExecution active;

    /**
     * @return false if another request already occupies the slot
     */
    public boolean tryOccupy(ToolRequest request, long now) {
        Preconditions.checkNotNull(request, "Request cannot be null");
        if (active != null) {
            return false;
        }
        active = new ActiveExecution(request, now);
        return true;
    }

    /**
     * Free the slot if {@code requestId} occupies it.
     */
    public Optional<ActiveExecution> release(String requestId) {
        if (active == null || !active.getRequest().getId().equals(requestId)) {
            return Optional.empty();
        }
        ActiveExecution released = active;
        active = null;
        return Optional.of(released);
    }

    public boolean markCancelled(String requestId) {
        if (!contains(requestId)) {
            return false;
        }
        active.markCancelled();
        return true;
    }

    public boolean contains(String requestId) {
        return active != null && active.getRequest().getId().equals(requestId);
    }

    public boolean isOccupied() {
        return active != null;
    }

    public int activeCount() {
        return active == null ? 0 : 1;
    }
}
