package com.purchasingpower.toolagent.core;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The request currently occupying an {@link ExecutionSlot}.
 *
 * @since 1.0.0
 */
@Getter
@RequiredArgsConstructor
public final class ActiveExecution {

    private final ToolRequest request;
    private final long startedAt;
    private boolean cancelled;

    void markCancelled() {
        this.cancelled = true;
    }
}
