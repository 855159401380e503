package com.purchasingpower.toolagent.core;

import com.google.common.base.Preconditions;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Most recent completions of one agent, newest first, capped at a fixed size.
 *
 * <p>Not thread-safe; owned by a single lifecycle manager.
 *
 * @since 1.0.0
 */
public final class CompletionHistory {

    public static final int DEFAULT_MAX_SIZE = 100;

    private final int maxSize;
    private final Deque<CompletionRecord> records = new ArrayDeque<>();

    public CompletionHistory(int maxSize) {
        Preconditions.checkArgument(maxSize > 0, "History size must be positive");
        this.maxSize = maxSize;
    }

    public void record(CompletionRecord completion) {
        Preconditions.checkNotNull(completion, "Completion cannot be null");
        records.addFirst(completion);
        while (records.size() > maxSize) {
            records.removeLast();
        }
    }

    public List<CompletionRecord> snapshot() {
        return List.copyOf(records);
    }
}
