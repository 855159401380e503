package com.purchasingpower.toolagent.core;

import com.purchasingpower.toolagent.core.CompletionRecord.Outcome;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Completion History Tests")
class CompletionHistoryTest {

    @Test
    @DisplayName("Oldest entries are dropped past the cap")
    void testCap() {
        CompletionHistory history = new CompletionHistory(2);

        history.record(record("r1", Outcome.SUCCESS));
        history.record(record("r2", Outcome.FAILURE));
        history.record(record("r3", Outcome.CANCELLED));

        assertThat(history.snapshot()).extracting(CompletionRecord::requestId).containsExactly("r3", "r2");
    }

    @Test
    @DisplayName("Snapshots are independent of later records")
    void testSnapshotIsCopy() {
        CompletionHistory history = new CompletionHistory(CompletionHistory.DEFAULT_MAX_SIZE);
        history.record(record("r1", Outcome.SUCCESS));

        List<CompletionRecord> snapshot = history.snapshot();
        history.record(record("r2", Outcome.SUCCESS));

        assertEquals(1, snapshot.size());
        assertEquals(2, history.snapshot().size());
    }

    @Test
    @DisplayName("Non-positive sizes are rejected")
    void testInvalidSize() {
        assertThrows(IllegalArgumentException.class, () -> new CompletionHistory(0));
    }

    private static CompletionRecord record(String id, Outcome outcome) {
        return new CompletionRecord(id, outcome, 10L, Instant.now());
    }
}
