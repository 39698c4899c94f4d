package com.taskgraph.core.persistence;

import java.util.List;

/**
 * Outcome of restoring a blackboard from bytes.
 *
 * @param restored  number of entries written into the blackboard
 * @param skipped   one diagnostic per entry that was read but not applied
 * @param truncated true if the stream ended or became unreadable before all declared entries were read
 */
public record RestoreReport(int restored, List<String> skipped, boolean truncated) {

    public RestoreReport {
        skipped = List.copyOf(skipped);
    }

    public boolean clean() {
        return skipped.isEmpty() && !truncated;
    }
}
