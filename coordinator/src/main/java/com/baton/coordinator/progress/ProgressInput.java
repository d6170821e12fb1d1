package com.baton.coordinator.progress;

/**
 * Counters before the pass being evaluated.
 *
 * @param previousIteration      Review iteration before this pass (0 when none happened yet).
 * @param previousBlockingCount  Unresolved blocking issues after the previous pass.
 * @param currentBlockingCount   Unresolved blocking issues after this pass.
 * @param noProgressStreak       Consecutive no-progress passes so far.
 */
public record ProgressInput(
        int previousIteration,
        int previousBlockingCount,
        int currentBlockingCount,
        int noProgressStreak) {

    public ProgressInput {
        if (previousIteration < 0 || previousBlockingCount < 0
                || currentBlockingCount < 0 || noProgressStreak < 0) {
            throw new IllegalArgumentException("progress counters cannot be negative");
        }
    }

    public int currentIteration() {
        return previousIteration + 1;
    }
}
