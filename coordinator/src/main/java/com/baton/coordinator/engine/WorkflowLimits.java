package com.baton.coordinator.engine;

/**
 * Iteration limits for one session.
 *
 * @param maxIterations     Consecutive no-progress passes before escalation.
 *                          A warning is raised one pass earlier.
 * @param hardIterationCap  Absolute number of review passes per group,
 *                          whatever tier is working on it.
 */
public record WorkflowLimits(int maxIterations, int hardIterationCap) {

    public WorkflowLimits {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be >= 1, was " + maxIterations);
        }
        if (hardIterationCap < maxIterations) {
            throw new IllegalArgumentException("hardIterationCap (%d) must be >= maxIterations (%d)"
                    .formatted(hardIterationCap, maxIterations));
        }
    }
}
