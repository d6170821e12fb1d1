package com.baton.coordinator.progress;

import com.baton.coordinator.engine.WorkflowLimits;
import org.springframework.stereotype.Component;

/**
 * Decides whether a review pass made progress and whether the group has
 * stalled long enough to escalate.
 *
 * Progress means exactly one thing: fewer blocking issues remain than after
 * the previous pass. Fixing something while the count stays the same is not
 * progress, so fixing one trivial issue per pass and ignoring the rest
 * still escalates.
 */
@Component
public class ProgressTracker {

    public ProgressEvaluation evaluate(ProgressInput input, WorkflowLimits limits) {
        int iteration = input.currentIteration();

        boolean progressed;
        int streak;
        if (iteration == 1) {
            // No baseline yet: the first pass never counts against the group.
            progressed = true;
            streak     = input.noProgressStreak();
        } else if (input.currentBlockingCount() < input.previousBlockingCount()) {
            progressed = true;
            streak     = 0;
        } else {
            progressed = false;
            streak     = input.noProgressStreak() + 1;
        }
        return new ProgressEvaluation(iteration, progressed, streak, assess(iteration, streak, limits));
    }

    /**
     * Escalation level for counters already stored on a group.
     * The hard cap wins over everything else.
     */
    public EscalationLevel assess(int iteration, int streak, WorkflowLimits limits) {
        if (iteration >= limits.hardIterationCap()) {
            return EscalationLevel.HARD_CAP;
        }
        if (streak >= limits.maxIterations()) {
            return EscalationLevel.ESCALATE;
        }
        if (streak == limits.maxIterations() - 1 && streak > 0) {
            return EscalationLevel.WARNING;
        }
        return EscalationLevel.NONE;
    }
}
