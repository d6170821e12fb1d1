package com.baton.coordinator.progress;

import com.baton.coordinator.engine.WorkflowLimits;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ProgressTracker. Pure arithmetic, no Spring context.
 */
class ProgressTrackerTest {

    final ProgressTracker tracker = new ProgressTracker();
    final WorkflowLimits  limits  = new WorkflowLimits(3, 8);

    // ------------------------------------------------------------------
    // evaluate()
    // ------------------------------------------------------------------

    @Test
    void evaluate_firstIteration_neverCountsAsNoProgress() {
        // 0 -> 5 blocking issues would be "no progress" on any later pass
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(0, 0, 5, 0), limits);

        assertThat(eval.iteration()).isEqualTo(1);
        assertThat(eval.progressed()).isTrue();
        assertThat(eval.streak()).isZero();
        assertThat(eval.level()).isEqualTo(EscalationLevel.NONE);
    }

    @Test
    void evaluate_fewerBlockingIssues_resetsStreak() {
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(3, 4, 3, 2), limits);

        assertThat(eval.progressed()).isTrue();
        assertThat(eval.streak()).isZero();
    }

    @Test
    void evaluate_sameBlockingCount_incrementsStreak() {
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(1, 2, 2, 0), limits);

        assertThat(eval.progressed()).isFalse();
        assertThat(eval.streak()).isEqualTo(1);
        assertThat(eval.level()).isEqualTo(EscalationLevel.NONE);
    }

    @Test
    void evaluate_moreBlockingIssues_isNoProgress() {
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(1, 2, 4, 0), limits);

        assertThat(eval.progressed()).isFalse();
        assertThat(eval.streak()).isEqualTo(1);
    }

    @Test
    void evaluate_streakOneBelowLimit_warns() {
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(2, 2, 2, 1), limits);

        assertThat(eval.streak()).isEqualTo(2);
        assertThat(eval.level()).isEqualTo(EscalationLevel.WARNING);
    }

    @Test
    void evaluate_streakReachesLimit_escalates() {
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(3, 2, 2, 2), limits);

        assertThat(eval.streak()).isEqualTo(3);
        assertThat(eval.level()).isEqualTo(EscalationLevel.ESCALATE);
    }

    @Test
    void evaluate_hardCapWinsEvenWhenProgressing() {
        ProgressEvaluation eval = tracker.evaluate(new ProgressInput(7, 5, 1, 0), limits);

        assertThat(eval.iteration()).isEqualTo(8);
        assertThat(eval.progressed()).isTrue();
        assertThat(eval.level()).isEqualTo(EscalationLevel.HARD_CAP);
    }

    @Test
    void evaluate_fixingTrivialIssuesWhileCountStaysFlat_stillEscalates() {
        // Each pass fixes one issue and the reviewer finds one more: count never drops.
        int streak = 0;
        EscalationLevel level = EscalationLevel.NONE;
        for (int previous = 1; previous <= 3; previous++) {
            ProgressEvaluation eval = tracker.evaluate(new ProgressInput(previous, 3, 3, streak), limits);
            streak = eval.streak();
            level  = eval.level();
        }
        assertThat(streak).isEqualTo(3);
        assertThat(level).isEqualTo(EscalationLevel.ESCALATE);
    }

    @Test
    void progressInput_negativeCounter_rejected() {
        assertThatThrownBy(() -> new ProgressInput(1, -1, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ------------------------------------------------------------------
    // assess()
    // ------------------------------------------------------------------

    @Test
    void assess_zeroStreak_noWarningEvenWithLimitOfOne() {
        WorkflowLimits strict = new WorkflowLimits(1, 4);

        assertThat(tracker.assess(2, 0, strict)).isEqualTo(EscalationLevel.NONE);
        assertThat(tracker.assess(2, 1, strict)).isEqualTo(EscalationLevel.ESCALATE);
    }
}
