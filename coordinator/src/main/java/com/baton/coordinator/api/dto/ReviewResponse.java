package com.baton.coordinator.api.dto;

import com.baton.coordinator.event.Issue;
import com.baton.coordinator.progress.EscalationLevel;
import com.baton.coordinator.service.ReviewOutcome;

import java.util.List;

/**
 * Result of a review pass: the stored issues, the progress verdict and the
 * routing that followed. Review fields are empty when the pass was dropped
 * as stale.
 */
public record ReviewResponse(
        int                iteration,
        List<Issue>        issues,
        int                droppedNonBlocking,
        List<String>       autoAccepted,
        int                blockingCount,
        int                nonBlockingCount,
        Boolean            progressed,
        Integer            noProgressStreak,
        EscalationLevel    escalationLevel,
        TransitionResponse transition
) {
    public static ReviewResponse from(ReviewOutcome o) {
        TransitionResponse transition = TransitionResponse.of(
                o.group().getGroupId(), o.group().getStatus(), o.decision(), o.duplicate());
        if (o.review() == null) {
            return new ReviewResponse(o.group().getReviewIteration(), List.of(), 0, List.of(),
                    o.group().getBlockingIssuesCount(), 0, null, null, null, transition);
        }
        return new ReviewResponse(
                o.review().iteration(),
                o.review().issues(),
                o.review().dropped().size(),
                o.review().autoAccepted(),
                o.review().blockingCount(),
                o.review().nonBlockingCount(),
                o.progress() == null ? null : o.progress().progressed(),
                o.progress() == null ? null : o.progress().streak(),
                o.progress() == null ? null : o.progress().level(),
                transition
        );
    }
}
