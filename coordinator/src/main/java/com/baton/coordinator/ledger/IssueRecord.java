package com.baton.coordinator.ledger;

import com.baton.coordinator.event.Issue;
import com.baton.coordinator.event.Severity;

/**
 * Derived view of one issue: what the reviewer raised joined with the
 * latest response to it.
 *
 * @param reason The implementer's reason for the current resolution, if any.
 */
public record IssueRecord(
        String           id,
        String           groupId,
        int              iteration,
        String           title,
        String           description,
        Severity         severity,
        boolean          blocking,
        String           location,
        ResolutionStatus resolution,
        String           reason) {

    static IssueRecord of(String groupId, int iteration, Issue issue, ResolutionStatus resolution, String reason) {
        return new IssueRecord(issue.id(), groupId, iteration, issue.title(), issue.description(),
                issue.severity(), issue.blocking(), issue.location(), resolution, reason);
    }

    /** Blocking and not yet fixed or accepted as rejected. */
    public boolean unresolvedBlocking() {
        return blocking && !resolution.resolved();
    }
}
