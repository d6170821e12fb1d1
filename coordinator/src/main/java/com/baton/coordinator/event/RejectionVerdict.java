package com.baton.coordinator.event;

/**
 * Reviewer decision on one rejected issue.
 *
 * @param accepted true accepts the implementer's rejection, false overrules it
 */
public record RejectionVerdict(String issueId, boolean accepted, String note) {

    void validate() {
        Payloads.requireText(issueId, "verdict.issue_id");
    }
}
