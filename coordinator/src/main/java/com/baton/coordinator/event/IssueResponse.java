package com.baton.coordinator.event;

/**
 * @param issueId Issue being answered; must belong to the answered iteration.
 * @param status  What was done about it.
 * @param reason  Mandatory for rejections, optional otherwise.
 */
public record IssueResponse(String issueId, ResponseStatus status, String reason) {

    void validate() {
        Payloads.requireText(issueId, "response.issue_id");
        Payloads.require(status != null, "response.status is required for " + issueId);
        if (status == ResponseStatus.REJECTED) {
            Payloads.requireText(reason, "reason for rejecting " + issueId);
        }
    }
}
