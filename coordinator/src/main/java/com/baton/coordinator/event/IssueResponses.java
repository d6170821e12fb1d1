package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Responses to the issues of one iteration. The latest event for an
 * iteration supersedes earlier ones and is always complete.
 */
public record IssueResponses(int iteration, List<IssueResponse> responses) implements EventPayload {


    @Override
    public EventType type() { return EventType.ISSUE_RESPONSES; }

    @Override
    public void validate() {
        Payloads.require(iteration >= 1, "iteration must be >= 1, was " + iteration);
        Payloads.requireNoNulls(responses, "responses");
        Set<String> ids = new HashSet<>();
        for (IssueResponse response : responses) {
            response.validate();
            Payloads.require(ids.add(response.issueId()), "issue answered twice: " + response.issueId());
        }
    }
}
