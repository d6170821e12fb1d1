package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * The complete issue list of one review pass. Never a diff against the
 * previous pass.
 */
public record IssuesRaised(int iteration, List<Issue> issues) implements EventPayload {


    @Override
    public EventType type() { return EventType.ISSUES_RAISED; }

    @Override
    public void validate() {
        Payloads.require(iteration >= 1, "iteration must be >= 1, was " + iteration);
        Payloads.requireNoNulls(issues, "issues");
        Set<String> ids = new HashSet<>();
        for (Issue issue : issues) {
            issue.validate();
            Payloads.require(ids.add(issue.id()), "duplicate issue id " + issue.id());
        }
    }
}
