package com.baton.coordinator.event;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.Role;

/**
 * Routing decision taken for one status report. A retried report with the
 * same dedup key gets this stored decision back instead of a second routing.
 */
public record TransitionRecorded(Role role, String statusCode, int iteration,
                                 RoutingDecision decision) implements EventPayload {

    @Override
    public EventType type() { return EventType.TRANSITION; }

    @Override
    public void validate() {
        Payloads.require(role != null, "role is required");
        Payloads.requireText(statusCode, "status_code");
        Payloads.require(decision != null, "decision is required");
    }
}
