package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.Role;

import java.time.Instant;

/**
 * Written when a role invocation passes its deadline without an answer, so
 * the progress tracker sees a stalled pass like any other.
 */
public record NoProgress(Role role, Instant deadline, String reason) implements EventPayload {

    @Override
    public EventType type() { return EventType.NO_PROGRESS; }

    @Override
    public void validate() {
        Payloads.require(role != null, "role is required");
        Payloads.require(deadline != null, "deadline is required");
    }
}
