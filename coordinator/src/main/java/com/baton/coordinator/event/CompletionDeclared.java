package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.Role;

public record CompletionDeclared(Role role, String summary) implements EventPayload {

    @Override
    public EventType type() { return EventType.COMPLETION_DECLARED; }

    @Override
    public void validate() {
        Payloads.require(role == Role.MANAGER, "only the manager can declare completion, not " + role);
    }
}
