package com.baton.coordinator.event;

import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.Role;

import java.util.List;

public record RoleViolation(Role role, String statusCode, List<String> missingCapabilities)
        implements EventPayload {

    @Override
    public EventType type() { return EventType.ROLE_VIOLATION; }

    @Override
    public void validate() {
        Payloads.require(role != null, "role is required");
        Payloads.requireNoNulls(missingCapabilities, "missing_capabilities");
    }
}
