package com.baton.coordinator.api.dto;

import com.baton.coordinator.event.RejectionVerdict;
import com.baton.coordinator.model.Role;

import java.util.List;

/** Request body for POST /sessions/{sessionId}/groups/{groupId}/verdicts. */
public record VerdictRequest(Role role, int iteration, List<RejectionVerdict> verdicts) {

    public VerdictRequest {
        if (role == null) role = Role.REVIEWER;
    }
}
