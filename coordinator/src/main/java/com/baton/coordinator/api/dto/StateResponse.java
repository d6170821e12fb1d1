package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.StateSnapshot;
import com.fasterxml.jackson.annotation.JsonRawValue;

import java.time.Instant;

public record StateResponse(
        String  sessionId,
        String  scope,
        String  stateType,
        @JsonRawValue String payload,
        Instant updatedAt
) {
    public static StateResponse from(StateSnapshot s) {
        return new StateResponse(s.getSessionId(), s.getScope(), s.getStateType(), s.getPayload(), s.getUpdatedAt());
    }
}
