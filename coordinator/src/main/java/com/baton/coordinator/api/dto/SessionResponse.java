package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.ExecutionMode;
import com.baton.coordinator.model.ScopeItem;
import com.baton.coordinator.model.Session;
import com.baton.coordinator.model.SessionStatus;
import com.baton.coordinator.model.TestingMode;

import java.time.Instant;
import java.util.List;

/**
 * Response body for POST /sessions and GET /sessions/{sessionId}.
 */
public record SessionResponse(
        String          id,
        SessionStatus   status,
        ExecutionMode   executionMode,
        TestingMode     testingMode,
        List<ScopeItem> scope,
        Instant         createdAt,
        Instant         closedAt
) {
    public static SessionResponse from(Session s) {
        return new SessionResponse(
                s.getId(),
                s.getStatus(),
                s.getExecutionMode(),
                s.getTestingMode(),
                s.getOriginalScope(),
                s.getCreatedAt(),
                s.getClosedAt()
        );
    }
}
