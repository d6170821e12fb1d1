package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.ExecutionMode;
import com.baton.coordinator.model.ScopeItem;
import com.baton.coordinator.model.TestingMode;

import java.util.List;

/**
 * Request body for POST /sessions.
 *
 * Required: sessionId
 * Optional: scope (defaults to empty), executionMode (SINGLE_TRACK), testingMode (FULL)
 */
public record CreateSessionRequest(String sessionId, List<ScopeItem> scope,
                                   ExecutionMode executionMode, TestingMode testingMode) {

    public CreateSessionRequest {
        if (scope == null) scope = List.of();
    }
}
