package com.baton.coordinator.engine;

import com.baton.coordinator.model.Role;
import com.baton.coordinator.model.TestingMode;
import com.baton.coordinator.progress.EscalationLevel;

import java.util.Set;

/**
 * Everything the engine needs for one lookup: the reporting role and its
 * status, plus the state of that one group and the session's testing mode.
 * Nothing about other groups is ever part of a request.
 */
public record RoutingRequest(
        Role            currentRole,
        String          statusCode,
        boolean         securitySensitive,
        TestingMode     testingMode,
        EscalationLevel escalationLevel,
        Set<String>     capabilities) {

    public RoutingRequest {
        testingMode     = testingMode == null ? TestingMode.FULL : testingMode;
        escalationLevel = escalationLevel == null ? EscalationLevel.NONE : escalationLevel;
        capabilities    = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }
}
