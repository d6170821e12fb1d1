package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.Role;

import java.util.Set;

/**
 * Request body for POST /sessions/{sessionId}/groups/{groupId}/status.
 *
 * capabilities lists the markers present in the role's output; dedupKey
 * makes a retried report safe.
 */
public record StatusReportRequest(Role role, String statusCode, Set<String> capabilities, String dedupKey) {

    public StatusReportRequest {
        if (capabilities == null) capabilities = Set.of();
    }
}
