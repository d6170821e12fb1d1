package com.baton.coordinator.api.dto;

import com.baton.coordinator.ledger.IssueDraft;
import com.baton.coordinator.model.Role;

import java.util.List;

/**
 * Request body for POST /sessions/{sessionId}/groups/{groupId}/reviews.
 *
 * iteration must be the group's current review iteration plus one; issues is
 * the complete list for this pass (not a diff).
 */
public record ReviewRequest(Role role, int iteration, List<IssueDraft> issues) {

    public ReviewRequest {
        if (role == null) role = Role.REVIEWER;
        if (issues == null) issues = List.of();
    }
}
