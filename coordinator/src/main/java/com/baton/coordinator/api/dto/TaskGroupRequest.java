package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;

import java.util.List;

/**
 * Request body for PUT /sessions/{sessionId}/groups/{groupId}.
 * Omitted fields keep their stored value; name is required on create.
 */
public record TaskGroupRequest(String name, GroupStatus status, Role assignedRole,
                               Integer reviewIteration, Integer complexity, List<String> scopeItemIds) {}
