package com.baton.coordinator.api.dto;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;
import com.baton.coordinator.model.TaskGroup;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of a task group and its review counters.
 */
public record TaskGroupResponse(
        String       groupId,
        String       name,
        GroupStatus  status,
        Role         assignedRole,
        int          reviewIteration,
        int          noProgressCount,
        int          blockingIssuesCount,
        int          complexity,
        List<String> scopeItemIds,
        boolean      securitySensitive,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static TaskGroupResponse from(TaskGroup g) {
        return new TaskGroupResponse(
                g.getGroupId(),
                g.getName(),
                g.getStatus(),
                g.getAssignedRole(),
                g.getReviewIteration(),
                g.getNoProgressCount(),
                g.getBlockingIssuesCount(),
                g.getComplexity(),
                g.getScopeItemIds(),
                g.isSecuritySensitive(),
                g.getCreatedAt(),
                g.getUpdatedAt()
        );
    }
}
