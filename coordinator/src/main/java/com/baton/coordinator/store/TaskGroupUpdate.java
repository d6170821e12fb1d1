package com.baton.coordinator.store;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;

import java.util.List;

/**
 * Fields for a create-or-update of one task group. A null field leaves the
 * stored value as it is (or takes the default on create).
 */
public record TaskGroupUpdate(
        String       groupId,
        String       name,
        GroupStatus  status,
        Role         assignedRole,
        Integer      reviewIteration,
        Integer      complexity,
        List<String> scopeItemIds) {

    public static TaskGroupUpdate create(String groupId, String name, List<String> scopeItemIds) {
        return new TaskGroupUpdate(groupId, name, null, null, null, null, scopeItemIds);
    }
}
