package com.baton.coordinator.service;

import com.baton.coordinator.model.Role;

import java.util.Set;

/**
 * A role finishing its turn on a task group.
 *
 * @param capabilities Capability markers present in the role's output.
 * @param dedupKey     Optional; a retry with the same key gets the stored decision back.
 */
public record StatusReport(
        String      sessionId,
        String      groupId,
        Role        role,
        String      statusCode,
        Set<String> capabilities,
        String      dedupKey) {}
