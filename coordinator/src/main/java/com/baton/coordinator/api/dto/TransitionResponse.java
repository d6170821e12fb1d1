package com.baton.coordinator.api.dto;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.engine.TransitionAction;
import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;
import com.baton.coordinator.service.TransitionOutcome;

import java.util.List;

/**
 * Routing decision for one report, plus the group status after it.
 */
public record TransitionResponse(
        String           groupId,
        Role             nextRole,
        TransitionAction action,
        GroupStatus      groupStatus,
        List<String>     includeContext,
        boolean          escalated,
        boolean          failClosed,
        boolean          stale,
        boolean          duplicate,
        List<String>     notes
) {
    public static TransitionResponse from(TransitionOutcome outcome) {
        return of(outcome.group().getGroupId(), outcome.group().getStatus(), outcome.decision(), outcome.duplicate());
    }

    static TransitionResponse of(String groupId, GroupStatus status, RoutingDecision d, boolean duplicate) {
        return new TransitionResponse(
                groupId,
                d.nextRole(),
                d.action(),
                status,
                d.includeContext(),
                d.escalated(),
                d.failClosed(),
                d.stale(),
                duplicate,
                d.notes()
        );
    }
}
