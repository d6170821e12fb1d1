package com.baton.coordinator.engine;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;

import java.util.List;

/**
 * Result of a routing lookup.
 *
 * @param nextRole       Role that receives the group.
 * @param action         How to hand it over.
 * @param groupStatus    New group status, or null when the status does not change.
 * @param includeContext Context items to pass to the next role.
 * @param escalated      The group was handed to a higher tier (or stopped by the hard cap).
 * @param failClosed     The report could not be routed normally and went to the manager.
 * @param stale          The report arrived for a group that no longer accepts it and was dropped.
 * @param notes          Human-readable reasons for every rule that fired.
 */
public record RoutingDecision(
        Role             nextRole,
        TransitionAction action,
        GroupStatus      groupStatus,
        List<String>     includeContext,
        boolean          escalated,
        boolean          failClosed,
        boolean          stale,
        List<String>     notes) {

    public RoutingDecision {
        includeContext = includeContext == null ? List.of() : List.copyOf(includeContext);
        notes          = notes == null ? List.of() : List.copyOf(notes);
    }

    /** Route to the manager because the report could not be routed as sent. */
    public static RoutingDecision failClosed(String reason) {
        return new RoutingDecision(Role.MANAGER, TransitionAction.ROUTE, null,
                List.of(), false, true, false, List.of(reason));
    }

    /** Drop a late report; the group stays with whoever holds it now. */
    public static RoutingDecision stale(Role holder, String reason) {
        return new RoutingDecision(holder, TransitionAction.TERMINATE, null,
                List.of(), false, false, true, List.of(reason));
    }
}
