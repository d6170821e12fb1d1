package com.baton.coordinator.engine;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;

import java.util.List;

/**
 * One row of the transition table.
 *
 * @param nextRole             Role that receives the group.
 * @param action               How the caller should hand it over.
 * @param groupStatus          Status the group moves to, or null to leave it unchanged.
 * @param includeContext       Names of the context items the next role needs.
 * @param escalationCheck      Consult the progress tracker before handing over.
 * @param bypassQualityCheck   The transition skips the quality checker on purpose.
 */
public record Transition(
        Role             nextRole,
        TransitionAction action,
        GroupStatus      groupStatus,
        List<String>     includeContext,
        boolean          escalationCheck,
        boolean          bypassQualityCheck) {

    public Transition {
        includeContext = includeContext == null ? List.of() : List.copyOf(includeContext);
    }
}
