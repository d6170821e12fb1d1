package com.baton.coordinator.engine;

import com.baton.coordinator.model.Role;

import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable workflow configuration of one session: transition table, role
 * capabilities and iteration limits.
 *
 * Built once when the session is created and never re-read from the
 * configuration source afterwards, so an edit to the source only affects
 * sessions created after it.
 */
public final class WorkflowSnapshot {

    private final int version;
    private final TransitionTable transitions;
    private final Map<Role, RoleCapabilities> capabilities;
    private final WorkflowLimits limits;

    public WorkflowSnapshot(int version, TransitionTable transitions,
                            Map<Role, RoleCapabilities> capabilities, WorkflowLimits limits) {
        this.version      = version;
        this.transitions  = transitions;
        this.capabilities = capabilities.isEmpty()
                ? Map.of()
                : Map.copyOf(new EnumMap<>(capabilities));
        this.limits       = limits;
    }

    public int             version()     { return version; }
    public TransitionTable transitions() { return transitions; }
    public WorkflowLimits  limits()      { return limits; }

    public RoleCapabilities capabilitiesOf(Role role) {
        return capabilities.getOrDefault(role, RoleCapabilities.NONE);
    }
}
