package com.baton.coordinator.config;

import com.baton.coordinator.engine.RoleCapabilities;
import com.baton.coordinator.engine.Transition;
import com.baton.coordinator.engine.TransitionAction;
import com.baton.coordinator.engine.TransitionTable;
import com.baton.coordinator.engine.WorkflowLimits;
import com.baton.coordinator.engine.WorkflowSnapshot;
import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JSON shape of the externally authored workflow configuration
 * ({@code workflow/transitions.json}).
 *
 * Kept as plain strings so the document can be stored verbatim in the
 * session's global state and compiled into a {@link WorkflowSnapshot}
 * whenever the session is loaded.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WorkflowConfig(
        int                                      version,
        LimitsSpec                               limits,
        Map<String, CapabilitySpec>              capabilities,
        Map<String, Map<String, TransitionSpec>> transitions) {

    public record LimitsSpec(int maxIterations, int hardIterationCap) {}

    public record CapabilitySpec(List<String> mandatory, List<String> optional) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransitionSpec(
            String       nextRole,
            String       action,
            String       groupStatus,
            List<String> includeContext,
            boolean      escalationCheck,
            boolean      bypassQualityCheck) {}

    /**
     * Validate and build the immutable snapshot.
     *
     * @throws IllegalStateException naming the offending entry when the document is invalid
     */
    public WorkflowSnapshot compile() {
        if (limits == null) {
            throw new IllegalStateException("workflow config has no limits section");
        }
        if (transitions == null || transitions.isEmpty()) {
            throw new IllegalStateException("workflow config has no transitions");
        }

        TransitionTable.Builder table = TransitionTable.builder();
        transitions.forEach((roleKey, byStatus) -> {
            Role role = role(roleKey, "transitions");
            byStatus.forEach((status, spec) -> table.add(role, status, toTransition(roleKey, status, spec)));
        });

        Map<Role, RoleCapabilities> caps = new EnumMap<>(Role.class);
        if (capabilities != null) {
            capabilities.forEach((roleKey, spec) -> caps.put(role(roleKey, "capabilities"),
                    new RoleCapabilities(
                            spec.mandatory() == null ? null : new HashSet<>(spec.mandatory()),
                            spec.optional() == null ? null : new HashSet<>(spec.optional()))));
        }

        WorkflowLimits workflowLimits;
        try {
            workflowLimits = new WorkflowLimits(limits.maxIterations(), limits.hardIterationCap());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("invalid workflow limits: " + e.getMessage(), e);
        }
        return new WorkflowSnapshot(version, table.build(), caps, workflowLimits);
    }

    private static Transition toTransition(String roleKey, String status, TransitionSpec spec) {
        String where = roleKey + " + " + status;
        if (spec == null || spec.nextRole() == null || spec.action() == null) {
            throw new IllegalStateException("transition " + where + " needs nextRole and action");
        }
        Role next = role(spec.nextRole(), "transition " + where);
        TransitionAction action = constant(TransitionAction.class, spec.action(), where);
        GroupStatus groupStatus = spec.groupStatus() == null
                ? null
                : constant(GroupStatus.class, spec.groupStatus(), where);
        return new Transition(next, action, groupStatus, spec.includeContext(),
                spec.escalationCheck(), spec.bypassQualityCheck());
    }

    private static Role role(String key, String where) {
        return Role.fromKey(key).orElseThrow(() ->
                new IllegalStateException("unknown role '" + key + "' in " + where));
    }

    private static <E extends Enum<E>> E constant(Class<E> type, String value, String where) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("unknown %s '%s' in transition %s"
                    .formatted(type.getSimpleName(), value, where), e);
        }
    }
}
