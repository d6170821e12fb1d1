package com.baton.coordinator.engine;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;
import com.baton.coordinator.progress.EscalationLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic routing: (current role, status code) → next action.
 *
 * Pure function of the session's {@link WorkflowSnapshot} and one
 * {@link RoutingRequest}; no I/O, no clock, no shared state. The rules are
 * applied in a fixed order:
 * <ol>
 *   <li>Missing mandatory capabilities fail closed to the manager.</li>
 *   <li>Table lookup; an unknown status fails closed to the manager.</li>
 *   <li>Security-sensitive groups never bypass the quality checker.</li>
 *   <li>Testing modes MINIMAL/DISABLED skip the quality checker.</li>
 *   <li>Transitions flagged with an escalation check honour the progress
 *       tracker: warning, escalation to the next tier, or the hard cap.</li>
 * </ol>
 */
@Component
public class TransitionEngine {

    public RoutingDecision route(WorkflowSnapshot workflow, RoutingRequest request) {
        Role current = request.currentRole();

        List<String> missing = workflow.capabilitiesOf(current).missingFrom(request.capabilities());
        if (!missing.isEmpty()) {
            return RoutingDecision.failClosed(
                    "%s reported %s without mandatory capabilities %s"
                            .formatted(current.key(), request.statusCode(), missing));
        }

        Optional<Transition> found = workflow.transitions().lookup(current, request.statusCode());
        if (found.isEmpty()) {
            return RoutingDecision.failClosed(
                    "unknown status '%s' from %s, routed to manager".formatted(request.statusCode(), current.key()));
        }
        Transition transition = found.get();

        Role             next      = transition.nextRole();
        TransitionAction action    = transition.action();
        GroupStatus      status    = transition.groupStatus();
        boolean          escalated = false;
        List<String>     notes     = new ArrayList<>();

        if (request.securitySensitive() && transition.bypassQualityCheck()) {
            next   = Role.QUALITY_CHECKER;
            action = TransitionAction.ROUTE;
            status = GroupStatus.READY_FOR_REVIEW;
            notes.add("security-sensitive group: quality check enforced");
        }

        if (next == Role.QUALITY_CHECKER && request.testingMode().skipsQualityCheck()
                && !request.securitySensitive()) {
            next   = Role.REVIEWER;
            status = GroupStatus.UNDER_REVIEW;
            notes.add("quality check skipped (testing mode " + request.testingMode() + ")");
        }

        if (transition.escalationCheck()) {
            switch (request.escalationLevel()) {
                case HARD_CAP -> {
                    next      = Role.MANAGER;
                    action    = TransitionAction.TERMINATE;
                    status    = GroupStatus.REJECTED;
                    escalated = true;
                    notes.add("hard iteration cap reached, group stopped");
                }
                case ESCALATE -> {
                    Optional<Role> target = escalationTarget(current, next);
                    escalated = true;
                    if (target.isPresent()) {
                        next   = target.get();
                        action = TransitionAction.ROUTE;
                        status = GroupStatus.ESCALATED;
                        notes.add("no progress for too many passes, escalated to " + next.key());
                    } else {
                        next   = Role.MANAGER;
                        action = TransitionAction.TERMINATE;
                        status = GroupStatus.REJECTED;
                        notes.add("no progress and no higher tier left, group stopped");
                    }
                }
                case WARNING -> notes.add("one more pass without progress escalates this group");
                case NONE -> { }
            }
        }

        return new RoutingDecision(next, action, status, transition.includeContext(),
                escalated, false, false, notes);
    }

    /**
     * Routing for a role that missed its deadline. There is no status code to
     * look up: the role is respawned, or escalated when the synthetic
     * no-progress pass pushed the group over a limit.
     */
    public RoutingDecision routeTimeout(Role role, EscalationLevel level) {
        return switch (level) {
            case HARD_CAP -> new RoutingDecision(Role.MANAGER, TransitionAction.TERMINATE, GroupStatus.REJECTED,
                    List.of(), true, false, false, List.of("deadline missed at the hard iteration cap, group stopped"));
            case ESCALATE -> role.escalationTarget()
                    .map(target -> new RoutingDecision(target, TransitionAction.ROUTE, GroupStatus.ESCALATED,
                            List.of(), true, false, false,
                            List.of(role.key() + " kept missing its deadline, escalated to " + target.key())))
                    .orElseGet(() -> new RoutingDecision(Role.MANAGER, TransitionAction.TERMINATE, GroupStatus.REJECTED,
                            List.of(), true, false, false, List.of("manager missed its deadline, group stopped")));
            case WARNING, NONE -> new RoutingDecision(role, TransitionAction.RESPAWN, null,
                    List.of(), false, false, false, List.of("deadline missed, " + role.key() + " respawned"));
        };
    }

    /**
     * Review decision rule: any blocking issue means changes are required,
     * otherwise notes alone still approve.
     */
    public static GroupStatus reviewOutcome(int blockingCount, int nonBlockingCount) {
        if (blockingCount > 0) {
            return GroupStatus.CHANGES_REQUIRED;
        }
        if (nonBlockingCount > 0) {
            return GroupStatus.APPROVED_WITH_NOTES;
        }
        return GroupStatus.APPROVED;
    }

    /**
     * The tier above the role that would have received the group. Never the
     * reporting role itself: a lead reviewer that keeps sending work back is
     * escalated past, to the manager.
     */
    static Optional<Role> escalationTarget(Role current, Role next) {
        Optional<Role> target = next.escalationTarget();
        if (target.isPresent() && target.get() != current) {
            return target;
        }
        return current.escalationTarget().filter(r -> r != current);
    }
}
