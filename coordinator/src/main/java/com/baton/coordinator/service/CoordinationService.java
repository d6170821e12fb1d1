package com.baton.coordinator.service;

import com.baton.coordinator.config.SessionWorkflows;
import com.baton.coordinator.engine.*;
import com.baton.coordinator.event.*;
import com.baton.coordinator.ledger.IssueDraft;
import com.baton.coordinator.ledger.IssueLedger;
import com.baton.coordinator.ledger.IssueRecord;
import com.baton.coordinator.ledger.ReviewRecord;
import com.baton.coordinator.model.*;
import com.baton.coordinator.progress.EscalationLevel;
import com.baton.coordinator.progress.ProgressEvaluation;
import com.baton.coordinator.progress.ProgressInput;
import com.baton.coordinator.progress.ProgressTracker;
import com.baton.coordinator.store.*;
import com.baton.coordinator.validator.ValidationReport;
import com.baton.coordinator.validator.ValidatorGate;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.*;
import java.util.function.Supplier;

/**
 * Business logic for the coordination lifecycle.
 *
 * Every operation that changes a group runs as one unit of work under the
 * session's write guard: the status report, the events it causes and the
 * group update commit together or not at all.
 *
 * Late reports are dropped as stale (logged, nothing written) when the
 * session is closed, the group is terminal, or the group is escalated and
 * the report comes from a role other than the one now holding it. The
 * manager may always act on a non-terminal group.
 *
 * Metrics:
 * <pre>
 *   baton.transitions{role, action, result="routed|fail_closed"}
 *   baton.escalations{from, to}
 * </pre>
 */
@Service
public class CoordinationService {

    private static final Logger log = LoggerFactory.getLogger(CoordinationService.class);

    // Capability every review pass carries by construction.
    static final String REVIEW_CAPABILITY = "issue_list";

    static final String TIMEOUT_STATUS = "TIMEOUT";

    private static final Set<String> REVIEW_OUTCOMES = Set.of(GroupStatus.APPROVED.name(),
            GroupStatus.APPROVED_WITH_NOTES.name(), GroupStatus.CHANGES_REQUIRED.name());

    private final CoordinationStore store;
    private final IssueLedger       ledger;
    private final TransitionEngine  engine;
    private final ProgressTracker   tracker;
    private final ValidatorGate     gate;
    private final SessionWorkflows  workflows;
    private final EventPayloadCodec codec;
    private final SessionWriteGuard guard;
    private final MeterRegistry     meterRegistry;

    public CoordinationService(CoordinationStore store,
                               IssueLedger ledger,
                               TransitionEngine engine,
                               ProgressTracker tracker,
                               ValidatorGate gate,
                               SessionWorkflows workflows,
                               EventPayloadCodec codec,
                               SessionWriteGuard guard,
                               MeterRegistry meterRegistry) {
        this.store         = store;
        this.ledger        = ledger;
        this.engine        = engine;
        this.tracker       = tracker;
        this.gate          = gate;
        this.workflows     = workflows;
        this.codec         = codec;
        this.guard         = guard;
        this.meterRegistry = meterRegistry;
    }

    // ------------------------------------------------------------------
    // Sessions and groups
    // ------------------------------------------------------------------

    /**
     * Create a session and freeze the current workflow configuration into it.
     * If the configuration cannot be loaded the session is not created.
     */
    public Session createSession(String sessionId, List<ScopeItem> scope,
                                 ExecutionMode executionMode, TestingMode testingMode) {
        Identifiers.sessionId(sessionId);
        return withContext(sessionId, null, null, () -> guard.inTransaction(sessionId, () -> {
            Session session = store.createSession(sessionId, scope, executionMode, testingMode);
            WorkflowSnapshot workflow = workflows.snapshotFor(sessionId);
            log.info("Session {} uses workflow config v{} ({} transitions, limits {})", sessionId,
                    workflow.version(), workflow.transitions().size(), workflow.limits());
            return session;
        }));
    }

    public Session getSession(String sessionId) {
        return store.requireSession(sessionId);
    }

    /**
     * Create or update a task group. Scope item ids must name items of the
     * session's original scope.
     */
    public TaskGroup upsertTaskGroup(String sessionId, TaskGroupUpdate update) {
        Identifiers.sessionId(sessionId);
        return guard.inTransaction(sessionId, () -> {
            Session session = store.requireSession(sessionId);
            if (update != null && update.scopeItemIds() != null) {
                Set<String> known = new HashSet<>();
                session.getOriginalScope().forEach(item -> known.add(item.id()));
                for (String id : update.scopeItemIds()) {
                    if (!known.contains(id)) {
                        throw CoordinationException.validation("scope item " + id + " is not part of session " + sessionId);
                    }
                }
            }
            return store.upsertTaskGroup(sessionId, update);
        });
    }

    public TaskGroup getTaskGroup(String sessionId, String groupId) {
        return store.requireTaskGroup(sessionId, groupId);
    }

    public List<TaskGroup> listTaskGroups(String sessionId) {
        store.requireSession(sessionId);
        return store.listTaskGroups(sessionId);
    }

    /**
     * Hand pending groups to the implementer, as many as the session's
     * execution mode allows: one group at a time in single-track mode,
     * {@code maxParallel} groups in flight in multi-track mode.
     *
     * @return outcomes for the groups started by this call
     */
    public List<TransitionOutcome> startPendingGroups(String sessionId, int maxParallel) {
        Identifiers.sessionId(sessionId);
        if (maxParallel < 1) {
            throw CoordinationException.validation("max_parallel must be at least 1, was " + maxParallel);
        }
        return withContext(sessionId, null, Role.MANAGER, () -> guard.inTransaction(sessionId, () -> {
            Session session = store.requireSession(sessionId);
            List<TaskGroup> groups = store.listTaskGroups(sessionId);
            long inFlight = groups.stream()
                    .map(TaskGroup::getStatus)
                    .filter(s -> s != GroupStatus.PENDING && !s.isTerminal() && !s.isSignedOff())
                    .count();
            int limit = session.getExecutionMode() == ExecutionMode.SINGLE_TRACK ? 1 : maxParallel;

            List<TransitionOutcome> started = new ArrayList<>();
            for (TaskGroup group : groups) {
                if (inFlight + started.size() >= limit) {
                    break;
                }
                if (group.getStatus() == GroupStatus.PENDING) {
                    started.add(applyReport(new StatusReport(sessionId, group.getGroupId(), Role.MANAGER,
                            "PLANNING_COMPLETE", Set.of(), "start:" + sessionId + ":" + group.getGroupId())));
                }
            }
            log.info("Started {} pending group(s) in session {} ({} already in flight, limit {})",
                    started.size(), sessionId, inFlight, limit);
            return started;
        }));
    }

    // ------------------------------------------------------------------
    // Status reports
    // ------------------------------------------------------------------

    /**
     * Route a role's status report through the session's transition table and
     * apply the decision to the group.
     *
     * A report without a dedup key gets one derived from the group's
     * transition count, so only callers that pass their own key are protected
     * against applying a retried report twice.
     */
    public TransitionOutcome reportStatus(StatusReport report) {
        if (report == null || report.role() == null) {
            throw CoordinationException.validation("role is required");
        }
        Identifiers.sessionId(report.sessionId());
        Identifiers.groupId(report.groupId());
        Identifiers.statusCode(report.statusCode());
        if (report.dedupKey() != null) {
            Identifiers.dedupKey(report.dedupKey());
        }
        return withContext(report.sessionId(), report.groupId(), report.role(),
                () -> guard.inTransaction(report.sessionId(), () -> applyReport(report)));
    }

    private TransitionOutcome applyReport(StatusReport report) {
        String sessionId  = report.sessionId();
        String groupId    = report.groupId();
        Role   role       = report.role();
        String reported   = report.statusCode().toUpperCase(Locale.ROOT);

        Session   session = store.requireSession(sessionId);
        TaskGroup group   = store.requireTaskGroup(sessionId, groupId);
        String key = report.dedupKey() != null
                ? report.dedupKey()
                : "transition:%s:%s:%d:%s:%s".formatted(sessionId, groupId,
                        transitionsOf(sessionId, groupId).size(), role.key(), reported);

        Optional<RoutingDecision> replayed = replay(sessionId, key);
        if (replayed.isPresent()) {
            return new TransitionOutcome(replayed.get(), group, true);
        }
        Optional<RoutingDecision> stale = staleDecision(session, group, role);
        if (stale.isPresent()) {
            return new TransitionOutcome(stale.get(), group, false);
        }

        String statusCode = role.reviews() && REVIEW_OUTCOMES.contains(reported)
                ? outcomeFromLedger(group, role, reported)
                : reported;

        WorkflowSnapshot workflow = workflows.forSession(sessionId);
        List<String> missing = workflow.capabilitiesOf(role).missingFrom(report.capabilities());
        if (!missing.isEmpty()) {
            store.appendEvent(sessionId, groupId, new RoleViolation(role, statusCode, missing),
                    "violation:" + Digests.sha256Hex(key));
            log.warn("{} reported {} on group {} without mandatory capabilities {}",
                    role.key(), statusCode, groupId, missing);
        }

        EscalationLevel level = escalationLevel(workflow, group);
        RoutingDecision decision = engine.route(workflow, new RoutingRequest(role, statusCode,
                group.isSecuritySensitive(), session.getTestingMode(), level, report.capabilities()));
        return new TransitionOutcome(apply(group, role, statusCode, level, decision, key), group, false);
    }

    /**
     * A review outcome reported as a plain status is replaced by the one the
     * issue ledger gives, so open blocking issues always mean changes required.
     */
    private String outcomeFromLedger(TaskGroup group, Role role, String reported) {
        String sessionId = group.getSessionId();
        String groupId   = group.getGroupId();
        if (!ledger.hasHistory(sessionId, groupId)) {
            throw CoordinationException.validation("group %s has no recorded review; submit %s through record-review"
                    .formatted(groupId, reported));
        }
        List<IssueRecord> current = ledger.issues(sessionId, groupId);
        int blocking    = (int) current.stream().filter(IssueRecord::unresolvedBlocking).count();
        int nonBlocking = (int) current.stream().filter(i -> !i.blocking()).count();
        group.setBlockingIssuesCount(blocking);

        String outcome = TransitionEngine.reviewOutcome(blocking, nonBlocking).name();
        if (!outcome.equals(reported)) {
            log.warn("{} reported {} on group {} with {} unresolved blocking issue(s), routing as {}",
                    role.key(), reported, groupId, blocking, outcome);
        }
        return outcome;
    }

    // ------------------------------------------------------------------
    // Review passes and issue handling
    // ------------------------------------------------------------------

    /**
     * Record a review pass and route the group by its outcome.
     *
     * {@code iteration} must be the group's review iteration plus one. Sending
     * the current iteration again returns the stored result.
     */
    public ReviewOutcome recordReview(String sessionId, String groupId, Role role,
                                      int iteration, List<IssueDraft> issues) {
        Identifiers.sessionId(sessionId);
        Identifiers.groupId(groupId);
        if (role == null || !role.reviews()) {
            throw CoordinationException.validation("only a reviewer or lead reviewer can submit a review, not " + role);
        }
        return withContext(sessionId, groupId, role, () -> guard.inTransaction(sessionId, () -> {
            Session   session = store.requireSession(sessionId);
            TaskGroup group   = store.requireTaskGroup(sessionId, groupId);
            String    key     = "review:%s:%s:%d".formatted(sessionId, groupId, iteration);

            if (iteration >= 1 && iteration == group.getReviewIteration()) {
                Optional<RoutingDecision> replayed = replay(sessionId, key);
                if (replayed.isPresent()) {
                    ReviewRecord stored = ledger.recordReview(sessionId, groupId, iteration, issues);
                    return new ReviewOutcome(stored, null, replayed.get(), group, true);
                }
            }
            Optional<RoutingDecision> stale = staleDecision(session, group, role);
            if (stale.isPresent()) {
                return new ReviewOutcome(null, null, stale.get(), group, false);
            }
            if (iteration != group.getReviewIteration() + 1) {
                throw CoordinationException.validation("review iteration %d does not follow %d for group %s"
                        .formatted(iteration, group.getReviewIteration(), groupId));
            }

            WorkflowSnapshot workflow = workflows.forSession(sessionId);
            ReviewRecord record = ledger.recordReview(sessionId, groupId, iteration, issues);
            ProgressEvaluation progress = tracker.evaluate(new ProgressInput(group.getReviewIteration(),
                    group.getBlockingIssuesCount(), record.blockingCount(), group.getNoProgressCount()),
                    workflow.limits());

            group.setReviewIteration(iteration);
            group.setBlockingIssuesCount(record.blockingCount());
            group.setNoProgressCount(progress.streak());

            String outcome = TransitionEngine.reviewOutcome(record.blockingCount(), record.nonBlockingCount()).name();
            RoutingDecision decision = engine.route(workflow, new RoutingRequest(role, outcome,
                    group.isSecuritySensitive(), session.getTestingMode(), progress.level(),
                    Set.of(REVIEW_CAPABILITY)));
            log.info("Review {} of group {}: {} blocking, {} non-blocking, streak {} ({})", iteration, groupId,
                    record.blockingCount(), record.nonBlockingCount(), progress.streak(), progress.level());
            return new ReviewOutcome(record, progress,
                    apply(group, role, outcome, progress.level(), decision, key), group, false);
        }));
    }

    /** Record the implementer's responses to the latest issue list. */
    public List<IssueRecord> recordResponses(String sessionId, String groupId, IssueResponses responses) {
        Identifiers.sessionId(sessionId);
        Identifiers.groupId(groupId);
        return withContext(sessionId, groupId, Role.IMPLEMENTER, () -> guard.inTransaction(sessionId, () -> {
            Session   session = store.requireSession(sessionId);
            TaskGroup group   = store.requireTaskGroup(sessionId, groupId);
            if (staleDecision(session, group, Role.IMPLEMENTER).isEmpty()) {
                AppendResult result = ledger.recordResponses(sessionId, groupId, responses);
                if (!result.duplicate()) {
                    log.info("Recorded {} response(s) for iteration {} of group {}",
                            responses.responses().size(), responses.iteration(), groupId);
                }
            }
            return ledger.issues(sessionId, groupId);
        }));
    }

    /**
     * Record the reviewer's verdicts on rejected issues. Verdicts on the
     * latest iteration refresh the group's blocking count, and a group whose
     * last blocking issue was cleared this way is signed off.
     */
    public VerdictOutcome recordVerdicts(String sessionId, String groupId, Role role, ReviewVerdicts verdicts) {
        Identifiers.sessionId(sessionId);
        Identifiers.groupId(groupId);
        if (role == null || !role.reviews()) {
            throw CoordinationException.validation("only a reviewer or lead reviewer can rule on rejections, not " + role);
        }
        return withContext(sessionId, groupId, role, () -> guard.inTransaction(sessionId, () -> {
            Session   session = store.requireSession(sessionId);
            TaskGroup group   = store.requireTaskGroup(sessionId, groupId);
            Optional<RoutingDecision> stale = staleDecision(session, group, role);
            if (stale.isPresent()) {
                return new VerdictOutcome(List.of(), group, stale.get());
            }

            List<String> accepted = ledger.recordVerdicts(sessionId, groupId, verdicts);
            if (verdicts.iteration() != group.getReviewIteration()) {
                return new VerdictOutcome(accepted, group, null);
            }

            List<IssueRecord> current = ledger.issues(sessionId, groupId);
            int blocking    = (int) current.stream().filter(IssueRecord::unresolvedBlocking).count();
            int nonBlocking = (int) current.stream().filter(i -> !i.blocking()).count();
            group.setBlockingIssuesCount(blocking);

            RoutingDecision decision = null;
            if (blocking == 0 && group.getStatus() == GroupStatus.CHANGES_REQUIRED) {
                String outcome = TransitionEngine.reviewOutcome(0, nonBlocking).name();
                WorkflowSnapshot workflow = workflows.forSession(sessionId);
                decision = engine.route(workflow, new RoutingRequest(role, outcome, group.isSecuritySensitive(),
                        session.getTestingMode(), EscalationLevel.NONE, Set.of(REVIEW_CAPABILITY)));
                decision = apply(group, role, outcome, EscalationLevel.NONE, decision,
                        "signoff:%s:%s:%d".formatted(sessionId, groupId, verdicts.iteration()));
            } else {
                store.saveGroup(group);
            }
            return new VerdictOutcome(accepted, group, decision);
        }));
    }

    public List<IssueRecord> issues(String sessionId, String groupId) {
        store.requireTaskGroup(sessionId, groupId);
        return ledger.issues(sessionId, groupId);
    }

    /** Unresolved blocking issues of one group, or of the whole session when {@code groupId} is null. */
    public List<IssueRecord> unresolvedBlocking(String sessionId, String groupId) {
        if (groupId == null) {
            store.requireSession(sessionId);
            return ledger.unresolvedBlocking(sessionId);
        }
        store.requireTaskGroup(sessionId, groupId);
        return ledger.unresolvedBlocking(sessionId, groupId);
    }

    // ------------------------------------------------------------------
    // Timeouts
    // ------------------------------------------------------------------

    /**
     * Record a missed deadline as a pass without progress and act on it.
     * Before the first review there is no baseline, so a timeout only
     * respawns the role.
     */
    public TransitionOutcome recordTimeout(String sessionId, String groupId, Role role,
                                           Instant deadline, String reason) {
        Identifiers.sessionId(sessionId);
        Identifiers.groupId(groupId);
        if (role == null || deadline == null) {
            throw CoordinationException.validation("role and deadline are required");
        }
        return withContext(sessionId, groupId, role, () -> guard.inTransaction(sessionId, () -> {
            Session   session = store.requireSession(sessionId);
            TaskGroup group   = store.requireTaskGroup(sessionId, groupId);
            String    key     = "timeout:%s:%s:%s:%d".formatted(sessionId, groupId, role.key(), deadline.toEpochMilli());

            Optional<RoutingDecision> replayed = replay(sessionId, key + ":route");
            if (replayed.isPresent()) {
                return new TransitionOutcome(replayed.get(), group, true);
            }
            Optional<RoutingDecision> stale = staleDecision(session, group, role);
            if (stale.isPresent()) {
                return new TransitionOutcome(stale.get(), group, false);
            }

            store.appendEvent(sessionId, groupId, new NoProgress(role, deadline,
                    reason == null || reason.isBlank() ? "deadline missed" : reason), key);

            WorkflowLimits limits = workflows.forSession(sessionId).limits();
            ProgressEvaluation pass = tracker.evaluate(new ProgressInput(group.getReviewIteration(),
                    group.getBlockingIssuesCount(), group.getBlockingIssuesCount(), group.getNoProgressCount()), limits);
            group.setNoProgressCount(pass.streak());
            EscalationLevel level = tracker.assess(group.getReviewIteration(), pass.streak(), limits);

            log.warn("{} missed its deadline on group {} (streak {}, {})", role.key(), groupId, pass.streak(), level);
            RoutingDecision decision = engine.routeTimeout(role, level);
            return new TransitionOutcome(apply(group, role, TIMEOUT_STATUS, level, decision, key + ":route"),
                    group, false);
        }));
    }

    // ------------------------------------------------------------------
    // Scope and completion
    // ------------------------------------------------------------------

    /** Record an approved removal of original scope items. */
    public AppendResult declareScopeChange(String sessionId, ScopeChange change, String dedupKey) {
        Identifiers.sessionId(sessionId);
        if (change == null) {
            throw CoordinationException.validation("scope change is required");
        }
        change.validate();
        if (dedupKey != null) {
            Identifiers.dedupKey(dedupKey);
        }
        return withContext(sessionId, null, Role.MANAGER, () -> guard.inTransaction(sessionId, () -> {
            Session session = store.requireSession(sessionId);
            Set<String> known = new HashSet<>();
            session.getOriginalScope().forEach(item -> known.add(item.id()));
            for (String id : change.removedItemIds()) {
                if (!known.contains(id)) {
                    throw CoordinationException.validation("scope item " + id + " is not part of session " + sessionId);
                }
            }
            String key = dedupKey != null ? dedupKey : "scope:" + sessionId + ":" + Digests.sha256Hex(change.toString());
            AppendResult result = store.appendEvent(sessionId, null, change, key);
            if (!result.duplicate()) {
                log.info("Scope of session {} reduced by {} (approved by {})",
                        sessionId, change.removedItemIds(), change.approvedBy());
            }
            return result;
        }));
    }

    /** The manager claims the session is done; the validator gate decides. */
    public ValidationReport declareCompletion(String sessionId, String summary) {
        Identifiers.sessionId(sessionId);
        return withContext(sessionId, null, Role.MANAGER, () -> guard.inTransaction(sessionId, () -> {
            Session session = store.requireSession(sessionId);
            if (!session.isClosed()) {
                int declared = store.findEvents(sessionId,
                        new EventQuery(null, EventType.COMPLETION_DECLARED, null, null)).size();
                store.appendEvent(sessionId, null, new CompletionDeclared(Role.MANAGER, summary),
                        "completion:" + sessionId + ":" + (declared + 1));
            }
            return gate.validate(sessionId);
        }));
    }

    public ValidationReport validateCompletion(String sessionId) {
        Identifiers.sessionId(sessionId);
        return withContext(sessionId, null, null, () -> gate.validate(sessionId));
    }

    // ------------------------------------------------------------------
    // Generic event and state access
    // ------------------------------------------------------------------

    /**
     * Append an event supplied as JSON. Only audit entries and scope changes
     * can be written this way; every other type has a dedicated operation that
     * keeps the group counters in step with the events.
     */
    public AppendResult appendEvent(String sessionId, String groupId, EventType type,
                                    JsonNode payload, String dedupKey) {
        EventPayload parsed = codec.fromJson(type, payload);
        return switch (type) {
            case SCOPE_CHANGE -> declareScopeChange(sessionId, (ScopeChange) parsed, dedupKey);
            case AUDIT -> {
                Identifiers.dedupKey(dedupKey);
                yield store.appendEvent(sessionId, groupId, parsed, dedupKey);
            }
            default -> throw CoordinationException.validation(
                    type + " events are written by " + ownerOf(type) + ", not appended directly");
        };
    }

    public List<Event> findEvents(String sessionId, EventQuery query) {
        store.requireSession(sessionId);
        return store.findEvents(sessionId, query);
    }

    /** Replace a state snapshot. The workflow configuration snapshot is read-only. */
    public StateSnapshot upsertState(String sessionId, String scope, String stateType, String payloadJson) {
        if (SessionWorkflows.STATE_TYPE.equals(stateType)) {
            throw CoordinationException.validation(stateType + " is fixed at session creation and cannot be replaced");
        }
        return store.upsertState(sessionId, scope, stateType, payloadJson);
    }

    public Optional<StateSnapshot> getState(String sessionId, String scope, String stateType) {
        return store.getState(sessionId, scope, stateType);
    }

    // ------------------------------------------------------------------
    // Internal helpers
    // ------------------------------------------------------------------

    private RoutingDecision apply(TaskGroup group, Role role, String statusCode,
                                  EscalationLevel level, RoutingDecision decision, String key) {
        String sessionId = group.getSessionId();
        String groupId   = group.getGroupId();

        boolean trackerEscalation = level == EscalationLevel.ESCALATE || level == EscalationLevel.HARD_CAP;
        if (decision.escalated() && trackerEscalation && !ledger.hasHistory(sessionId, groupId)) {
            log.warn("[{}] group {} escalated without any issue history, using the default escalation route",
                    CoordinationException.Kind.STATE_INCONSISTENCY, groupId);
            store.appendEvent(sessionId, groupId, new AuditEntry(
                    "escalation on a group with no issue history",
                    Map.of("kind", CoordinationException.Kind.STATE_INCONSISTENCY.name(),
                           "groupId", groupId,
                           "escalatedTo", decision.nextRole().key())),
                    "inconsistent:" + Digests.sha256Hex(key));
        }

        if (decision.groupStatus() != null) {
            group.setStatus(decision.groupStatus());
        }
        group.setAssignedRole(decision.nextRole());
        if (decision.escalated() && decision.groupStatus() == GroupStatus.ESCALATED) {
            // The next tier starts with a clean streak; the hard cap still bounds the group.
            group.setNoProgressCount(0);
        }
        store.saveGroup(group);
        store.appendEvent(sessionId, groupId,
                new TransitionRecorded(role, statusCode, group.getReviewIteration(), decision), key);

        meterRegistry.counter("baton.transitions",
                "role", role.key(),
                "action", decision.action().name().toLowerCase(Locale.ROOT),
                "result", decision.failClosed() ? "fail_closed" : "routed").increment();
        if (decision.escalated()) {
            meterRegistry.counter("baton.escalations",
                    "from", role.key(), "to", decision.nextRole().key()).increment();
        }
        log.info("Group {}: {} {} -> {} {} (status {}){}", groupId, role.key(), statusCode,
                decision.action(), decision.nextRole().key(), group.getStatus(),
                decision.notes().isEmpty() ? "" : " " + decision.notes());
        return decision;
    }

    private EscalationLevel escalationLevel(WorkflowSnapshot workflow, TaskGroup group) {
        WorkflowLimits limits = workflow.limits();
        EscalationLevel level = tracker.assess(group.getReviewIteration(), group.getNoProgressCount(), limits);
        long respawns = transitionsOf(group.getSessionId(), group.getGroupId()).stream()
                .filter(t -> t.decision().action() == TransitionAction.RESPAWN)
                .count();
        if (respawns >= limits.hardIterationCap()) {
            // Loops that never reach a review (e.g. repeated quality-check failures) are capped too.
            return EscalationLevel.HARD_CAP;
        }
        return level;
    }

    private List<TransitionRecorded> transitionsOf(String sessionId, String groupId) {
        return codec.decodeAll(store.findEvents(sessionId, EventQuery.of(groupId, EventType.TRANSITION)),
                TransitionRecorded.class);
    }

    private Optional<RoutingDecision> replay(String sessionId, String key) {
        Optional<Event> existing = store.findByDedupKey(key);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        Event event = existing.get();
        if (!event.getSessionId().equals(sessionId) || event.getEventType() != EventType.TRANSITION) {
            throw new CoordinationException(CoordinationException.Kind.CONFLICT,
                    "dedup_key " + key + " is already used by another event");
        }
        log.debug("Report {} already applied, returning the stored decision", key);
        return Optional.of(codec.decode(event, TransitionRecorded.class).decision());
    }

    private Optional<RoutingDecision> staleDecision(Session session, TaskGroup group, Role role) {
        String reason = null;
        if (session.isClosed()) {
            reason = "session " + session.getId() + " is closed";
        } else if (group.getStatus().isTerminal()) {
            reason = "group " + group.getGroupId() + " is " + group.getStatus();
        } else if (group.getStatus() == GroupStatus.ESCALATED
                && role != group.getAssignedRole() && role != Role.MANAGER) {
            reason = "group " + group.getGroupId() + " was escalated to " + group.getAssignedRole().key();
        }
        if (reason == null) {
            return Optional.empty();
        }
        log.info("Dropped stale report from {}: {}", role.key(), reason);
        return Optional.of(RoutingDecision.stale(group.getAssignedRole(), reason));
    }

    private static String ownerOf(EventType type) {
        return switch (type) {
            case ISSUES_RAISED       -> "record-review";
            case ISSUE_RESPONSES     -> "record-responses";
            case REVIEW_VERDICTS     -> "record-verdicts";
            case NO_PROGRESS         -> "record-timeout";
            case COMPLETION_DECLARED, VALIDATOR_VERDICT -> "validate-completion";
            case TRANSITION, ROLE_VIOLATION -> "report-status";
            case SCOPE_CHANGE        -> "declare-scope-change";
            case AUDIT               -> "append-event";
        };
    }

    private static <T> T withContext(String sessionId, String groupId, Role role, Supplier<T> work) {
        // Every log line of this call carries the session, group and role, in text and JSON output.
        MDC.put("sessionId", sessionId);
        if (groupId != null) MDC.put("groupId", groupId);
        if (role != null)    MDC.put("role", role.key());
        try {
            return work.get();
        } finally {
            MDC.remove("sessionId");
            MDC.remove("groupId");
            MDC.remove("role");
        }
    }
}
