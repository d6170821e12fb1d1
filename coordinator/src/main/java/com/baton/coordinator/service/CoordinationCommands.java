package com.baton.coordinator.service;

import com.baton.coordinator.event.IssueResponses;
import com.baton.coordinator.event.ReviewVerdicts;
import com.baton.coordinator.event.ScopeChange;
import com.baton.coordinator.ledger.IssueDraft;
import com.baton.coordinator.ledger.IssueRecord;
import com.baton.coordinator.model.*;
import com.baton.coordinator.store.AppendResult;
import com.baton.coordinator.store.CoordinationException;
import com.baton.coordinator.store.EventQuery;
import com.baton.coordinator.store.TaskGroupUpdate;
import com.baton.coordinator.validator.ValidationReport;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The command surface: one method per command, each returning a
 * {@link CommandResult} instead of throwing.
 *
 * Error mapping:
 *   CoordinationException           -> its kind (STATE_INCONSISTENCY reported as INTERNAL_ERROR)
 *   DataIntegrityViolationException -> CONFLICT (a concurrent writer got there first)
 *   any other failure               -> INTERNAL_ERROR, logged with its stack trace
 */
@Component
public class CoordinationCommands {

    private static final Logger log = LoggerFactory.getLogger(CoordinationCommands.class);

    private final CoordinationService service;

    public CoordinationCommands(CoordinationService service) {
        this.service = service;
    }

    // ------------------------------------------------------------------
    // Store commands
    // ------------------------------------------------------------------

    public CommandResult<Session> createSession(String sessionId, List<ScopeItem> scope,
                                                ExecutionMode executionMode, TestingMode testingMode) {
        return run("create-session", () -> service.createSession(sessionId, scope, executionMode, testingMode));
    }

    public CommandResult<Session> getSession(String sessionId) {
        return run("get-session", () -> service.getSession(sessionId));
    }

    public CommandResult<TaskGroup> upsertTaskGroup(String sessionId, TaskGroupUpdate update) {
        return run("create-or-update-task-group", () -> service.upsertTaskGroup(sessionId, update));
    }

    public CommandResult<TaskGroup> getTaskGroup(String sessionId, String groupId) {
        return run("get-task-group", () -> service.getTaskGroup(sessionId, groupId));
    }

    public CommandResult<List<TaskGroup>> listTaskGroups(String sessionId) {
        return run("list-task-groups", () -> service.listTaskGroups(sessionId));
    }

    public CommandResult<AppendResult> appendEvent(String sessionId, String groupId, EventType type,
                                                   JsonNode payload, String dedupKey) {
        return run("append-event", () -> service.appendEvent(sessionId, groupId, type, payload, dedupKey));
    }

    public CommandResult<List<Event>> getEvents(String sessionId, EventQuery query) {
        return run("get-events", () -> service.findEvents(sessionId, query));
    }

    public CommandResult<StateSnapshot> upsertState(String sessionId, String scope, String stateType,
                                                    String payloadJson) {
        return run("upsert-state", () -> service.upsertState(sessionId, scope, stateType, payloadJson));
    }

    public CommandResult<Optional<StateSnapshot>> getState(String sessionId, String scope, String stateType) {
        return run("get-state", () -> service.getState(sessionId, scope, stateType));
    }

    // ------------------------------------------------------------------
    // Workflow commands
    // ------------------------------------------------------------------

    public CommandResult<TransitionOutcome> reportStatus(StatusReport report) {
        return run("report-status", () -> service.reportStatus(report));
    }

    public CommandResult<List<TransitionOutcome>> startPendingGroups(String sessionId, int maxParallel) {
        return run("start-pending-groups", () -> service.startPendingGroups(sessionId, maxParallel));
    }

    public CommandResult<ReviewOutcome> recordReview(String sessionId, String groupId, Role role,
                                                     int iteration, List<IssueDraft> issues) {
        return run("record-review", () -> service.recordReview(sessionId, groupId, role, iteration, issues));
    }

    public CommandResult<List<IssueRecord>> recordResponses(String sessionId, String groupId,
                                                            IssueResponses responses) {
        return run("record-responses", () -> service.recordResponses(sessionId, groupId, responses));
    }

    public CommandResult<VerdictOutcome> recordVerdicts(String sessionId, String groupId, Role role,
                                                        ReviewVerdicts verdicts) {
        return run("record-verdicts", () -> service.recordVerdicts(sessionId, groupId, role, verdicts));
    }

    public CommandResult<TransitionOutcome> recordTimeout(String sessionId, String groupId, Role role,
                                                          Instant deadline, String reason) {
        return run("record-timeout", () -> service.recordTimeout(sessionId, groupId, role, deadline, reason));
    }

    public CommandResult<List<IssueRecord>> issues(String sessionId, String groupId) {
        return run("get-issues", () -> service.issues(sessionId, groupId));
    }

    /** Unresolved blocking issues of one group, or of the session when {@code groupId} is null. */
    public CommandResult<List<IssueRecord>> checkUnresolvedBlocking(String sessionId, String groupId) {
        return run("check-unresolved-blocking", () -> service.unresolvedBlocking(sessionId, groupId));
    }

    public CommandResult<AppendResult> declareScopeChange(String sessionId, ScopeChange change, String dedupKey) {
        return run("declare-scope-change", () -> service.declareScopeChange(sessionId, change, dedupKey));
    }

    public CommandResult<ValidationReport> declareCompletion(String sessionId, String summary) {
        return run("declare-completion", () -> service.declareCompletion(sessionId, summary));
    }

    public CommandResult<ValidationReport> validateCompletion(String sessionId) {
        return run("validate-completion", () -> service.validateCompletion(sessionId));
    }

    // ------------------------------------------------------------------

    private <T> CommandResult<T> run(String command, Supplier<T> work) {
        try {
            return CommandResult.ok(work.get());
        } catch (CoordinationException e) {
            ResultStatus status = ResultStatus.of(e.getKind());
            if (status == ResultStatus.INTERNAL_ERROR) {
                log.error("{} failed: {}", command, e.getMessage(), e);
            } else {
                log.info("{} returned {}: {}", command, status, e.getMessage());
            }
            return CommandResult.failure(status, e.getMessage());
        } catch (DataIntegrityViolationException e) {
            log.warn("{} lost a write race: {}", command, e.getMostSpecificCause().getMessage());
            return CommandResult.failure(ResultStatus.CONFLICT,
                    "[CONFLICT] a concurrent write already stored this record");
        } catch (DataAccessException e) {
            log.error("{} failed on the store", command, e);
            return CommandResult.failure(ResultStatus.INTERNAL_ERROR, "[INTERNAL_ERROR] store unavailable: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("{} failed unexpectedly", command, e);
            return CommandResult.failure(ResultStatus.INTERNAL_ERROR, "[INTERNAL_ERROR] " + e.getMessage());
        }
    }
}
