package com.baton.coordinator.api;

import com.baton.coordinator.api.dto.*;
import com.baton.coordinator.event.ScopeChange;
import com.baton.coordinator.model.EventType;
import com.baton.coordinator.model.StateSnapshot;
import com.baton.coordinator.service.CommandResult;
import com.baton.coordinator.service.CoordinationCommands;
import com.baton.coordinator.service.ResultStatus;
import com.baton.coordinator.store.AppendResult;
import com.baton.coordinator.store.EventQuery;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Optional;

/**
 * REST API for sessions and their session-level commands.
 *
 * POST /sessions                                  - create a session with its original scope
 * GET  /sessions/{id}                             - session status
 * POST /sessions/{id}/groups/start                - hand pending groups to the implementer
 * POST /sessions/{id}/events                      - append an audit entry or scope change
 * GET  /sessions/{id}/events                      - query events (groupId, type, since, limit)
 * PUT  /sessions/{id}/state/{scope}/{stateType}   - replace a state snapshot
 * GET  /sessions/{id}/state/{scope}/{stateType}   - read a state snapshot
 * GET  /sessions/{id}/blocking-issues             - unresolved blocking issues of every group
 * POST /sessions/{id}/scope-changes               - record an approved scope reduction
 * POST /sessions/{id}/completion                  - manager declares completion, validator decides
 * POST /sessions/{id}/validation                  - run the validator gate without a declaration
 */
@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final CoordinationCommands commands;

    public SessionController(CoordinationCommands commands) {
        this.commands = commands;
    }

    /**
     * Create a session.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions \
     *     -H "Content-Type: application/json" \
     *     -d '{"sessionId":"run-42","scope":[{"id":"S1","description":"login form"}]}'
     */
    @PostMapping
    public ResponseEntity<Object> create(@RequestBody CreateSessionRequest req) {
        return CommandResponses.respond(
                commands.createSession(req.sessionId(), req.scope(), req.executionMode(), req.testingMode()),
                HttpStatus.CREATED, SessionResponse::from);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<Object> get(@PathVariable String sessionId) {
        return CommandResponses.respond(commands.getSession(sessionId), SessionResponse::from);
    }

    @PostMapping("/{sessionId}/groups/start")
    public ResponseEntity<Object> startPending(@PathVariable String sessionId,
                                               @RequestParam(defaultValue = "1") int maxParallel) {
        return CommandResponses.respond(commands.startPendingGroups(sessionId, maxParallel),
                started -> started.stream().map(TransitionResponse::from).toList());
    }

    // ------------------------------------------------------------------
    // Events and state
    // ------------------------------------------------------------------

    /** 201 when the event was stored, 200 when the dedup key was already present. */
    @PostMapping("/{sessionId}/events")
    public ResponseEntity<Object> appendEvent(@PathVariable String sessionId,
                                              @RequestBody AppendEventRequest req) {
        CommandResult<AppendResult> result =
                commands.appendEvent(sessionId, req.groupId(), req.type(), req.payload(), req.dedupKey());
        return appended(result);
    }

    @GetMapping("/{sessionId}/events")
    public ResponseEntity<Object> events(@PathVariable String sessionId,
                                         @RequestParam(required = false) String groupId,
                                         @RequestParam(required = false) EventType type,
                                         @RequestParam(required = false) Instant since,
                                         @RequestParam(required = false) Integer limit) {
        return CommandResponses.respond(commands.getEvents(sessionId, new EventQuery(groupId, type, since, limit)),
                events -> events.stream().map(EventResponse::from).toList());
    }

    @PutMapping("/{sessionId}/state/{scope}/{stateType}")
    public ResponseEntity<Object> upsertState(@PathVariable String sessionId,
                                              @PathVariable String scope,
                                              @PathVariable String stateType,
                                              @RequestBody JsonNode payload) {
        return CommandResponses.respond(commands.upsertState(sessionId, scope, stateType, payload.toString()),
                StateResponse::from);
    }

    /** 404 when no snapshot was written for this scope and type. */
    @GetMapping("/{sessionId}/state/{scope}/{stateType}")
    public ResponseEntity<Object> getState(@PathVariable String sessionId,
                                           @PathVariable String scope,
                                           @PathVariable String stateType) {
        CommandResult<Optional<StateSnapshot>> result = commands.getState(sessionId, scope, stateType);
        if (result.isOk() && result.value().isEmpty()) {
            return CommandResponses.respond(
                    CommandResult.failure(ResultStatus.NOT_FOUND,
                            "[NOT_FOUND] no " + stateType + " state for scope " + scope),
                    x -> x);
        }
        return CommandResponses.respond(result, snapshot -> StateResponse.from(snapshot.get()));
    }

    @GetMapping("/{sessionId}/blocking-issues")
    public ResponseEntity<Object> blockingIssues(@PathVariable String sessionId) {
        return CommandResponses.respond(commands.checkUnresolvedBlocking(sessionId, null), issues -> issues);
    }

    // ------------------------------------------------------------------
    // Scope and completion
    // ------------------------------------------------------------------

    @PostMapping("/{sessionId}/scope-changes")
    public ResponseEntity<Object> scopeChange(@PathVariable String sessionId,
                                              @RequestBody ScopeChangeRequest req) {
        return appended(commands.declareScopeChange(sessionId,
                new ScopeChange(req.removedItemIds(), req.reason(), req.approvedBy()), req.dedupKey()));
    }

    @PostMapping("/{sessionId}/completion")
    public ResponseEntity<Object> declareCompletion(@PathVariable String sessionId,
                                                    @RequestBody(required = false) CompletionRequest req) {
        return CommandResponses.respond(commands.declareCompletion(sessionId, req == null ? null : req.summary()),
                report -> report);
    }

    @PostMapping("/{sessionId}/validation")
    public ResponseEntity<Object> validate(@PathVariable String sessionId) {
        return CommandResponses.respond(commands.validateCompletion(sessionId), report -> report);
    }

    private static ResponseEntity<Object> appended(CommandResult<AppendResult> result) {
        HttpStatus ok = result.isOk() && result.value().duplicate() ? HttpStatus.OK : HttpStatus.CREATED;
        return CommandResponses.respond(result, ok,
                appended -> EventResponse.from(appended.event(), appended.duplicate()));
    }
}
