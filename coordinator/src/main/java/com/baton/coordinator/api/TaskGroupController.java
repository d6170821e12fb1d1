package com.baton.coordinator.api;

import com.baton.coordinator.api.dto.*;
import com.baton.coordinator.event.IssueResponses;
import com.baton.coordinator.event.ReviewVerdicts;
import com.baton.coordinator.service.CoordinationCommands;
import com.baton.coordinator.service.StatusReport;
import com.baton.coordinator.store.TaskGroupUpdate;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for task groups and the role turns played on them.
 *
 * GET  /sessions/{id}/groups                          - all groups in creation order
 * PUT  /sessions/{id}/groups/{groupId}                - create or update a group
 * GET  /sessions/{id}/groups/{groupId}                - one group with its counters
 * POST /sessions/{id}/groups/{groupId}/status         - a role reports a status code
 * POST /sessions/{id}/groups/{groupId}/reviews        - a reviewer submits a review pass
 * POST /sessions/{id}/groups/{groupId}/responses      - the implementer answers the issues
 * POST /sessions/{id}/groups/{groupId}/verdicts       - the reviewer rules on rejections
 * POST /sessions/{id}/groups/{groupId}/timeouts       - a role missed its deadline
 * GET  /sessions/{id}/groups/{groupId}/issues         - issues of the latest pass
 * GET  /sessions/{id}/groups/{groupId}/blocking-issues
 */
@RestController
@RequestMapping("/sessions/{sessionId}/groups")
public class TaskGroupController {

    private final CoordinationCommands commands;

    public TaskGroupController(CoordinationCommands commands) {
        this.commands = commands;
    }

    @GetMapping
    public ResponseEntity<Object> list(@PathVariable String sessionId) {
        return CommandResponses.respond(commands.listTaskGroups(sessionId),
                groups -> groups.stream().map(TaskGroupResponse::from).toList());
    }

    @PutMapping("/{groupId}")
    public ResponseEntity<Object> upsert(@PathVariable String sessionId,
                                         @PathVariable String groupId,
                                         @RequestBody TaskGroupRequest req) {
        TaskGroupUpdate update = new TaskGroupUpdate(groupId, req.name(), req.status(), req.assignedRole(),
                req.reviewIteration(), req.complexity(), req.scopeItemIds());
        return CommandResponses.respond(commands.upsertTaskGroup(sessionId, update), TaskGroupResponse::from);
    }

    @GetMapping("/{groupId}")
    public ResponseEntity<Object> get(@PathVariable String sessionId, @PathVariable String groupId) {
        return CommandResponses.respond(commands.getTaskGroup(sessionId, groupId), TaskGroupResponse::from);
    }

    /**
     * Report the outcome of a role turn.
     *
     * Example:
     *   curl -X POST http://localhost:8080/sessions/run-42/groups/G1/status \
     *     -H "Content-Type: application/json" \
     *     -d '{"role":"IMPLEMENTER","statusCode":"READY_FOR_QA","capabilities":["change_summary"]}'
     */
    @PostMapping("/{groupId}/status")
    public ResponseEntity<Object> reportStatus(@PathVariable String sessionId,
                                               @PathVariable String groupId,
                                               @RequestBody StatusReportRequest req) {
        StatusReport report = new StatusReport(sessionId, groupId, req.role(), req.statusCode(),
                req.capabilities(), req.dedupKey());
        return CommandResponses.respond(commands.reportStatus(report), TransitionResponse::from);
    }

    @PostMapping("/{groupId}/reviews")
    public ResponseEntity<Object> review(@PathVariable String sessionId,
                                         @PathVariable String groupId,
                                         @RequestBody ReviewRequest req) {
        return CommandResponses.respond(
                commands.recordReview(sessionId, groupId, req.role(), req.iteration(), req.issues()),
                ReviewResponse::from);
    }

    @PostMapping("/{groupId}/responses")
    public ResponseEntity<Object> responses(@PathVariable String sessionId,
                                            @PathVariable String groupId,
                                            @RequestBody IssueResponses req) {
        return CommandResponses.respond(commands.recordResponses(sessionId, groupId, req), issues -> issues);
    }

    @PostMapping("/{groupId}/verdicts")
    public ResponseEntity<Object> verdicts(@PathVariable String sessionId,
                                           @PathVariable String groupId,
                                           @RequestBody VerdictRequest req) {
        return CommandResponses.respond(
                commands.recordVerdicts(sessionId, groupId, req.role(),
                        new ReviewVerdicts(req.iteration(), req.verdicts())),
                VerdictResponse::from);
    }

    @PostMapping("/{groupId}/timeouts")
    public ResponseEntity<Object> timeout(@PathVariable String sessionId,
                                          @PathVariable String groupId,
                                          @RequestBody TimeoutRequest req) {
        return CommandResponses.respond(
                commands.recordTimeout(sessionId, groupId, req.role(), req.deadline(), req.reason()),
                TransitionResponse::from);
    }

    @GetMapping("/{groupId}/issues")
    public ResponseEntity<Object> issues(@PathVariable String sessionId, @PathVariable String groupId) {
        return CommandResponses.respond(commands.issues(sessionId, groupId), issues -> issues);
    }

    @GetMapping("/{groupId}/blocking-issues")
    public ResponseEntity<Object> blockingIssues(@PathVariable String sessionId, @PathVariable String groupId) {
        return CommandResponses.respond(commands.checkUnresolvedBlocking(sessionId, groupId), issues -> issues);
    }
}
