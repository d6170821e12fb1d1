package com.baton.coordinator.api;

import com.baton.coordinator.engine.RoutingDecision;
import com.baton.coordinator.engine.TransitionAction;
import com.baton.coordinator.event.Issue;
import com.baton.coordinator.event.Severity;
import com.baton.coordinator.ledger.ReviewRecord;
import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.Role;
import com.baton.coordinator.model.TaskGroup;
import com.baton.coordinator.progress.EscalationLevel;
import com.baton.coordinator.progress.ProgressEvaluation;
import com.baton.coordinator.service.*;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskGroupController.class)
class TaskGroupControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean CoordinationCommands commands;

    private static TaskGroup group(GroupStatus status, Role assigned) {
        TaskGroup group = new TaskGroup("run-42", "G1", "Login");
        group.setStatus(status);
        group.setAssignedRole(assigned);
        return group;
    }

    @Test
    void upsert_passesPathIdAndFields() throws Exception {
        when(commands.upsertTaskGroup(eq("run-42"), any()))
                .thenReturn(CommandResult.ok(group(GroupStatus.PENDING, null)));

        mockMvc.perform(put("/sessions/run-42/groups/G1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"name":"Login","complexity":4,"scopeItemIds":["S1"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.groupId").value("G1"))
                .andExpect(jsonPath("$.status").value("PENDING"));

        ArgumentCaptor<com.baton.coordinator.store.TaskGroupUpdate> update =
                ArgumentCaptor.forClass(com.baton.coordinator.store.TaskGroupUpdate.class);
        verify(commands).upsertTaskGroup(eq("run-42"), update.capture());
        assertThat(update.getValue().groupId()).isEqualTo("G1");
        assertThat(update.getValue().complexity()).isEqualTo(4);
        assertThat(update.getValue().scopeItemIds()).containsExactly("S1");
    }

    @Test
    void reportStatus_returnsRoutingDecision() throws Exception {
        RoutingDecision decision = new RoutingDecision(Role.QUALITY_CHECKER, TransitionAction.ROUTE,
                GroupStatus.READY_FOR_REVIEW, List.of("change_summary"), false, false, false, List.of());
        when(commands.reportStatus(any())).thenReturn(CommandResult.ok(
                new TransitionOutcome(decision, group(GroupStatus.READY_FOR_REVIEW, Role.QUALITY_CHECKER), false)));

        mockMvc.perform(post("/sessions/run-42/groups/G1/status")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role":"IMPLEMENTER","statusCode":"READY_FOR_QA","capabilities":["change_summary"]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.nextRole").value("QUALITY_CHECKER"))
                .andExpect(jsonPath("$.action").value("ROUTE"))
                .andExpect(jsonPath("$.groupStatus").value("READY_FOR_REVIEW"))
                .andExpect(jsonPath("$.includeContext[0]").value("change_summary"));

        ArgumentCaptor<StatusReport> report = ArgumentCaptor.forClass(StatusReport.class);
        verify(commands).reportStatus(report.capture());
        assertThat(report.getValue().groupId()).isEqualTo("G1");
        assertThat(report.getValue().capabilities()).containsExactly("change_summary");
    }

    @Test
    void review_escalated_reportsProgressAndTransition() throws Exception {
        Issue issue = new Issue("G1-4-1", "Missing null check", null, Severity.HIGH, true, "Login.java");
        ReviewRecord record = new ReviewRecord(4, List.of(issue), List.of(), List.of(), 1, 0, false);
        RoutingDecision decision = new RoutingDecision(Role.LEAD_REVIEWER, TransitionAction.ROUTE,
                GroupStatus.ESCALATED, List.of("issue_list"), true, false, false, List.of("escalated"));
        when(commands.recordReview(eq("run-42"), eq("G1"), eq(Role.REVIEWER), eq(4), anyList()))
                .thenReturn(CommandResult.ok(new ReviewOutcome(record,
                        new ProgressEvaluation(4, false, 3, EscalationLevel.ESCALATE), decision,
                        group(GroupStatus.ESCALATED, Role.LEAD_REVIEWER), false)));

        mockMvc.perform(post("/sessions/run-42/groups/G1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"iteration":4,"issues":[{"title":"Missing null check","severity":"HIGH",
                                  "blocking":true,"location":"Login.java"}]}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.issues[0].id").value("G1-4-1"))
                .andExpect(jsonPath("$.noProgressStreak").value(3))
                .andExpect(jsonPath("$.escalationLevel").value("ESCALATE"))
                .andExpect(jsonPath("$.transition.nextRole").value("LEAD_REVIEWER"))
                .andExpect(jsonPath("$.transition.escalated").value(true));
    }

    @Test
    void review_skippedIteration_returns400() throws Exception {
        when(commands.recordReview(any(), any(), any(), anyInt(), anyList()))
                .thenReturn(CommandResult.failure(ResultStatus.VALIDATION_ERROR,
                        "[VALIDATION_ERROR] review iteration 3 does not follow 0 for group G1"));

        mockMvc.perform(post("/sessions/run-42/groups/G1/reviews")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"iteration":3,"issues":[]}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value("VALIDATION_ERROR"));
    }

    @Test
    void issues_unknownGroup_returns404() throws Exception {
        when(commands.issues("run-42", "G9"))
                .thenReturn(CommandResult.failure(ResultStatus.NOT_FOUND, "[NOT_FOUND] task group G9 does not exist"));

        mockMvc.perform(get("/sessions/run-42/groups/G9/issues"))
                .andExpect(status().isNotFound());
    }

    @Test
    void timeout_returnsRespawn() throws Exception {
        RoutingDecision decision = new RoutingDecision(Role.IMPLEMENTER, TransitionAction.RESPAWN, null,
                List.of(), false, false, false, List.of("deadline missed, implementer respawned"));
        when(commands.recordTimeout(eq("run-42"), eq("G1"), eq(Role.IMPLEMENTER), any(), eq("no answer")))
                .thenReturn(CommandResult.ok(new TransitionOutcome(decision,
                        group(GroupStatus.IN_PROGRESS, Role.IMPLEMENTER), false)));

        mockMvc.perform(post("/sessions/run-42/groups/G1/timeouts")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"role":"IMPLEMENTER","deadline":"2026-10-17T10:00:00Z","reason":"no answer"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.action").value("RESPAWN"))
                .andExpect(jsonPath("$.groupStatus").value("IN_PROGRESS"));
    }
}
