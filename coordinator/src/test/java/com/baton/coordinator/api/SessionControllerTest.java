package com.baton.coordinator.api;

import com.baton.coordinator.model.*;
import com.baton.coordinator.service.CommandResult;
import com.baton.coordinator.service.CoordinationCommands;
import com.baton.coordinator.service.ResultStatus;
import com.baton.coordinator.store.AppendResult;
import com.baton.coordinator.validator.MissingItem;
import com.baton.coordinator.validator.ValidationReport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Slice test for SessionController.
 *
 * Only the web layer is started; the command surface is a mock, so each test
 * controls the result tag and checks the HTTP status it maps to.
 */
@WebMvcTest(SessionController.class)
class SessionControllerTest {

    @Autowired MockMvc mockMvc;
    @MockitoBean CoordinationCommands commands;

    private static Session session() {
        return new Session("run-42", List.of(new ScopeItem("S1", "login form")),
                ExecutionMode.SINGLE_TRACK, TestingMode.FULL);
    }

    // ------------------------------------------------------------------
    // POST /sessions
    // ------------------------------------------------------------------

    @Test
    void create_validRequest_returns201() throws Exception {
        when(commands.createSession(eq("run-42"), anyList(), any(), any()))
                .thenReturn(CommandResult.ok(session()));

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionId":"run-42","scope":[{"id":"S1","description":"login form"}]}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value("run-42"))
                .andExpect(jsonPath("$.status").value("ACTIVE"))
                .andExpect(jsonPath("$.scope[0].id").value("S1"));
    }

    @Test
    void create_existingSession_returns200WithConflict() throws Exception {
        when(commands.createSession(any(), anyList(), any(), any()))
                .thenReturn(CommandResult.failure(ResultStatus.CONFLICT, "[CONFLICT] session run-42 already exists"));

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionId":"run-42"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CONFLICT"));
    }

    @Test
    void create_invalidId_returns400() throws Exception {
        when(commands.createSession(any(), anyList(), any(), any()))
                .thenReturn(CommandResult.failure(ResultStatus.VALIDATION_ERROR,
                        "[VALIDATION_ERROR] session_id must contain only alphanumeric characters"));

        mockMvc.perform(post("/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"sessionId":"../x"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("session_id")));
    }

    // ------------------------------------------------------------------
    // GET /sessions/{id}
    // ------------------------------------------------------------------

    @Test
    void get_unknownSession_returns404() throws Exception {
        when(commands.getSession("ghost"))
                .thenReturn(CommandResult.failure(ResultStatus.NOT_FOUND, "[NOT_FOUND] session ghost does not exist"));

        mockMvc.perform(get("/sessions/ghost"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("NOT_FOUND"));
    }

    @Test
    void get_storeDown_returns503() throws Exception {
        when(commands.getSession("run-42"))
                .thenReturn(CommandResult.failure(ResultStatus.INTERNAL_ERROR, "[INTERNAL_ERROR] store unavailable"));

        mockMvc.perform(get("/sessions/run-42"))
                .andExpect(status().isServiceUnavailable());
    }

    // ------------------------------------------------------------------
    // Events and state
    // ------------------------------------------------------------------

    @Test
    void appendEvent_new_returns201WithRawPayload() throws Exception {
        Event event = new Event("run-42", null, EventType.AUDIT, "{\"message\":\"hello\"}", "audit:1");
        when(commands.appendEvent(eq("run-42"), isNull(), eq(EventType.AUDIT), any(), eq("audit:1")))
                .thenReturn(CommandResult.ok(new AppendResult(event, false)));

        mockMvc.perform(post("/sessions/run-42/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"AUDIT","payload":{"message":"hello"},"dedupKey":"audit:1"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.payload.message").value("hello"))
                .andExpect(jsonPath("$.duplicate").value(false));
    }

    @Test
    void appendEvent_duplicateKey_returns200() throws Exception {
        Event event = new Event("run-42", null, EventType.AUDIT, "{\"message\":\"hello\"}", "audit:1");
        when(commands.appendEvent(any(), any(), any(), any(), any()))
                .thenReturn(CommandResult.ok(new AppendResult(event, true)));

        mockMvc.perform(post("/sessions/run-42/events")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"type":"AUDIT","payload":{"message":"hello"},"dedupKey":"audit:1"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.duplicate").value(true));
    }

    @Test
    void getState_neverWritten_returns404() throws Exception {
        when(commands.getState("run-42", "global", "plan")).thenReturn(CommandResult.ok(Optional.empty()));

        mockMvc.perform(get("/sessions/run-42/state/global/plan"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value(org.hamcrest.Matchers.containsString("plan")));
    }

    @Test
    void putState_returnsStoredDocument() throws Exception {
        when(commands.upsertState(eq("run-42"), eq("global"), eq("plan"), anyString()))
                .thenReturn(CommandResult.ok(new StateSnapshot("run-42", "global", "plan", "{\"phase\":2}")));

        mockMvc.perform(put("/sessions/run-42/state/global/plan")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"phase":2}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.payload.phase").value(2));
    }

    // ------------------------------------------------------------------
    // Completion
    // ------------------------------------------------------------------

    @Test
    void completion_rejected_returnsMissingItems() throws Exception {
        when(commands.declareCompletion("run-42", "done")).thenReturn(CommandResult.ok(ValidationReport.reject(
                List.of(new MissingItem(MissingItem.Category.SCOPE_ITEM, "S1", "not delivered")))));

        mockMvc.perform(post("/sessions/run-42/completion")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"summary":"done"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("REJECT"))
                .andExpect(jsonPath("$.routeTo").value("MANAGER"))
                .andExpect(jsonPath("$.missing[0].category").value("SCOPE_ITEM"))
                .andExpect(jsonPath("$.missing[0].reference").value("S1"));
    }

    @Test
    void validation_accepted() throws Exception {
        when(commands.validateCompletion("run-42")).thenReturn(CommandResult.ok(ValidationReport.accept()));

        mockMvc.perform(post("/sessions/run-42/validation"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.verdict").value("ACCEPT"))
                .andExpect(jsonPath("$.missing").isEmpty());
    }
}
