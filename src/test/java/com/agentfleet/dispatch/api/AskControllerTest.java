package com.agentfleet.dispatch.api;

import com.agentfleet.ask.AskHandle;
import com.agentfleet.ask.AskManager;
import com.agentfleet.ask.AskRequest;
import com.agentfleet.ask.AskResolution;
import com.agentfleet.ask.AskScope;
import com.agentfleet.ask.PendingAsk;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AskController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class AskControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AskManager askManager;

    private static PendingAsk pending(String id, String workflowId) {
        return new PendingAsk(id, "Deploy now?", List.of("yes", "no"), null, "agent-1", null,
                workflowId, null, CREATED, CREATED.plusSeconds(60));
    }

    // ── GET /api/v1/asks ─────────────────────────────────────────────

    @Test
    @DisplayName("GET /asks lists pending asks in the requested scope")
    void listPending() throws Exception {
        when(askManager.listPending(new AskScope(null, null, null, "wf-1", null)))
                .thenReturn(List.of(pending("ask-1", "wf-1")));

        mockMvc.perform(get("/api/v1/asks").param("workflow_id", "wf-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(1)))
                .andExpect(jsonPath("$[0].requestId").value("ask-1"))
                .andExpect(jsonPath("$[0].options", contains("yes", "no")));
    }

    // ── POST /api/v1/asks ────────────────────────────────────────────

    @Test
    @DisplayName("POST /asks opens an ask and returns 201 with its id")
    void openAsk() throws Exception {
        when(askManager.open(any(AskRequest.class)))
                .thenReturn(new AskHandle(pending("ask-7", null), new CompletableFuture<>()));

        mockMvc.perform(post("/api/v1/asks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"question":"Deploy now?","options":["yes","no"],"timeoutMs":60000}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.request_id").value("ask-7"))
                .andExpect(jsonPath("$.expires_at").value("2026-03-01T10:01:00Z"));
    }

    @Test
    @DisplayName("POST /asks with a blank question returns 400")
    void openBlankQuestion() throws Exception {
        when(askManager.open(any(AskRequest.class)))
                .thenThrow(new IllegalArgumentException("ask question is required"));

        mockMvc.perform(post("/api/v1/asks")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error", containsString("required")));
    }

    // ── POST /api/v1/asks/{id}/answer ────────────────────────────────

    @Test
    @DisplayName("POST /asks/{id}/answer returns the resolution")
    void answerById() throws Exception {
        when(askManager.resolveByRequestId("ask-1", "2"))
                .thenReturn(Optional.of(new AskResolution(true, "ask-1", "2", "no", false, CREATED)));

        mockMvc.perform(post("/api/v1/asks/ask-1/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"2\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.selectedOption").value("no"))
                .andExpect(jsonPath("$.timedOut").value(false));
    }

    @Test
    @DisplayName("POST /asks/{id}/answer for an unknown id returns 404")
    void answerUnknown() throws Exception {
        when(askManager.resolveByRequestId(eq("nope"), any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/asks/nope/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"yes\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error", containsString("nope")));
    }

    // ── POST /api/v1/asks/answer ─────────────────────────────────────

    @Test
    @DisplayName("POST /asks/answer resolves the oldest ask in the body's scope")
    void answerOldest() throws Exception {
        AskScope scope = new AskScope(null, "agent-1", null, null, null);
        when(askManager.resolveOldestByScope(scope, "yes"))
                .thenReturn(Optional.of(new AskResolution(true, "ask-3", "yes", "yes", false, CREATED)));

        mockMvc.perform(post("/api/v1/asks/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"yes\",\"agent_id\":\"agent-1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.requestId").value("ask-3"));

        verify(askManager).resolveOldestByScope(scope, "yes");
    }

    @Test
    @DisplayName("POST /asks/answer with nothing pending in scope returns 404")
    void answerOldestNothingPending() throws Exception {
        when(askManager.resolveOldestByScope(any(), any())).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/asks/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"yes\",\"workflow_id\":\"wf-9\"}"))
                .andExpect(status().isNotFound());
    }
}
