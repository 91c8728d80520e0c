package com.inboxpilot.dispatch.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxpilot.core.engine.ConversationEngine;
import com.inboxpilot.core.engine.ConversationNotFoundException;
import com.inboxpilot.core.engine.DuplicateConversationException;
import com.inboxpilot.core.engine.NotAwaitingInputException;
import com.inboxpilot.core.interrupt.ActionRequest;
import com.inboxpilot.core.interrupt.HumanResponse;
import com.inboxpilot.core.interrupt.HumanResponseType;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.interrupt.PendingInterrupt;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.persistence.ConversationSnapshot;
import com.inboxpilot.core.state.ConversationState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.hamcrest.Matchers.*;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ConversationController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class ConversationControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-03T08:00:00Z");

    @TestConfiguration
    static class FixedClock {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private ConversationEngine engine;

    @MockitoBean
    private ConversationEventStream eventStream;

    private static ConversationSnapshot awaitingReview(String id) {
        var request = new ActionRequest("Review: Pricing question",
                Map.of("draft_response", "Hi Sam, thanks for reaching out."),
                true, true, true, true, 86400);
        var map = new HashMap<String, Object>();
        map.put(ConversationState.CONVERSATION_ID, id);
        map.put(ConversationState.REQUEST, new InboundEmail("m-1", "t-1", "sam@example.com",
                "Pricing question", "What does the team plan cost?", NOW));
        map.put(ConversationState.DRAFT_OUTPUT, "Hi Sam, thanks for reaching out.");
        map.put(ConversationState.STATUS, ConversationStatus.AWAITING_REVIEW);
        map.put(ConversationState.EPOCH, 1);
        map.put(ConversationState.TASK_DATA, Map.of(StageKind.KNOWLEDGE,
                TaskResult.success(StageKind.KNOWLEDGE, "team plan pricing",
                        "Team plan is 20 EUR per seat", List.of(), 1)));
        map.put(ConversationState.PENDING_INTERRUPT,
                new PendingInterrupt(InterruptPoint.DRAFT_REVIEW, request, 1, NOW, NOW.plusSeconds(86400)));
        return ConversationSnapshot.of(new ConversationState(map), NOW);
    }

    private static ConversationSnapshot withStatus(ConversationSnapshot snapshot, ConversationStatus status) {
        var map = snapshot.toStateMap();
        map.put(ConversationState.STATUS, status);
        map.put(ConversationState.PENDING_INTERRUPT, PendingInterrupt.none());
        return ConversationSnapshot.of(new ConversationState(map), NOW);
    }

    // ── POST /api/v1/conversations ──────────────────────────────────

    @Test
    @DisplayName("POST /conversations runs the email and returns the pending review")
    void submitConversation() throws Exception {
        when(engine.generateConversationId()).thenReturn("CONV-2025-0001");
        when(engine.start(eq("CONV-2025-0001"), any(InboundEmail.class)))
                .thenReturn(awaitingReview("CONV-2025-0001"));

        String body = objectMapper.writeValueAsString(new EmailRequest(
                "m-1", "t-1", "sam@example.com", "Pricing question", "What does the team plan cost?", null));

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.conversation_id").value("CONV-2025-0001"))
                .andExpect(jsonPath("$.status").value("AWAITING_REVIEW"))
                .andExpect(jsonPath("$.awaiting_input").value(true))
                .andExpect(jsonPath("$.interrupt_point").value("DRAFT_REVIEW"))
                .andExpect(jsonPath("$.action_request.allow_edit").value(true))
                .andExpect(jsonPath("$.action_request.timeout_seconds").value(86400))
                .andExpect(jsonPath("$.stages.knowledge").value("SUCCESS"));
    }

    @Test
    @DisplayName("POST /conversations defaults received_at to the clock")
    void submitDefaultsReceivedAt() throws Exception {
        when(engine.generateConversationId()).thenReturn("CONV-2025-0002");
        when(engine.start(any(), any())).thenReturn(awaitingReview("CONV-2025-0002"));

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sender\":\"sam@example.com\",\"subject\":\"Hi\",\"body\":\"Hello\"}"))
                .andExpect(status().isOk());

        verify(engine).start(eq("CONV-2025-0002"),
                argThat(email -> NOW.equals(email.receivedAt()) && "sam@example.com".equals(email.sender())));
    }

    @Test
    @DisplayName("POST /conversations without a sender returns 400 and starts nothing")
    void submitWithoutSender() throws Exception {
        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"subject\":\"Hi\",\"body\":\"Hello\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("sender is required"));

        verify(engine, never()).start(any(), any());
    }

    @Test
    @DisplayName("POST /conversations with malformed JSON returns 400")
    void submitMalformed() throws Exception {
        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    @DisplayName("POST /conversations for an id that already exists returns 409")
    void submitDuplicate() throws Exception {
        when(engine.generateConversationId()).thenReturn("CONV-2025-0001");
        when(engine.start(eq("CONV-2025-0001"), any()))
                .thenThrow(new DuplicateConversationException("CONV-2025-0001"));

        mockMvc.perform(post("/api/v1/conversations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sender\":\"sam@example.com\",\"subject\":\"Hi\",\"body\":\"Hello\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Conversation CONV-2025-0001 already exists"));
    }

    // ── GET /api/v1/conversations/{id}/events ───────────────────────

    @Test
    @DisplayName("GET /events opens a server-sent event stream for a known conversation")
    void streamEvents() throws Exception {
        when(engine.get("CONV-2025-0001")).thenReturn(Optional.of(awaitingReview("CONV-2025-0001")));
        when(eventStream.open("CONV-2025-0001")).thenReturn(new SseEmitter(1000L));

        mockMvc.perform(get("/api/v1/conversations/CONV-2025-0001/events")
                        .accept(MediaType.TEXT_EVENT_STREAM))
                .andExpect(status().isOk())
                .andExpect(request().asyncStarted());

        verify(eventStream).open("CONV-2025-0001");
    }

    @Test
    @DisplayName("GET /events for an unknown id returns 404 without subscribing")
    void streamUnknown() throws Exception {
        when(engine.get("CONV-404")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/conversations/CONV-404/events"))
                .andExpect(status().isNotFound());

        verify(eventStream, never()).open(any());
    }

    // ── GET /api/v1/conversations/{id} ──────────────────────────────

    @Test
    @DisplayName("GET /conversations/{id} returns the conversation view")
    void getConversation() throws Exception {
        when(engine.get("CONV-2025-0001")).thenReturn(Optional.of(awaitingReview("CONV-2025-0001")));

        mockMvc.perform(get("/api/v1/conversations/CONV-2025-0001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.subject").value("Pricing question"))
                .andExpect(jsonPath("$.draft").value("Hi Sam, thanks for reaching out."))
                .andExpect(jsonPath("$.epoch").value(1))
                .andExpect(jsonPath("$.archived").value(false))
                .andExpect(jsonPath("$.booking").doesNotExist());
    }

    @Test
    @DisplayName("GET /conversations/{id} for an unknown id returns 404")
    void getUnknown() throws Exception {
        when(engine.get("CONV-404")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/conversations/CONV-404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value(containsString("CONV-404")));
    }

    // ── POST /api/v1/conversations/{id}/resume ──────────────────────

    @Test
    @DisplayName("POST /resume passes the wire response type to the engine")
    void resumeAccept() throws Exception {
        var completed = withStatus(awaitingReview("CONV-2025-0001"), ConversationStatus.COMPLETED);
        when(engine.resume(eq("CONV-2025-0001"), any(HumanResponse.class))).thenReturn(completed);

        mockMvc.perform(post("/api/v1/conversations/CONV-2025-0001/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"accept\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.awaiting_input").value(false))
                .andExpect(jsonPath("$.action_request").doesNotExist());

        verify(engine).resume(eq("CONV-2025-0001"), argThat(r -> r.type() == HumanResponseType.ACCEPT));
    }

    @Test
    @DisplayName("POST /resume with feedback text keeps the args")
    void resumeRespond() throws Exception {
        when(engine.resume(any(), any())).thenReturn(awaitingReview("CONV-2025-0001"));

        mockMvc.perform(post("/api/v1/conversations/CONV-2025-0001/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"response\",\"args\":\"Mention the annual discount\"}"))
                .andExpect(status().isOk());

        verify(engine).resume(eq("CONV-2025-0001"),
                argThat(r -> r.type() == HumanResponseType.RESPONSE
                        && "Mention the annual discount".equals(r.argsAsText())));
    }

    @Test
    @DisplayName("POST /resume on a conversation that is not waiting returns 409")
    void resumeNotAwaiting() throws Exception {
        when(engine.resume(eq("CONV-2025-0001"), any()))
                .thenThrow(new NotAwaitingInputException("CONV-2025-0001", "COMPLETED"));

        mockMvc.perform(post("/api/v1/conversations/CONV-2025-0001/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"accept\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value(containsString("not awaiting input")));
    }

    @Test
    @DisplayName("POST /resume with a disallowed response returns 400")
    void resumeDisallowed() throws Exception {
        when(engine.resume(any(), any()))
                .thenThrow(new IllegalArgumentException("Response 'edit' is not allowed for action 'Book: Sync'"));

        mockMvc.perform(post("/api/v1/conversations/CONV-2025-0001/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"edit\",\"args\":{\"start\":\"2025-03-04T14:00\"}}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(startsWith("Response 'edit'")));
    }

    @Test
    @DisplayName("POST /resume for an unknown id returns 404")
    void resumeUnknown() throws Exception {
        when(engine.resume(eq("CONV-404"), any())).thenThrow(new ConversationNotFoundException("CONV-404"));

        mockMvc.perform(post("/api/v1/conversations/CONV-404/resume")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"ignore\"}"))
                .andExpect(status().isNotFound());
    }

    // ── GET /api/v1/conversations/awaiting ──────────────────────────

    @Test
    @DisplayName("GET /awaiting lists suspended conversations")
    void listAwaiting() throws Exception {
        when(engine.listAwaiting()).thenReturn(List.of(
                awaitingReview("CONV-2025-0001"), awaitingReview("CONV-2025-0002")));

        mockMvc.perform(get("/api/v1/conversations/awaiting"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[1].conversation_id").value("CONV-2025-0002"));
    }
}
