package com.inboxpilot.dispatch.api;

import com.inboxpilot.core.engine.ConversationEngine;
import com.inboxpilot.core.engine.ConversationNotFoundException;
import com.inboxpilot.core.interrupt.HumanResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * REST controller for conversation lifecycle operations.
 */
@RestController
@RequestMapping("/api/v1/conversations")
public class ConversationController {

    private static final Logger log = LoggerFactory.getLogger(ConversationController.class);

    private final ConversationEngine engine;
    private final ConversationEventStream eventStream;
    private final Clock clock;

    public ConversationController(ConversationEngine engine, ConversationEventStream eventStream, Clock clock) {
        this.engine = engine;
        this.eventStream = eventStream;
        this.clock = clock;
    }

    /**
     * POST /api/v1/conversations: Process a new email until it needs a human or finishes.
     */
    @PostMapping
    public ResponseEntity<?> submit(@RequestBody EmailRequest request) {
        if (request == null || request.sender() == null || request.sender().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "sender is required"));
        }
        String conversationId = engine.generateConversationId();
        log.info("Accepted email from {} as {}", request.sender(), conversationId);
        var snapshot = engine.start(conversationId, request.toEmail(clock.instant()));
        return ResponseEntity.ok(ConversationResponse.from(snapshot));
    }

    /**
     * GET /api/v1/conversations/{id}: Current view, including the pending action request.
     */
    @GetMapping("/{id}")
    public ConversationResponse get(@PathVariable("id") String id) {
        return engine.get(id)
                .map(ConversationResponse::from)
                .orElseThrow(() -> new ConversationNotFoundException(id));
    }

    /**
     * GET /api/v1/conversations/{id}/events: Server-sent events for a live conversation.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events(@PathVariable("id") String id) {
        if (engine.get(id).isEmpty()) {
            throw new ConversationNotFoundException(id);
        }
        return eventStream.open(id);
    }

    /**
     * POST /api/v1/conversations/{id}/resume: Answer the pending action request.
     */
    @PostMapping("/{id}/resume")
    public ConversationResponse resume(@PathVariable("id") String id, @RequestBody HumanResponse response) {
        return ConversationResponse.from(engine.resume(id, response));
    }

    /**
     * GET /api/v1/conversations/awaiting: Conversations suspended at an interrupt.
     */
    @GetMapping("/awaiting")
    public List<ConversationResponse> awaiting() {
        return engine.listAwaiting().stream().map(ConversationResponse::from).toList();
    }
}
