package com.inboxpilot.core.routing;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxpilot.core.model.FeedbackDecision;
import com.inboxpilot.core.model.FeedbackDomain;
import com.inboxpilot.integration.ClassificationException;
import com.inboxpilot.integration.ClassificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class FeedbackClassifierTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private ClassificationService service;
    private FeedbackClassifier classifier;

    @BeforeEach
    void setUp() {
        service = mock(ClassificationService.class);
        classifier = new FeedbackClassifier(service);
    }

    @Test
    @DisplayName("modification wins when approval and modification are both reported")
    void modificationWins() throws Exception {
        var result = classifier.validate(mapper.readTree("""
                {"domain": "scheduling", "decisions": ["approved", "modified"],
                 "instructions": "Offer Thursday instead", "confidence": 0.7}
                """), "looks fine but use Thursday");

        assertTrue(result.isValid());
        assertEquals(FeedbackDomain.SCHEDULING, result.value().domain());
        assertEquals(FeedbackDecision.MODIFIED, result.value().decision());
        assertEquals("Offer Thursday instead", result.value().instructions());
    }

    @Test
    @DisplayName("a single decision string is accepted and blank instructions fall back to the feedback")
    void singleDecision() throws Exception {
        var result = classifier.validate(mapper.readTree("""
                {"domain": "response-only", "decision": "modified", "instructions": ""}
                """), "shorter please");

        assertEquals(FeedbackDomain.RESPONSE_ONLY, result.value().domain());
        assertEquals("shorter please", result.value().instructions());
        assertEquals(0.5, result.value().confidence());
    }

    @Test
    @DisplayName("no decisions at all is read as a modification")
    void missingDecisions() throws Exception {
        var result = classifier.validate(mapper.readTree("{\"domain\": \"contact\"}"), "wrong phone number");

        assertEquals(FeedbackDecision.MODIFIED, result.value().decision());
        assertEquals(FeedbackDomain.CONTACT, result.value().domain());
    }

    @Test
    @DisplayName("unknown domain, non-object response and bad decisions are rejected")
    void malformed() throws Exception {
        assertFalse(classifier.validate(mapper.readTree("{\"domain\": \"billing\"}"), "x").isValid());
        assertFalse(classifier.validate(mapper.readTree("\"scheduling\""), "x").isValid());
        assertFalse(classifier.validate(mapper.readTree("{\"domain\": \"contact\", \"decisions\": 3}"), "x").isValid());
        assertFalse(classifier.validate(mapper.readTree("{\"domain\": \"contact\", \"confidence\": -1}"), "x").isValid());
    }

    @Test
    @DisplayName("a failing classification call yields an invalid result")
    void callFailure() {
        when(service.classify(any())).thenThrow(new ClassificationException("unavailable"));

        assertFalse(classifier.classify("shorter", "draft", "subject").isValid());
    }
}
