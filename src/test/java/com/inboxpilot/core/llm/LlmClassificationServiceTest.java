package com.inboxpilot.core.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.inboxpilot.integration.ClassificationException;
import com.inboxpilot.integration.ClassificationPrompt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class LlmClassificationServiceTest {

    private LlmService llmService;
    private LlmClassificationService service;

    @BeforeEach
    void setUp() {
        llmService = mock(LlmService.class);
        service = new LlmClassificationService(llmService);
    }

    private static ClassificationPrompt prompt(Map<String, Object> context) {
        return new ClassificationPrompt(ClassificationPrompt.Purpose.BOOKING_ROUTING, "Decide review or exit.", context);
    }

    @Test
    @DisplayName("renders the context as JSON after the instructions")
    void rendersContext() throws Exception {
        var context = new LinkedHashMap<String, Object>();
        context.put("title", "Sync");
        context.put("start", LocalDateTime.of(2025, 3, 4, 10, 0));
        context.put("attendees", List.of("sam@example.com"));
        var answer = new ObjectMapper().readTree("{\"route\": \"review\"}");
        when(llmService.jsonCall(anyString(), anyString())).thenReturn(answer);

        var result = service.classify(prompt(context));

        assertSame(answer, result);
        var user = ArgumentCaptor.forClass(String.class);
        verify(llmService).jsonCall(anyString(), user.capture());
        assertTrue(user.getValue().startsWith("Decide review or exit.\n\nContext:\n"));
        assertTrue(user.getValue().contains("\"start\" : \"2025-03-04T10:00:00\""));
        assertTrue(user.getValue().contains("sam@example.com"));
    }

    @Test
    @DisplayName("model failures become ClassificationException")
    void wrapsFailures() {
        when(llmService.jsonCall(anyString(), anyString()))
                .thenThrow(new LlmParseException("not json", new IllegalStateException()));

        var error = assertThrows(ClassificationException.class, () -> service.classify(prompt(Map.of())));
        assertTrue(error.getMessage().startsWith("BOOKING_ROUTING classification failed"));
        assertInstanceOf(LlmParseException.class, error.getCause());
    }

    @Test
    @DisplayName("unexpected runtime errors are wrapped too")
    void wrapsUnexpected() {
        when(llmService.jsonCall(anyString(), anyString())).thenThrow(new IllegalStateException("client closed"));

        assertThrows(ClassificationException.class, () -> service.classify(prompt(Map.of())));
    }
}
