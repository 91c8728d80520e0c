package com.inboxpilot.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.inboxpilot.integration.ClassificationException;
import com.inboxpilot.integration.ClassificationPrompt;
import com.inboxpilot.integration.ClassificationService;
import com.inboxpilot.integration.IntegrationException;
import org.springframework.stereotype.Service;

/**
 * {@link ClassificationService} backed by the chat model. The prompt context is rendered as
 * JSON and appended to the caller's instructions.
 */
@Service
public class LlmClassificationService implements ClassificationService {

    private static final String SYSTEM_PROMPT = """
            You are the routing classifier of an email assistant.
            You never write prose. You answer with a single JSON object that follows the
            instructions exactly, with no markdown and no commentary.
            """;

    private final LlmService llmService;
    private final ObjectMapper contextMapper;

    public LlmClassificationService(LlmService llmService) {
        this.llmService = llmService;
        this.contextMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public JsonNode classify(ClassificationPrompt prompt) {
        String userPrompt;
        try {
            userPrompt = prompt.instructions() + "\n\nContext:\n"
                    + contextMapper.writerWithDefaultPrettyPrinter().writeValueAsString(prompt.context());
        } catch (JsonProcessingException e) {
            throw new ClassificationException("Cannot render classification context for " + prompt.purpose(), e);
        }
        try {
            return llmService.jsonCall(SYSTEM_PROMPT, userPrompt);
        } catch (IntegrationException e) {
            throw new ClassificationException(prompt.purpose() + " classification failed: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ClassificationException(prompt.purpose() + " classification call failed", e);
        }
    }
}
