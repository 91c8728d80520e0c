package com.inboxpilot.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Wraps Spring AI's {@link ChatClient} for the three call shapes the engine needs:
 * typed structured output, raw JSON for classification, and plain text for drafting.
 * <p>
 * Structured calls use {@link BeanOutputConverter} and fall back to lenient Jackson parsing
 * (stripping markdown code fences) when the converter rejects the response.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);

    private final ChatClient chatClient;
    private final ObjectMapper lenientMapper;

    public LlmService(ChatClient.Builder builder,
                      @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.lenientMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true)
                .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true)
                .registerModule(new ParameterNamesModule())
                .registerModule(new JavaTimeModule());
        log.info("LlmService initialized, OpenAI base-url: {}", baseUrl);
    }

    /**
     * Sends a system + user prompt and deserializes the response into {@code outputType}.
     *
     * @throws LlmEmptyResponseException when the model returns no content
     * @throws LlmParseException         when neither the converter nor Jackson can read the response
     */
    public <T> T structuredCall(String systemPrompt, String userPrompt, Class<T> outputType) {
        var converter = new BeanOutputConverter<>(outputType);
        String response = call(systemPrompt, userPrompt + "\n\n" + converter.getFormat(), outputType.getSimpleName());
        try {
            return converter.convert(response);
        } catch (RuntimeException e) {
            log.warn("Converter rejected LLM response for {}: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", response);
            return parseWithJackson(response, outputType);
        }
    }

    /**
     * Sends a prompt that asks for a JSON object and returns it as a tree, leaving schema
     * validation to the caller.
     */
    public JsonNode jsonCall(String systemPrompt, String userPrompt) {
        String response = call(systemPrompt, userPrompt, "JSON");
        try {
            return lenientMapper.readTree(stripCodeFences(response));
        } catch (Exception e) {
            log.debug("Raw LLM response: {}", response);
            throw new LlmParseException("LLM response is not valid JSON: " + e.getMessage(), e);
        }
    }

    /** Plain-text completion. */
    public String textCall(String systemPrompt, String userPrompt) {
        return call(systemPrompt, userPrompt, "text").trim();
    }

    private String call(String systemPrompt, String userPrompt, String label) {
        log.info("LLM call started -> {}", label);
        long start = System.currentTimeMillis();
        String response = chatClient.prompt()
                .system(systemPrompt)
                .user(userPrompt)
                .call()
                .content();
        long elapsed = System.currentTimeMillis() - start;
        log.info("LLM call complete -> {} ({}s)", label, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("LLM returned empty content for " + label
                    + ". Check that the model is running and reachable.");
        }
        return response;
    }

    private <T> T parseWithJackson(String json, Class<T> outputType) {
        try {
            T result = lenientMapper.readValue(stripCodeFences(json), outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing failed for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), e);
        }
    }

    static String stripCodeFences(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }
}
