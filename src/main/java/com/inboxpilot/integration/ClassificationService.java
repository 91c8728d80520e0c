package com.inboxpilot.integration;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Returns structured JSON for a routing question. Callers validate the shape and apply
 * their own fallback; implementations only guarantee syntactically valid JSON or an exception.
 */
public interface ClassificationService {

    JsonNode classify(ClassificationPrompt prompt) throws ClassificationException;
}
