package com.inboxpilot.core.llm;

import com.inboxpilot.integration.IntegrationException;

/**
 * Thrown when the model returns null or blank content.
 */
public class LlmEmptyResponseException extends IntegrationException {

    public LlmEmptyResponseException(String message) {
        super(message);
    }
}
