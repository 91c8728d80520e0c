package com.inboxpilot.core.llm;

import com.inboxpilot.integration.IntegrationException;

/**
 * Thrown when model output cannot be parsed into the expected type or into JSON at all.
 */
public class LlmParseException extends IntegrationException {

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
