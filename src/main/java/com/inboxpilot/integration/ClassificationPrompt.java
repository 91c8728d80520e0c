package com.inboxpilot.integration;

import java.util.Map;

/**
 * Input to a classification call.
 *
 * @param purpose      which routing decision is being classified
 * @param instructions task-specific instructions, including the expected JSON shape
 * @param context      facts the classifier may use, rendered as JSON
 */
public record ClassificationPrompt(
        Purpose purpose,
        String instructions,
        Map<String, Object> context
) {

    public enum Purpose {
        STAGE_ROUTING,
        FEEDBACK_ROUTING,
        BOOKING_ROUTING
    }
}
