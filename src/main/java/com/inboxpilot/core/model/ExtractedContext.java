package com.inboxpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Structured facts the parser derives from the request.
 */
public record ExtractedContext(
        List<String> keyEntities,
        List<String> dates,
        List<String> requestedActions,
        String urgency,
        String sentiment,
        boolean meetingRequested
) implements Serializable {

    public ExtractedContext {
        keyEntities = keyEntities == null ? List.of() : List.copyOf(keyEntities);
        dates = dates == null ? List.of() : List.copyOf(dates);
        requestedActions = requestedActions == null ? List.of() : List.copyOf(requestedActions);
        urgency = urgency == null || urgency.isBlank() ? "medium" : urgency;
        sentiment = sentiment == null || sentiment.isBlank() ? "neutral" : sentiment;
    }
}
