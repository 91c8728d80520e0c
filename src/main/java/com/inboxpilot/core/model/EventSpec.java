package com.inboxpilot.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Event to create in the calendar.
 */
public record EventSpec(
        String title,
        LocalDateTime start,
        LocalDateTime end,
        List<String> attendees,
        String description
) implements Serializable {}
