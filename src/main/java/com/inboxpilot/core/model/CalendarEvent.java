package com.inboxpilot.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * An existing calendar entry. The subject is private to the calendar owner.
 */
public record CalendarEvent(
        String id,
        String subject,
        LocalDateTime start,
        LocalDateTime end
) implements Serializable {

    public TimeSlot slot() {
        return new TimeSlot(start, end);
    }
}
