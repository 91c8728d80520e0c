package com.inboxpilot.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Half-open interval {@code [start, end)} in the configured zone.
 */
public record TimeSlot(LocalDateTime start, LocalDateTime end) implements Serializable {

    public TimeSlot {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Slot bounds must not be null");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Slot end " + end + " must be after start " + start);
        }
    }

    public static TimeSlot of(LocalDateTime start, int durationMinutes) {
        return new TimeSlot(start, start.plusMinutes(durationMinutes));
    }

    /** Touching intervals do not overlap. */
    public boolean overlaps(TimeSlot other) {
        return start.isBefore(other.end) && end.isAfter(other.start);
    }

    public boolean contains(LocalDateTime instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }
}
