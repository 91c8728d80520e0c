package com.inboxpilot.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Meeting requirements extracted from the request (and any scheduling feedback).
 *
 * @param requested       whether the request asks for a meeting at all
 * @param title           proposed event title
 * @param start           requested start, null when no concrete time was given
 * @param durationMinutes requested duration
 * @param attendees       attendee addresses
 * @param notes           free-form requirement notes passed to the booking classifier
 */
public record MeetingRequest(
        boolean requested,
        String title,
        LocalDateTime start,
        int durationMinutes,
        List<String> attendees,
        String notes
) implements Serializable {

    public MeetingRequest {
        attendees = attendees == null ? List.of() : List.copyOf(attendees);
        notes = notes == null ? "" : notes;
    }

    public static MeetingRequest none() {
        return new MeetingRequest(false, "", null, 0, List.of(), "");
    }

    public boolean hasConcreteTime() {
        return requested && start != null && durationMinutes > 0;
    }

    public TimeSlot slot() {
        return TimeSlot.of(start, durationMinutes);
    }
}
