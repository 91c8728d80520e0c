package com.inboxpilot.core.model;

import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Result bundle of the scheduling stage.
 * <p>
 * {@code withheldSubjects} lists subjects of conflicting events. They are kept only so the
 * composed draft can be scrubbed of them and must never be shown to the requester.
 */
public record SchedulingOutcome(
        BookingStatus status,
        MeetingRequest meeting,
        TimeSlot requestedSlot,
        TimeSlot conflictWindow,
        List<LocalDateTime> alternatives,
        List<String> detectedConflicts,
        List<String> withheldSubjects,
        String eventId,
        String eventLink,
        String note
) implements Serializable {

    public SchedulingOutcome {
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        detectedConflicts = detectedConflicts == null ? List.of() : List.copyOf(detectedConflicts);
        withheldSubjects = withheldSubjects == null ? List.of() : List.copyOf(withheldSubjects);
        note = note == null ? "" : note;
    }

    public static SchedulingOutcome notRequested() {
        return new SchedulingOutcome(BookingStatus.NOT_REQUESTED, MeetingRequest.none(), null, null,
                List.of(), List.of(), List.of(), null, null, "No meeting requested");
    }

    public SchedulingOutcome withStatus(BookingStatus newStatus, String newNote) {
        return new SchedulingOutcome(newStatus, meeting, requestedSlot, conflictWindow, alternatives,
                detectedConflicts, withheldSubjects, eventId, eventLink, newNote);
    }

    public SchedulingOutcome withEvent(CreatedEvent event) {
        return new SchedulingOutcome(BookingStatus.BOOKED, meeting, requestedSlot, conflictWindow, alternatives,
                detectedConflicts, withheldSubjects, event.id(), event.link(), "Event created");
    }
}
