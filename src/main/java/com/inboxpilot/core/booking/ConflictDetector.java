package com.inboxpilot.core.booking;

import com.inboxpilot.core.model.CalendarEvent;
import com.inboxpilot.core.model.TimeSlot;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Half-open interval overlap between a requested slot and existing events:
 * {@code start < e.end && start + duration > e.start}. Back-to-back events do not conflict.
 * Conflicts come back earliest first, so the first one is the blocking event.
 */
@Component
public class ConflictDetector {

    public List<CalendarEvent> conflicts(TimeSlot requested, List<CalendarEvent> events) {
        return events.stream()
                .filter(event -> requested.overlaps(event.slot()))
                .sorted(Comparator.comparing(CalendarEvent::start).thenComparing(CalendarEvent::end))
                .toList();
    }
}
