package com.inboxpilot.integration.local;

import com.inboxpilot.core.model.CalendarEvent;
import com.inboxpilot.core.model.CreatedEvent;
import com.inboxpilot.core.model.EventSpec;
import com.inboxpilot.core.model.TimeSlot;
import com.inboxpilot.integration.CalendarException;
import com.inboxpilot.integration.CalendarService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calendar kept in process memory, used in local mode and tests.
 */
public class InMemoryCalendarService implements CalendarService {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCalendarService.class);

    private final CopyOnWriteArrayList<CalendarEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger counter = new AtomicInteger(0);

    public InMemoryCalendarService() {}

    public InMemoryCalendarService(List<CalendarEvent> initialEvents) {
        events.addAll(initialEvents);
    }

    @Override
    public List<CalendarEvent> listEvents(LocalDateTime from, LocalDateTime to) {
        var window = new TimeSlot(from, to);
        return events.stream()
                .filter(event -> event.slot().overlaps(window))
                .sorted(Comparator.comparing(CalendarEvent::start))
                .toList();
    }

    @Override
    public CreatedEvent createEvent(EventSpec spec) {
        if (spec.start() == null || spec.end() == null || !spec.end().isAfter(spec.start())) {
            throw new CalendarException("Invalid event window: " + spec.start() + " - " + spec.end());
        }
        String id = "evt-" + counter.incrementAndGet();
        events.add(new CalendarEvent(id, spec.title(), spec.start(), spec.end()));
        log.info("Created local calendar event {} '{}' at {}", id, spec.title(), spec.start());
        return new CreatedEvent(id, "local://calendar/" + id);
    }

    public List<CalendarEvent> events() {
        return List.copyOf(events);
    }
}
