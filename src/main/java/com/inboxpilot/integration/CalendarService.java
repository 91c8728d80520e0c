package com.inboxpilot.integration;

import com.inboxpilot.core.model.CalendarEvent;
import com.inboxpilot.core.model.CreatedEvent;
import com.inboxpilot.core.model.EventSpec;

import java.time.LocalDateTime;
import java.util.List;

public interface CalendarService {

    /** Events intersecting {@code [from, to)}. */
    List<CalendarEvent> listEvents(LocalDateTime from, LocalDateTime to) throws CalendarException;

    CreatedEvent createEvent(EventSpec spec) throws CalendarException;
}
