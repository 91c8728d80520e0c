package com.inboxpilot.core.booking;

import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.BookingStatus;
import com.inboxpilot.core.model.CreatedEvent;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.EventSpec;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.persistence.SideEffectLedger;
import com.inboxpilot.integration.CalendarException;
import com.inboxpilot.integration.CalendarService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the approved event at most once per conversation epoch.
 * <p>
 * The ledger entry is reserved before the calendar call and completed after it. A reservation
 * left behind by a crash is reported as an unknown outcome rather than retried.
 */
@Component
public class BookEventNode {

    private static final Logger log = LoggerFactory.getLogger(BookEventNode.class);

    private final CalendarService calendar;
    private final SideEffectLedger ledger;
    private final InboxMetrics metrics;

    public BookEventNode(CalendarService calendar, SideEffectLedger ledger, InboxMetrics metrics) {
        this.calendar = calendar;
        this.ledger = ledger;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(BookingState state) {
        var outcome = state.outcome();
        String key = state.conversationId() + ":" + state.epoch() + ":book";
        var update = new HashMap<String, Object>();
        update.put(BookingState.ROUTE, BookingState.ROUTE_EXIT);

        var existing = ledger.find(key);
        if (existing.isPresent()) {
            var entry = existing.get();
            if (entry.state() == SideEffectLedger.State.COMPLETED) {
                log.info("Event for {} already created ({}); not booking again", key, entry.result());
                metrics.recordSideEffect("book", "duplicate");
                update.put(BookingState.OUTCOME, outcome.withEvent(new CreatedEvent(entry.result(), null)));
                update.put(BookingState.TRANSCRIPT, List.of("book: already booked"));
                return update;
            }
            log.warn("Booking {} was reserved but never completed; outcome unknown", key);
            update.put(BookingState.OUTCOME, outcome.withStatus(BookingStatus.FAILED, "Booking outcome unknown"));
            update.put(BookingState.ERRORS, List.of(StageError.of(StageKind.SCHEDULING, ErrorKind.EXTERNAL_SERVICE,
                    "Booking " + key + " outcome unknown")));
            update.put(BookingState.TRANSCRIPT, List.of("book: outcome unknown"));
            return update;
        }

        if (!ledger.reserve(key)) {
            metrics.recordSideEffect("book", "duplicate");
            update.put(BookingState.OUTCOME, outcome.withStatus(BookingStatus.FAILED, "Booking already in progress"));
            update.put(BookingState.ERRORS, List.of(StageError.of(StageKind.SCHEDULING, ErrorKind.EXTERNAL_SERVICE,
                    "Booking " + key + " is already in progress")));
            update.put(BookingState.TRANSCRIPT, List.of("book: concurrent attempt"));
            return update;
        }

        var meeting = state.meeting();
        var slot = outcome.requestedSlot();
        var spec = new EventSpec(meeting.title(), slot.start(), slot.end(), meeting.attendees(), meeting.notes());
        try {
            CreatedEvent created = calendar.createEvent(spec);
            ledger.complete(key, created.id());
            metrics.recordSideEffect("book", "executed");
            log.info("Booked '{}' at {} as {}", meeting.title(), slot.start(), created.id());
            update.put(BookingState.OUTCOME, outcome.withEvent(created));
            update.put(BookingState.TRANSCRIPT, List.of("book: event created"));
        } catch (CalendarException e) {
            ledger.release(key);
            metrics.recordSideEffect("book", "failed");
            log.warn("Event creation failed for {}: {}", key, e.getMessage());
            update.put(BookingState.OUTCOME, outcome.withStatus(BookingStatus.FAILED, "Event creation failed"));
            update.put(BookingState.ERRORS, List.of(StageError.of(StageKind.SCHEDULING, ErrorKind.EXTERNAL_SERVICE,
                    "Event creation failed: " + e.getMessage())));
            update.put(BookingState.TRANSCRIPT, List.of("book: failed"));
        }
        return update;
    }
}
