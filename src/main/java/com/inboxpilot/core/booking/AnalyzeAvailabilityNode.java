package com.inboxpilot.core.booking;

import com.inboxpilot.core.model.BookingStatus;
import com.inboxpilot.core.model.CalendarEvent;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.model.SchedulingOutcome;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TimeSlot;
import com.inboxpilot.core.routing.BookingRoute;
import com.inboxpilot.core.routing.BookingRouteClassifier;
import com.inboxpilot.integration.CalendarException;
import com.inboxpilot.integration.CalendarService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks the requested slot against the calendar.
 * <p>
 * A deterministic overlap always wins: the slot is reported as a conflict with two alternatives
 * and the classifier is not consulted. Only a free slot is offered to the classifier, and only a
 * {@code review} verdict leads on to booking review. Event subjects never appear in the
 * transcript; they are carried in {@code withheldSubjects} so the draft can be scrubbed.
 */
@Component
public class AnalyzeAvailabilityNode {

    private static final Logger log = LoggerFactory.getLogger(AnalyzeAvailabilityNode.class);

    private final CalendarService calendar;
    private final ConflictDetector conflictDetector;
    private final AlternativeSlotPlanner slotPlanner;
    private final BookingRouteClassifier routeClassifier;

    public AnalyzeAvailabilityNode(CalendarService calendar,
                                   ConflictDetector conflictDetector,
                                   AlternativeSlotPlanner slotPlanner,
                                   BookingRouteClassifier routeClassifier) {
        this.calendar = calendar;
        this.conflictDetector = conflictDetector;
        this.slotPlanner = slotPlanner;
        this.routeClassifier = routeClassifier;
    }

    public Map<String, Object> apply(BookingState state) {
        MeetingRequest meeting = state.meeting();
        if (!meeting.requested()) {
            return exit(SchedulingOutcome.notRequested(), "availability: no meeting requested");
        }
        if (!meeting.hasConcreteTime()) {
            var outcome = new SchedulingOutcome(BookingStatus.UNRESOLVED, meeting, null, null, List.of(),
                    List.of(), List.of(), null, null, "Meeting requested without a concrete time");
            return exit(outcome, "availability: no concrete time");
        }

        TimeSlot requested = meeting.slot();
        List<CalendarEvent> events;
        try {
            events = calendar.listEvents(requested.start().toLocalDate().atStartOfDay(),
                    requested.end().toLocalDate().plusDays(1).atStartOfDay());
        } catch (CalendarException e) {
            log.warn("Calendar lookup failed: {}", e.getMessage());
            var outcome = new SchedulingOutcome(BookingStatus.FAILED, meeting, requested, null, List.of(),
                    List.of(), List.of(), null, null, "Calendar unavailable");
            var update = exit(outcome, "availability: calendar lookup failed");
            update.put(BookingState.ERRORS, List.of(StageError.of(StageKind.SCHEDULING, ErrorKind.EXTERNAL_SERVICE,
                    "Calendar lookup failed: " + e.getMessage())));
            return update;
        }

        List<CalendarEvent> conflicts = conflictDetector.conflicts(requested, events);
        if (!conflicts.isEmpty()) {
            CalendarEvent blocking = conflicts.get(0);
            var alternatives = slotPlanner.alternatives(requested, blocking);
            log.info("Requested slot {} conflicts with {} event(s); proposing {}",
                    requested.start(), conflicts.size(), alternatives);
            var outcome = new SchedulingOutcome(BookingStatus.CONFLICT, meeting, requested, blocking.slot(),
                    alternatives, List.of("calendar: " + conflicts.size() + " overlapping event(s)"),
                    conflicts.stream().map(CalendarEvent::subject).toList(), null, null,
                    "Requested time is unavailable");
            return exit(outcome, "availability: conflict with " + conflicts.size() + " event(s)");
        }

        BookingRoute route = routeClassifier.classify(meeting, requested);
        if (!route.review()) {
            log.info("Slot {} is free but the booking classifier declined review: {}",
                    requested.start(), route.detectedConflicts());
            var outcome = new SchedulingOutcome(BookingStatus.UNRESOLVED, meeting, requested, null, List.of(),
                    route.detectedConflicts(), List.of(), null, null, "Booking not proposed");
            return exit(outcome, "availability: classifier routed to exit");
        }
        var outcome = new SchedulingOutcome(BookingStatus.AVAILABLE, meeting, requested, null, List.of(),
                List.of(), List.of(), null, null, "Requested time is available");
        var update = new HashMap<String, Object>();
        update.put(BookingState.OUTCOME, outcome);
        update.put(BookingState.ROUTE, BookingState.ROUTE_REVIEW);
        update.put(BookingState.TRANSCRIPT, List.of("availability: slot free, routed to review"));
        return update;
    }

    private static Map<String, Object> exit(SchedulingOutcome outcome, String line) {
        var update = new HashMap<String, Object>();
        update.put(BookingState.OUTCOME, outcome);
        update.put(BookingState.ROUTE, BookingState.ROUTE_EXIT);
        update.put(BookingState.TRANSCRIPT, List.of(line));
        return update;
    }
}
