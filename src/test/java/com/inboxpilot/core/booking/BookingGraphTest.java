package com.inboxpilot.core.booking;

import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.interrupt.InterruptController;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.interrupt.ResolutionKind;
import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.*;
import com.inboxpilot.core.persistence.InMemorySideEffectLedger;
import com.inboxpilot.core.routing.BookingRoute;
import com.inboxpilot.core.routing.BookingRouteClassifier;
import com.inboxpilot.integration.CalendarException;
import com.inboxpilot.integration.CalendarService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs the nested booking workflow with a mocked calendar and booking classifier.
 */
class BookingGraphTest {

    private static final LocalDateTime TEN = LocalDateTime.of(2025, 3, 4, 10, 0);

    private CalendarService calendar;
    private BookingRouteClassifier classifier;
    private BookingGraph bookingGraph;

    @BeforeEach
    void setUp() throws Exception {
        calendar = mock(CalendarService.class);
        classifier = mock(BookingRouteClassifier.class);
        var metrics = new InboxMetrics(new SimpleMeterRegistry());
        var properties = new InboxProperties();
        var clock = Clock.fixed(Instant.parse("2025-03-03T08:00:00Z"), ZoneOffset.UTC);
        var interrupts = new InterruptController(clock, metrics);

        bookingGraph = new BookingGraph(
                new AnalyzeAvailabilityNode(calendar, new ConflictDetector(), new AlternativeSlotPlanner(properties), classifier),
                new BookingReviewNode(interrupts, properties),
                new BookEventNode(calendar, new InMemorySideEffectLedger(), metrics));
    }

    private static MeetingRequest meeting(LocalDateTime start) {
        return new MeetingRequest(true, "Contract review", start, 60, List.of("dana@example.com"), "");
    }

    @Nested
    @DisplayName("First pass")
    class Analyze {

        @Test
        @DisplayName("a calendar conflict proposes alternatives without consulting the classifier")
        void conflictShortCircuits() {
            when(calendar.listEvents(any(), any())).thenReturn(List.of(
                    new CalendarEvent("e1", "Board: Project Falcon", TEN.minusMinutes(30), TEN.plusMinutes(30))));

            var result = bookingGraph.analyze("CONV-1", 1, meeting(TEN), "");

            var outcome = result.outcome();
            assertEquals(BookingStatus.CONFLICT, outcome.status());
            assertEquals(List.of(TEN.plusMinutes(30), TEN.plusHours(2)), outcome.alternatives());
            assertEquals(List.of("Board: Project Falcon"), outcome.withheldSubjects());
            assertFalse(result.state().pendingInterrupt().isActive());
            assertTrue(result.state().transcript().stream().noneMatch(line -> line.contains("Falcon")));
            verify(classifier, never()).classify(any(), any());
        }

        @Test
        @DisplayName("a free slot with a review verdict suspends for booking approval")
        void freeSlotGoesToReview() {
            when(calendar.listEvents(any(), any())).thenReturn(List.of(
                    new CalendarEvent("e1", "Standup", TEN.minusMinutes(30), TEN)));
            when(classifier.classify(any(), any())).thenReturn(new BookingRoute(true, 0.9, List.of()));

            var result = bookingGraph.analyze("CONV-1", 1, meeting(TEN), "");

            assertEquals(BookingStatus.AWAITING_APPROVAL, result.outcome().status());
            var pending = result.state().pendingInterrupt();
            assertEquals(InterruptPoint.BOOKING_REVIEW, pending.point());
            assertEquals(1, pending.epoch());
            assertNotNull(pending.deadline());
            assertFalse(pending.request().allowEdit());
            verify(calendar, never()).createEvent(any());
        }

        @Test
        @DisplayName("a free slot with an exit verdict is left unresolved")
        void freeSlotExit() {
            when(calendar.listEvents(any(), any())).thenReturn(List.of());
            when(classifier.classify(any(), any())).thenReturn(BookingRoute.exit("ambiguous time"));

            var result = bookingGraph.analyze("CONV-1", 1, meeting(TEN), "");

            assertEquals(BookingStatus.UNRESOLVED, result.outcome().status());
            assertFalse(result.state().pendingInterrupt().isActive());
        }

        @Test
        @DisplayName("no meeting requested skips the calendar")
        void notRequested() {
            var result = bookingGraph.analyze("CONV-1", 1, MeetingRequest.none(), "");

            assertEquals(BookingStatus.NOT_REQUESTED, result.outcome().status());
            verifyNoInteractions(calendar);
        }

        @Test
        @DisplayName("a meeting without a concrete time is unresolved")
        void noConcreteTime() {
            var result = bookingGraph.analyze("CONV-1", 1, meeting(null), "");

            assertEquals(BookingStatus.UNRESOLVED, result.outcome().status());
            verifyNoInteractions(calendar);
        }

        @Test
        @DisplayName("a calendar failure is recorded as an external service error")
        void calendarFailure() {
            when(calendar.listEvents(any(), any())).thenThrow(new CalendarException("timeout"));

            var result = bookingGraph.analyze("CONV-1", 1, meeting(TEN), "");

            assertEquals(BookingStatus.FAILED, result.outcome().status());
            assertEquals(1, result.state().errors().size());
            assertEquals(ErrorKind.EXTERNAL_SERVICE, result.state().errors().get(0).kind());
        }
    }

    @Nested
    @DisplayName("Resumed pass")
    class Decide {

        private SchedulingOutcome awaiting() {
            var slot = TimeSlot.of(TEN, 60);
            return new SchedulingOutcome(BookingStatus.AWAITING_APPROVAL, meeting(TEN), slot, null, List.of(),
                    List.of(), List.of(), null, null, "Waiting for booking approval");
        }

        @Test
        @DisplayName("approval creates the event exactly once per epoch")
        void approvalBooksOnce() {
            when(calendar.createEvent(any())).thenReturn(new CreatedEvent("evt-7", "https://calendar/evt-7"));

            var first = bookingGraph.decide("CONV-1", 1, awaiting(), ResolutionKind.APPROVED);
            var second = bookingGraph.decide("CONV-1", 1, awaiting(), ResolutionKind.APPROVED);

            assertEquals(BookingStatus.BOOKED, first.outcome().status());
            assertEquals("evt-7", first.outcome().eventId());
            assertEquals(BookingStatus.BOOKED, second.outcome().status());
            assertEquals("evt-7", second.outcome().eventId());
            verify(calendar, times(1)).createEvent(any());
        }

        @Test
        @DisplayName("the created event uses the requested slot and attendees")
        void eventSpec() {
            when(calendar.createEvent(any())).thenReturn(new CreatedEvent("evt-1", null));

            bookingGraph.decide("CONV-1", 1, awaiting(), ResolutionKind.APPROVED);

            verify(calendar).createEvent(new EventSpec("Contract review", TEN, TEN.plusHours(1),
                    List.of("dana@example.com"), ""));
        }

        @Test
        @DisplayName("a declined booking never touches the calendar")
        void declineSkipsCalendar() {
            var result = bookingGraph.decide("CONV-1", 1, awaiting(), ResolutionKind.REJECTED);

            assertEquals(BookingStatus.DECLINED, result.outcome().status());
            verifyNoInteractions(calendar);
        }
    }
}
