package com.inboxpilot.core.booking;

import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.interrupt.ActionRequests;
import com.inboxpilot.core.interrupt.InterruptController;
import com.inboxpilot.core.interrupt.InterruptPoint;
import com.inboxpilot.core.interrupt.ResolutionKind;
import com.inboxpilot.core.model.BookingStatus;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Suspends for booking approval, or applies the decision on the second pass.
 */
@Component
public class BookingReviewNode {

    private final InterruptController interruptController;
    private final InboxProperties properties;

    public BookingReviewNode(InterruptController interruptController, InboxProperties properties) {
        this.interruptController = interruptController;
        this.properties = properties;
    }

    public Map<String, Object> apply(BookingState state) {
        var outcome = state.outcome();
        var update = new HashMap<String, Object>();
        if (!state.hasDecision()) {
            var request = ActionRequests.bookingReview(state.meeting(), outcome,
                    properties.getInterrupt().getBookingTimeout());
            var pending = interruptController.raise(InterruptPoint.BOOKING_REVIEW, request, state.epoch());
            update.put(BookingState.PENDING_INTERRUPT, pending);
            update.put(BookingState.OUTCOME, outcome.withStatus(BookingStatus.AWAITING_APPROVAL,
                    "Waiting for booking approval"));
            update.put(BookingState.ROUTE, BookingState.ROUTE_EXIT);
            update.put(BookingState.TRANSCRIPT, List.of("review: awaiting approval"));
            return update;
        }
        if (state.decision() == ResolutionKind.APPROVED) {
            update.put(BookingState.OUTCOME, outcome.withStatus(BookingStatus.APPROVED, "Booking approved"));
            update.put(BookingState.ROUTE, BookingState.ROUTE_BOOK);
            update.put(BookingState.TRANSCRIPT, List.of("review: approved"));
            return update;
        }
        update.put(BookingState.OUTCOME, outcome.withStatus(BookingStatus.DECLINED, "Booking declined by reviewer"));
        update.put(BookingState.ROUTE, BookingState.ROUTE_EXIT);
        update.put(BookingState.TRANSCRIPT, List.of("review: declined"));
        return update;
    }
}
