package com.inboxpilot.core.routing;

import java.util.List;

/**
 * Classifier verdict on whether a free slot should go to booking review.
 */
public record BookingRoute(boolean review, double confidence, List<String> detectedConflicts) {

    public BookingRoute {
        detectedConflicts = detectedConflicts == null ? List.of() : List.copyOf(detectedConflicts);
    }

    public static BookingRoute exit(String reason) {
        return new BookingRoute(false, 0.0, List.of(reason));
    }
}
