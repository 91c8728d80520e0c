package com.inboxpilot.core.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxpilot.core.model.MeetingRequest;
import com.inboxpilot.core.model.TimeSlot;
import com.inboxpilot.integration.ClassificationException;
import com.inboxpilot.integration.ClassificationPrompt;
import com.inboxpilot.integration.ClassificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Second opinion on a slot the deterministic detector found free.
 * <p>
 * Expected shape:
 * <pre>
 * { "route": "review", "confidence": 0.9, "detected_conflicts": [] }
 * </pre>
 * Anything malformed routes to {@code exit}, so a broken classifier never leads to a booking.
 */
@Component
public class BookingRouteClassifier {

    private static final Logger log = LoggerFactory.getLogger(BookingRouteClassifier.class);

    static final String INSTRUCTIONS = """
            A meeting was requested and the calendar shows the slot as free.
            Decide whether the booking should be proposed to a human for approval.
            Answer "exit" when the requirements are contradictory, the time is ambiguous,
            or the notes mention a conflict the calendar does not show.
            Return JSON with:
            - route: "review" or "exit"
            - confidence: number between 0 and 1
            - detected_conflicts: array of short descriptions, empty when none
            """;

    private final ClassificationService classificationService;

    public BookingRouteClassifier(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    public BookingRoute classify(MeetingRequest meeting, TimeSlot slot) {
        var promptContext = new LinkedHashMap<String, Object>();
        promptContext.put("title", meeting.title());
        promptContext.put("start", slot.start().toString());
        promptContext.put("end", slot.end().toString());
        promptContext.put("attendees", meeting.attendees());
        promptContext.put("requirements", meeting.notes());
        JsonNode response;
        try {
            response = classificationService.classify(new ClassificationPrompt(
                    ClassificationPrompt.Purpose.BOOKING_ROUTING, INSTRUCTIONS, promptContext));
        } catch (ClassificationException e) {
            log.warn("Booking classification call failed: {}", e.getMessage());
            return BookingRoute.exit("classification call failed");
        }
        return validate(response).asOptional()
                .orElseGet(() -> BookingRoute.exit("malformed booking classification"));
    }

    ClassificationResult<BookingRoute> validate(JsonNode response) {
        if (response == null || !response.isObject()) {
            return ClassificationResult.invalid("response is not a JSON object");
        }
        String route = JsonFields.text(response, "route").trim().toLowerCase();
        if (!route.equals("review") && !route.equals("exit")) {
            return ClassificationResult.invalid("route must be 'review' or 'exit', got '" + route + "'");
        }
        OptionalDouble confidence = JsonFields.confidence(response);
        if (confidence.isPresent() && Double.isNaN(confidence.getAsDouble())) {
            return ClassificationResult.invalid("confidence is not a number in [0, 1]");
        }
        List<String> conflicts = new ArrayList<>();
        JsonNode conflictsNode = response.get("detected_conflicts");
        if (conflictsNode != null && !conflictsNode.isNull()) {
            if (!conflictsNode.isArray()) {
                return ClassificationResult.invalid("detected_conflicts is not an array");
            }
            conflictsNode.forEach(entry -> conflicts.add(entry.asText()));
        }
        return ClassificationResult.valid(new BookingRoute(route.equals("review"), confidence.orElse(0.5), conflicts));
    }
}
