package com.inboxpilot.core.model;

import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Decision the feedback classifier reads from free-form reviewer text.
 * When several are reported at once, {@link #resolve} picks by precedence:
 * modification wins over approval.
 */
public enum FeedbackDecision {
    MODIFIED,
    REJECTED,
    APPROVED,
    UNCLEAR;

    public static FeedbackDecision resolve(Collection<FeedbackDecision> decisions) {
        for (FeedbackDecision candidate : values()) {
            if (decisions.contains(candidate)) {
                return candidate;
            }
        }
        return UNCLEAR;
    }

    public static Optional<FeedbackDecision> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "modified", "modify", "edit", "edited" -> Optional.of(MODIFIED);
            case "rejected", "reject" -> Optional.of(REJECTED);
            case "approved", "approve", "accept" -> Optional.of(APPROVED);
            case "unclear" -> Optional.of(UNCLEAR);
            default -> Optional.empty();
        };
    }
}
