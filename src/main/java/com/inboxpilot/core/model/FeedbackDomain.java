package com.inboxpilot.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Domain a piece of human feedback asks to change.
 */
public enum FeedbackDomain {
    SCHEDULING("scheduling", StageKind.SCHEDULING),
    CONTACT("contact", StageKind.CONTACT),
    INFORMATION("information", StageKind.KNOWLEDGE),
    RESPONSE_ONLY("response-only", null);

    private final String wireName;
    private final StageKind stage;

    FeedbackDomain(String wireName, StageKind stage) {
        this.wireName = wireName;
        this.stage = stage;
    }

    public String wireName() {
        return wireName;
    }

    /** Worker stage to redo, empty when only the draft changes. */
    public Optional<StageKind> stage() {
        return Optional.ofNullable(stage);
    }

    public static Optional<FeedbackDomain> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (FeedbackDomain domain : values()) {
            if (domain.wireName.equals(key)) {
                return Optional.of(domain);
            }
        }
        if (key.equals("response") || key.equals("writer") || key.equals("draft")) {
            return Optional.of(RESPONSE_ONLY);
        }
        if (key.equals("calendar")) {
            return Optional.of(SCHEDULING);
        }
        if (key.equals("knowledge")) {
            return Optional.of(INFORMATION);
        }
        return Optional.empty();
    }
}
