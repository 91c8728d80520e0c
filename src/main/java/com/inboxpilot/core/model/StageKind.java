package com.inboxpilot.core.model;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Stages the router can dispatch to. {@link #COMPOSE} always closes a routing plan.
 */
public enum StageKind {
    SCHEDULING("scheduling"),
    KNOWLEDGE("knowledge"),
    CONTACT("contact"),
    COMPOSE("compose");

    private static final Map<String, StageKind> ALIASES = Map.of(
            "calendar", SCHEDULING,
            "calendar_agent", SCHEDULING,
            "rag", KNOWLEDGE,
            "rag_agent", KNOWLEDGE,
            "information", KNOWLEDGE,
            "crm", CONTACT,
            "crm_agent", CONTACT,
            "adaptive_writer", COMPOSE,
            "writer", COMPOSE
    );

    private final String wireName;

    StageKind(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Graph node that executes this stage. */
    public String nodeName() {
        return switch (this) {
            case SCHEDULING -> "scheduling";
            case KNOWLEDGE -> "knowledge_lookup";
            case CONTACT -> "contact_lookup";
            case COMPOSE -> "compose_response";
        };
    }

    public boolean isWorker() {
        return this != COMPOSE;
    }

    public static Optional<StageKind> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (StageKind kind : values()) {
            if (kind.wireName.equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.ofNullable(ALIASES.get(key));
    }
}
