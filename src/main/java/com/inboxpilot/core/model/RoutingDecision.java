package com.inboxpilot.core.model;

import java.io.Serializable;

/**
 * Router output: the next stage, or FINISH when {@code next} is null.
 */
public record RoutingDecision(
        StageKind next,
        String rationale,
        double confidence,
        boolean overridden,
        int epoch
) implements Serializable {

    public static RoutingDecision finish(String rationale, int epoch) {
        return new RoutingDecision(null, rationale, 1.0, false, epoch);
    }

    public boolean isFinish() {
        return next == null;
    }

    public String target() {
        return next == null ? "FINISH" : next.wireName();
    }
}
