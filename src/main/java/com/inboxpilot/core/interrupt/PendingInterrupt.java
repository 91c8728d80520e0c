package com.inboxpilot.core.interrupt;

import java.io.Serializable;
import java.time.Instant;

/**
 * The interrupt a suspended conversation is waiting on. {@link #none()} marks "not waiting".
 */
public record PendingInterrupt(
        InterruptPoint point,
        ActionRequest request,
        int epoch,
        Instant raisedAt,
        Instant deadline
) implements Serializable {

    private static final PendingInterrupt NONE =
            new PendingInterrupt(InterruptPoint.NONE, null, 0, null, null);

    public static PendingInterrupt none() {
        return NONE;
    }

    public boolean isActive() {
        return point != null && point != InterruptPoint.NONE;
    }

    public boolean isExpired(Instant now) {
        return isActive() && deadline != null && !now.isBefore(deadline);
    }
}
