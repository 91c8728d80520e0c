package com.inboxpilot.core.interrupt;

import java.io.Serializable;

/**
 * How an interrupt was resolved. Kept in state so the stage that raised it can
 * continue from where it suspended.
 */
public record InterruptResolution(
        InterruptPoint point,
        ResolutionKind kind,
        String feedback,
        int epoch
) implements Serializable {

    private static final InterruptResolution NONE =
            new InterruptResolution(InterruptPoint.NONE, ResolutionKind.NONE, "", 0);

    public static InterruptResolution none() {
        return NONE;
    }

    public boolean isPresent() {
        return kind != ResolutionKind.NONE;
    }

    public boolean isFor(InterruptPoint target) {
        return isPresent() && point == target;
    }
}
