package com.inboxpilot.core.interrupt;

/**
 * Terminal states of one interrupt.
 */
public enum ResolutionKind {
    NONE,
    APPROVED,
    REJECTED,
    MODIFIED,
    EDITED,
    NO_RESPONSE;

    public boolean carriesFeedback() {
        return this == MODIFIED || this == EDITED;
    }
}
