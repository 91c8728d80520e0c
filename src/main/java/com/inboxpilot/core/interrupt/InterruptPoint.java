package com.inboxpilot.core.interrupt;

/**
 * Places where a conversation can suspend for human input.
 */
public enum InterruptPoint {
    NONE,
    DRAFT_REVIEW,
    BOOKING_REVIEW,
    /** A stage failed; the reviewer retries or gives up. */
    ERROR_REVIEW
}
