package com.inboxpilot.core.model;

/**
 * Outcome of the booking sub-workflow.
 */
public enum BookingStatus {
    NOT_REQUESTED,
    CONFLICT,
    AVAILABLE,
    AWAITING_APPROVAL,
    APPROVED,
    DECLINED,
    BOOKED,
    UNRESOLVED,
    FAILED;

    public boolean isTerminal() {
        return this != AVAILABLE && this != AWAITING_APPROVAL && this != APPROVED;
    }
}
