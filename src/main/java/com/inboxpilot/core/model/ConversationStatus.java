package com.inboxpilot.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Conversation lifecycle status.
 * <p>
 * Within one epoch transitions only move forward. A new epoch (human feedback or an
 * acknowledged error) may reset {@link #AWAITING_REVIEW} or {@link #ERROR} back to {@link #PROCESSING}.
 */
public enum ConversationStatus {
    PROCESSING,
    AWAITING_REVIEW,
    APPROVED,
    REJECTED,
    COMPLETED,
    ERROR;

    public boolean isTerminal() {
        return this == COMPLETED || this == REJECTED;
    }

    /** Same-epoch transition. */
    public boolean canTransitionTo(ConversationStatus next) {
        return allowedNext().contains(next);
    }

    /** Transition into a new epoch, which additionally allows the reset to PROCESSING. */
    public boolean canResetTo(ConversationStatus next) {
        return canTransitionTo(next)
                || (next == PROCESSING && (this == AWAITING_REVIEW || this == ERROR));
    }

    private Set<ConversationStatus> allowedNext() {
        return switch (this) {
            case PROCESSING -> EnumSet.of(PROCESSING, AWAITING_REVIEW, ERROR, REJECTED);
            case AWAITING_REVIEW -> EnumSet.of(AWAITING_REVIEW, APPROVED, REJECTED);
            case ERROR -> EnumSet.of(ERROR, APPROVED, REJECTED);
            case APPROVED -> EnumSet.of(APPROVED, COMPLETED, ERROR);
            case REJECTED -> EnumSet.of(REJECTED);
            case COMPLETED -> EnumSet.of(COMPLETED);
        };
    }
}
