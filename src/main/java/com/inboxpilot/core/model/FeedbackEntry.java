package com.inboxpilot.core.model;

import java.io.Serializable;

/**
 * One classified round of reviewer feedback.
 */
public record FeedbackEntry(
        int epoch,
        String text,
        FeedbackDomain domain,
        FeedbackDecision decision,
        String instructions
) implements Serializable {}
