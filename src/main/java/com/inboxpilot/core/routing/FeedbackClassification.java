package com.inboxpilot.core.routing;

import com.inboxpilot.core.model.FeedbackDecision;
import com.inboxpilot.core.model.FeedbackDomain;

/**
 * Validated feedback-classifier output.
 *
 * @param domain       domain whose stage must be redone
 * @param decision     resolved reviewer decision
 * @param instructions what to change, used as the redone stage's task
 * @param confidence   classifier confidence
 */
public record FeedbackClassification(
        FeedbackDomain domain,
        FeedbackDecision decision,
        String instructions,
        double confidence
) {}
