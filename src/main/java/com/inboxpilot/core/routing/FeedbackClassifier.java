package com.inboxpilot.core.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxpilot.core.model.FeedbackDecision;
import com.inboxpilot.core.model.FeedbackDomain;
import com.inboxpilot.integration.ClassificationException;
import com.inboxpilot.integration.ClassificationPrompt;
import com.inboxpilot.integration.ClassificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Maps free-form reviewer feedback onto the domain that must change.
 * <p>
 * Expected shape:
 * <pre>
 * { "domain": "scheduling", "decisions": ["modified"], "instructions": "...", "confidence": 0.9 }
 * </pre>
 * {@code decisions} may also be a single {@code decision} string. When several decisions are
 * reported, modification wins over approval.
 */
@Component
public class FeedbackClassifier {

    private static final Logger log = LoggerFactory.getLogger(FeedbackClassifier.class);

    static final String INSTRUCTIONS = """
            A reviewer commented on a draft email reply. Decide what must change.
            Return JSON with:
            - domain: one of "scheduling" (meeting time, booking), "contact" (details about people or companies),
              "information" (facts from documents), "response-only" (wording, tone, length of the reply)
            - decisions: array with any of "approved", "modified", "rejected", "unclear"
            - instructions: the concrete change requested, in one or two sentences
            - confidence: number between 0 and 1
            """;

    private final ClassificationService classificationService;

    public FeedbackClassifier(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    public ClassificationResult<FeedbackClassification> classify(String feedback, String draft, String subject) {
        var promptContext = new LinkedHashMap<String, Object>();
        promptContext.put("feedback", feedback);
        promptContext.put("draft", draft);
        promptContext.put("original_subject", subject);
        JsonNode response;
        try {
            response = classificationService.classify(new ClassificationPrompt(
                    ClassificationPrompt.Purpose.FEEDBACK_ROUTING, INSTRUCTIONS, promptContext));
        } catch (ClassificationException e) {
            log.warn("Feedback classification call failed: {}", e.getMessage());
            return ClassificationResult.invalid("classification call failed: " + e.getMessage());
        }
        return validate(response, feedback);
    }

    ClassificationResult<FeedbackClassification> validate(JsonNode response, String feedback) {
        if (response == null || !response.isObject()) {
            return ClassificationResult.invalid("response is not a JSON object");
        }
        var domain = FeedbackDomain.fromWire(JsonFields.text(response, "domain"));
        if (domain.isEmpty()) {
            return ClassificationResult.invalid("domain missing or unknown: " + response.get("domain"));
        }

        Set<FeedbackDecision> decisions = EnumSet.noneOf(FeedbackDecision.class);
        JsonNode decisionsNode = response.has("decisions") ? response.get("decisions") : response.get("decision");
        if (decisionsNode != null && !decisionsNode.isNull()) {
            if (decisionsNode.isTextual()) {
                FeedbackDecision.fromWire(decisionsNode.asText()).ifPresent(decisions::add);
            } else if (decisionsNode.isArray()) {
                for (JsonNode entry : decisionsNode) {
                    FeedbackDecision.fromWire(entry.asText()).ifPresent(decisions::add);
                }
            } else {
                return ClassificationResult.invalid("decisions is neither a string nor an array");
            }
        }

        OptionalDouble confidence = JsonFields.confidence(response);
        if (confidence.isPresent() && Double.isNaN(confidence.getAsDouble())) {
            return ClassificationResult.invalid("confidence is not a number in [0, 1]");
        }
        String instructions = JsonFields.text(response, "instructions");
        return ClassificationResult.valid(new FeedbackClassification(
                domain.get(),
                decisions.isEmpty() ? FeedbackDecision.MODIFIED : FeedbackDecision.resolve(decisions),
                instructions.isBlank() ? feedback : instructions,
                confidence.orElse(0.5)));
    }
}
