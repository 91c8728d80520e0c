package com.inboxpilot.core.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.inboxpilot.core.model.ExtractedContext;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.integration.ClassificationException;
import com.inboxpilot.integration.ClassificationPrompt;
import com.inboxpilot.integration.ClassificationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Asks the classification service which stages a request needs and validates the answer.
 * <p>
 * Expected shape:
 * <pre>
 * {
 *   "execution_plan": ["scheduling", "contact", "compose"],
 *   "assignments": { "scheduling": { "needed": true, "task": "..." } },
 *   "rationale": "...",
 *   "confidence": 0.8
 * }
 * </pre>
 * Any deviation yields an invalid result; the router then composes directly.
 */
@Component
public class StagePlanClassifier {

    private static final Logger log = LoggerFactory.getLogger(StagePlanClassifier.class);

    static final String INSTRUCTIONS = """
            Decide which stages must run before a reply to this email can be written.
            Stages:
            - "scheduling": the sender asks to meet, book, move or cancel a meeting
            - "knowledge": the reply needs facts from internal documents
            - "contact": the reply needs details about a person or company from the contact directory
            - "compose": writing the reply (always last)
            Return JSON with:
            - execution_plan: ordered array of stage names ending with "compose"
            - assignments: object keyed by stage name, each {"needed": boolean, "task": string}
            - rationale: one sentence
            - confidence: number between 0 and 1
            Use only the stages that are clearly required. A simple acknowledgement needs only "compose".
            """;

    private final ClassificationService classificationService;

    public StagePlanClassifier(ClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    public ClassificationResult<StagePlan> classify(InboundEmail email, ExtractedContext context) {
        var promptContext = new LinkedHashMap<String, Object>();
        promptContext.put("subject", email.subject());
        promptContext.put("body", email.body());
        promptContext.put("requested_actions", context.requestedActions());
        promptContext.put("key_entities", context.keyEntities());
        promptContext.put("dates", context.dates());
        promptContext.put("urgency", context.urgency());
        promptContext.put("meeting_requested", context.meetingRequested());
        JsonNode response;
        try {
            response = classificationService.classify(new ClassificationPrompt(
                    ClassificationPrompt.Purpose.STAGE_ROUTING, INSTRUCTIONS, promptContext));
        } catch (ClassificationException e) {
            log.warn("Stage classification call failed: {}", e.getMessage());
            return ClassificationResult.invalid("classification call failed: " + e.getMessage());
        }
        return validate(response);
    }

    ClassificationResult<StagePlan> validate(JsonNode response) {
        if (response == null || !response.isObject()) {
            return ClassificationResult.invalid("response is not a JSON object");
        }
        JsonNode planNode = response.get("execution_plan");
        if (planNode == null || !planNode.isArray() || planNode.isEmpty()) {
            return ClassificationResult.invalid("execution_plan missing or empty");
        }
        List<StageKind> stages = new ArrayList<>();
        for (JsonNode entry : planNode) {
            if (!entry.isTextual()) {
                return ClassificationResult.invalid("execution_plan entry is not a string: " + entry);
            }
            var stage = StageKind.fromWire(entry.asText());
            if (stage.isEmpty()) {
                return ClassificationResult.invalid("unknown stage '" + entry.asText() + "'");
            }
            if (!stages.contains(stage.get())) {
                stages.add(stage.get());
            }
        }

        Map<StageKind, String> tasks = new EnumMap<>(StageKind.class);
        JsonNode assignments = response.get("assignments");
        if (assignments != null && !assignments.isNull()) {
            if (!assignments.isObject()) {
                return ClassificationResult.invalid("assignments is not an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = assignments.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                var stage = StageKind.fromWire(field.getKey());
                if (stage.isEmpty()) {
                    return ClassificationResult.invalid("unknown stage in assignments '" + field.getKey() + "'");
                }
                JsonNode assignment = field.getValue();
                if (assignment.isTextual()) {
                    tasks.put(stage.get(), assignment.asText());
                } else if (assignment.isObject()) {
                    JsonNode needed = assignment.get("needed");
                    if (needed != null && needed.isBoolean() && !needed.asBoolean()) {
                        stages.remove(stage.get());
                    }
                    tasks.put(stage.get(), JsonFields.text(assignment, "task"));
                } else {
                    return ClassificationResult.invalid("assignment for '" + field.getKey() + "' is malformed");
                }
            }
        }

        OptionalDouble confidence = JsonFields.confidence(response);
        if (confidence.isPresent() && Double.isNaN(confidence.getAsDouble())) {
            return ClassificationResult.invalid("confidence is not a number in [0, 1]");
        }
        return ClassificationResult.valid(new StagePlan(
                stages, tasks, JsonFields.text(response, "rationale"), confidence.orElse(0.5)));
    }
}
