package com.inboxpilot.core.nodes;

import com.inboxpilot.core.metrics.InboxMetrics;
import com.inboxpilot.core.model.CompletionMarker;
import com.inboxpilot.core.model.ConversationStatus;
import com.inboxpilot.core.model.ErrorKind;
import com.inboxpilot.core.model.FeedbackDecision;
import com.inboxpilot.core.model.FeedbackDomain;
import com.inboxpilot.core.model.FeedbackEntry;
import com.inboxpilot.core.model.InboundEmail;
import com.inboxpilot.core.model.RoutingDecision;
import com.inboxpilot.core.model.RoutingPlan;
import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.StageKind;
import com.inboxpilot.core.model.TaskResult;
import com.inboxpilot.core.routing.FeedbackClassification;
import com.inboxpilot.core.routing.FeedbackClassifier;
import com.inboxpilot.core.routing.StagePlanClassifier;
import com.inboxpilot.core.state.ConversationState;
import com.inboxpilot.integration.ClassificationPrompt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Router: decides which stage runs next.
 * <ol>
 *   <li>Pending feedback is classified onto a domain; only that domain's stage is reopened and
 *       the next epoch's plan is derived from the previous one.</li>
 *   <li>Without a plan for the current epoch the stage classifier builds one.</li>
 *   <li>A worker whose marker is SUCCESS is never dispatched again; compose is forced instead.</li>
 *   <li>Invalid classifier output falls back to compose.</li>
 * </ol>
 * Every stage reports back here, so the routing plan always records what ran in this epoch.
 */
@Component
public class SupervisorNode {

    private static final Logger log = LoggerFactory.getLogger(SupervisorNode.class);

    public static final String ROUTER_VISITS = "router_visits";
    public static final String FEEDBACK_ROUNDS = "feedback_rounds";
    public static final String OVERRIDES = "routing_overrides";

    /** Edge label for a conversation that has to be acknowledged after a failure. */
    public static final String ERROR_ROUTE = "ERROR";

    static final String STAGE = "router";

    private final StagePlanClassifier stagePlanClassifier;
    private final FeedbackClassifier feedbackClassifier;
    private final InboxMetrics metrics;

    public SupervisorNode(StagePlanClassifier stagePlanClassifier,
                          FeedbackClassifier feedbackClassifier,
                          InboxMetrics metrics) {
        this.stagePlanClassifier = stagePlanClassifier;
        this.feedbackClassifier = feedbackClassifier;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(ConversationState state) {
        int epoch = state.epoch();
        var update = new HashMap<String, Object>();
        var messages = new ArrayList<String>();
        var errors = new ArrayList<StageError>();
        var counters = new HashMap<String, Integer>();
        counters.put(ROUTER_VISITS, state.counter(ROUTER_VISITS) + 1);

        if (state.status().isTerminal() || state.status() == ConversationStatus.ERROR) {
            var decision = RoutingDecision.finish("Conversation is " + state.status(), epoch);
            update.put(ConversationState.LAST_DECISION, decision);
            update.put(ConversationState.COUNTERS, counters);
            update.put(ConversationState.MESSAGES, List.of(STAGE + ": " + decision.target().toLowerCase()
                    + " (" + state.status() + ")"));
            return update;
        }

        RoutingPlan plan = state.routingPlan().orElse(null);
        StageKind reopened = null;

        if (state.hasPendingFeedback()) {
            FeedbackClassification classification = classifyFeedback(state, errors);
            reopened = classification.domain().stage().orElse(null);
            RoutingPlan previous = plan != null ? plan : RoutingPlan.composeOnly("", epoch);
            String rationale = "Feedback targets " + classification.domain().wireName()
                    + " (" + classification.decision().name().toLowerCase() + ")";
            plan = previous.nextEpoch(epoch, reopened, classification.instructions(), rationale);
            if (reopened != null) {
                update.put(ConversationState.TASK_DATA,
                        Map.of(reopened, TaskResult.pending(reopened, classification.instructions(), epoch)));
            }
            update.put(ConversationState.PENDING_FEEDBACK, "");
            update.put(ConversationState.FEEDBACK_HISTORY, List.of(new FeedbackEntry(epoch, state.pendingFeedback(),
                    classification.domain(), classification.decision(), classification.instructions())));
            counters.put(FEEDBACK_ROUNDS, state.counter(FEEDBACK_ROUNDS) + 1);
            messages.add(STAGE + ": " + rationale);
            log.info("Epoch {}: {}, reopening {}", epoch, rationale, reopened == null ? "nothing" : reopened.wireName());
        } else if (plan == null || plan.epoch() != epoch) {
            plan = buildPlan(state, epoch, errors);
            messages.add(STAGE + ": planned " + plan.stages().stream().map(StageKind::wireName).toList());
        } else if (plan.inFlightStage().isPresent()) {
            StageKind reported = plan.inFlight();
            plan = plan.reportBack(reported);
            messages.add(STAGE + ": " + reported.wireName() + " reported " + state.marker(reported));
        }

        StageKind candidate = plan.nextPending();
        boolean overridden = false;
        String rationale = plan.rationale();
        if (candidate.isWorker() && effectiveMarker(state, candidate, reopened) == CompletionMarker.SUCCESS) {
            rationale = "Stage " + candidate.wireName() + " already succeeded; composing instead";
            log.info("Routing override: {}", rationale);
            metrics.recordRoutingOverride(candidate.wireName());
            counters.put(OVERRIDES, state.counter(OVERRIDES) + 1);
            overridden = true;
            candidate = StageKind.COMPOSE;
        }
        plan = plan.dispatch(candidate);

        var decision = new RoutingDecision(candidate, rationale, plan.confidence(), overridden, epoch);
        log.info("Routing to {} (epoch {}, overridden={})", candidate.wireName(), epoch, overridden);
        messages.add(STAGE + ": next " + decision.target() + (overridden ? " (override)" : ""));

        update.put(ConversationState.ROUTING_PLAN, plan);
        update.put(ConversationState.LAST_DECISION, decision);
        update.put(ConversationState.COUNTERS, counters);
        update.put(ConversationState.MESSAGES, messages);
        if (!errors.isEmpty()) {
            update.put(ConversationState.ERRORS, errors);
        }
        return update;
    }

    /** Graph edge: node name of the next stage, FINISH, or {@link #ERROR_ROUTE} for a failed conversation. */
    public static String route(ConversationState state) {
        if (state.status() == ConversationStatus.ERROR) {
            return ERROR_ROUTE;
        }
        return state.lastDecision()
                .filter(decision -> !decision.isFinish())
                .map(decision -> decision.next().nodeName())
                .orElse("FINISH");
    }

    private RoutingPlan buildPlan(ConversationState state, int epoch, List<StageError> errors) {
        if (state.extractedContext().isEmpty() || state.request().isEmpty()) {
            log.info("No parsed context; composing with a gap acknowledgment");
            return RoutingPlan.composeOnly("Request context unavailable; acknowledging the gap", epoch);
        }
        var result = stagePlanClassifier.classify(state.request().get(), state.extractedContext().get());
        if (!result.isValid()) {
            log.warn("Stage plan rejected ({}); composing directly", result.failure());
            metrics.recordClassifierFallback(ClassificationPrompt.Purpose.STAGE_ROUTING.name());
            errors.add(new StageError(STAGE, ErrorKind.EXTERNAL_SERVICE, "Invalid stage plan: " + result.failure()));
            return RoutingPlan.composeOnly("Stage classification invalid; composing directly", epoch);
        }
        var stagePlan = result.value();
        return new RoutingPlan(stagePlan.stages(), stagePlan.tasks(), null, -1, null,
                stagePlan.rationale(), stagePlan.confidence(), epoch);
    }

    private FeedbackClassification classifyFeedback(ConversationState state, List<StageError> errors) {
        String feedback = state.pendingFeedback();
        String subject = state.request().map(InboundEmail::subject).orElse("");
        var result = feedbackClassifier.classify(feedback, state.draftOutput(), subject);
        if (result.isValid()) {
            return result.value();
        }
        log.warn("Feedback classification rejected ({}); treating as a wording change", result.failure());
        metrics.recordClassifierFallback(ClassificationPrompt.Purpose.FEEDBACK_ROUTING.name());
        errors.add(new StageError(STAGE, ErrorKind.EXTERNAL_SERVICE, "Invalid feedback classification: "
                + result.failure()));
        return new FeedbackClassification(FeedbackDomain.RESPONSE_ONLY, FeedbackDecision.MODIFIED, feedback, 0.0);
    }

    /** Marker as it will be after this visit's update is merged. */
    private static CompletionMarker effectiveMarker(ConversationState state, StageKind stage, StageKind reopened) {
        return stage == reopened ? CompletionMarker.PENDING : state.marker(stage);
    }
}
