package com.inboxpilot.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for conversation processing.
 */
@Service
public class InboxMetrics {

    private final MeterRegistry registry;

    public InboxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordStageExecution(String stage, String marker, long ms) {
        Timer.builder("inbox.stage.duration")
                .tag("stage", stage)
                .tag("marker", marker)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordEvent(String eventType) {
        Counter.builder("inbox.events")
                .tag("type", eventType)
                .register(registry)
                .increment();
    }

    public void recordConversationResult(String status) {
        Counter.builder("inbox.conversations.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * Counts router decisions replaced by compose because the candidate stage had
     * already succeeded.
     */
    public void recordRoutingOverride(String stage) {
        Counter.builder("inbox.routing.overrides")
                .description("Router candidates forced to compose by the completion marker rule")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    public void recordClassifierFallback(String purpose) {
        Counter.builder("inbox.classifier.fallbacks")
                .description("Classification responses rejected by schema validation")
                .tag("purpose", purpose)
                .register(registry)
                .increment();
    }

    public void recordInterruptRaised(String point) {
        Counter.builder("inbox.interrupts.raised")
                .tag("point", point)
                .register(registry)
                .increment();
    }

    public void recordInterruptResolved(String point, String resolution) {
        Counter.builder("inbox.interrupts.resolved")
                .tag("point", point)
                .tag("resolution", resolution)
                .register(registry)
                .increment();
    }

    /**
     * @param effect  "send" or "book"
     * @param outcome "executed", "duplicate" or "failed"
     */
    public void recordSideEffect(String effect, String outcome) {
        Counter.builder("inbox.side_effects")
                .tag("effect", effect)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
