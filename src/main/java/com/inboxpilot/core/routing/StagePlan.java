package com.inboxpilot.core.routing;

import com.inboxpilot.core.model.StageKind;

import java.util.List;
import java.util.Map;

/**
 * Validated stage-classifier output.
 */
public record StagePlan(
        List<StageKind> stages,
        Map<StageKind, String> tasks,
        String rationale,
        double confidence
) {}
