package com.inboxpilot.core.nodes;

import com.inboxpilot.core.model.StageError;
import com.inboxpilot.core.model.TaskResult;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * What a stage worker produced. {@link StageExecutor} turns it into a partial state update.
 *
 * @param result   the stage's result bundle, including its completion marker
 * @param errors   errors to append
 * @param messages transcript lines to append
 * @param extra    additional state keys the stage owns (for example the draft)
 */
public record StageOutcome(
        TaskResult result,
        List<StageError> errors,
        List<String> messages,
        Map<String, Object> extra
) {

    public StageOutcome {
        errors = errors == null ? List.of() : List.copyOf(errors);
        messages = messages == null ? List.of() : List.copyOf(messages);
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public static StageOutcome success(TaskResult result, String message) {
        return new StageOutcome(result, List.of(), List.of(message), Map.of());
    }

    public static StageOutcome failure(TaskResult result, StageError error) {
        return new StageOutcome(result, List.of(error), List.of(error.stage() + ": " + error.message()), Map.of());
    }

    public StageOutcome withError(StageError error) {
        var merged = new ArrayList<>(errors);
        merged.add(error);
        return new StageOutcome(result, merged, messages, extra);
    }

    public StageOutcome with(String key, Object value) {
        var merged = new HashMap<>(extra);
        merged.put(key, value);
        return new StageOutcome(result, errors, messages, merged);
    }
}
