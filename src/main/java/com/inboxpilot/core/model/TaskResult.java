package com.inboxpilot.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Per-stage result bundle stored in {@code taskData}. The {@code marker} is the
 * authoritative completion flag for the stage.
 */
public record TaskResult(
        StageKind stage,
        CompletionMarker marker,
        String task,
        String summary,
        List<DirectoryRecord> records,
        SchedulingOutcome scheduling,
        int epoch
) implements Serializable {

    public TaskResult {
        task = task == null ? "" : task;
        summary = summary == null ? "" : summary;
        records = records == null ? List.of() : List.copyOf(records);
    }

    public static TaskResult pending(StageKind stage, String task, int epoch) {
        return new TaskResult(stage, CompletionMarker.PENDING, task, "", List.of(), null, epoch);
    }

    public static TaskResult success(StageKind stage, String task, String summary,
                                     List<DirectoryRecord> records, int epoch) {
        return new TaskResult(stage, CompletionMarker.SUCCESS, task, summary, records, null, epoch);
    }

    public static TaskResult scheduled(String task, SchedulingOutcome outcome, CompletionMarker marker, int epoch) {
        return new TaskResult(StageKind.SCHEDULING, marker, task, outcome.note(), List.of(), outcome, epoch);
    }

    public static TaskResult failed(StageKind stage, String task, String summary, int epoch) {
        return new TaskResult(stage, CompletionMarker.FAILED, task, summary, List.of(), null, epoch);
    }

    public boolean succeeded() {
        return marker == CompletionMarker.SUCCESS;
    }
}
