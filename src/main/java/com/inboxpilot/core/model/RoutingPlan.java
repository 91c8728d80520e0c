package com.inboxpilot.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered stage list for one routing epoch plus its bookkeeping.
 * <p>
 * {@code completed} is routing bookkeeping only; the authoritative completion flag of a
 * stage lives in its {@link TaskResult}. The stage list always ends with {@link StageKind#COMPOSE}.
 *
 * @param stages       ordered, duplicate-free stages, ending with COMPOSE
 * @param tasks        per-stage task description
 * @param completed    stages that reported back in this epoch (or were carried over)
 * @param currentIndex index of the stage last dispatched, -1 before the first dispatch
 * @param inFlight     stage dispatched and not yet reported back, null when none
 * @param rationale    classifier rationale or fallback reason
 * @param confidence   classifier confidence in [0, 1]
 * @param epoch        routing epoch this plan belongs to
 */
public record RoutingPlan(
        List<StageKind> stages,
        Map<StageKind, String> tasks,
        Set<StageKind> completed,
        int currentIndex,
        StageKind inFlight,
        String rationale,
        double confidence,
        int epoch
) implements Serializable {

    public RoutingPlan {
        var ordered = new LinkedHashSet<StageKind>(stages == null ? List.of() : stages);
        ordered.remove(StageKind.COMPOSE);
        var normalized = new ArrayList<>(ordered);
        normalized.add(StageKind.COMPOSE);
        stages = List.copyOf(normalized);
        tasks = tasks == null ? Map.of() : Map.copyOf(tasks);
        completed = completed == null ? Set.of() : Set.copyOf(completed);
        rationale = rationale == null ? "" : rationale;
    }

    public static RoutingPlan composeOnly(String rationale, int epoch) {
        return new RoutingPlan(List.of(StageKind.COMPOSE), Map.of(), Set.of(), -1, null, rationale, 0.0, epoch);
    }

    public String taskFor(StageKind stage) {
        return tasks.getOrDefault(stage, "");
    }

    /** First planned stage that has not reported back, COMPOSE when all workers have. */
    public StageKind nextPending() {
        if (allWorkersCompleted()) {
            return StageKind.COMPOSE;
        }
        for (StageKind stage : stages) {
            if (!completed.contains(stage)) {
                return stage;
            }
        }
        return StageKind.COMPOSE;
    }

    public boolean allWorkersCompleted() {
        return stages.stream().filter(StageKind::isWorker).allMatch(completed::contains);
    }

    public Optional<StageKind> inFlightStage() {
        return Optional.ofNullable(inFlight);
    }

    public RoutingPlan dispatch(StageKind stage) {
        return new RoutingPlan(stages, tasks, completed, stages.indexOf(stage), stage, rationale, confidence, epoch);
    }

    public RoutingPlan reportBack(StageKind stage) {
        Set<StageKind> done = copyOf(completed);
        done.add(stage);
        return new RoutingPlan(stages, tasks, done, currentIndex, null, rationale, confidence, epoch);
    }

    /**
     * Plan for the next epoch. Completed stages carry over except {@code redo}, which is
     * reopened (and added to the stage list when it was not planned before) with the new task.
     */
    public RoutingPlan nextEpoch(int newEpoch, StageKind redo, String redoTask, String newRationale) {
        Set<StageKind> done = copyOf(completed);
        done.remove(StageKind.COMPOSE);
        List<StageKind> newStages = new ArrayList<>(stages);
        Map<StageKind, String> newTasks = new EnumMap<>(StageKind.class);
        newTasks.putAll(tasks);
        if (redo != null) {
            done.remove(redo);
            if (!newStages.contains(redo)) {
                newStages.add(0, redo);
            }
            newTasks.put(redo, redoTask);
        }
        return new RoutingPlan(newStages, newTasks, done, -1, null, newRationale, confidence, newEpoch);
    }

    private static Set<StageKind> copyOf(Set<StageKind> source) {
        Set<StageKind> copy = EnumSet.noneOf(StageKind.class);
        copy.addAll(source);
        return copy;
    }
}
