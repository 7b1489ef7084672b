package com.liftlog.projection;

import com.liftlog.aggregate.AggregateEngine;
import com.liftlog.aggregate.CompletedWorkout;
import com.liftlog.store.EventRecord;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Folds one event into a user's views. Pure: the prior snapshot is never
 * modified and nothing is persisted, so the caller decides whether the result
 * is committed.
 *
 * Reducer order matters. Exercise history decides the PR verdict, the current
 * workout reducer copies it onto the set and produces the finished workout,
 * which the history reducer and the aggregate engine then consume.
 */
public class ProjectionEngine {

    private final List<ProjectionReducer<?>> reducers;
    private final AggregateEngine aggregateEngine;

    public ProjectionEngine(List<ProjectionReducer<?>> reducers, AggregateEngine aggregateEngine) {
        this.reducers = List.copyOf(reducers);
        this.aggregateEngine = aggregateEngine;
    }

    public static ProjectionEngine standard(AggregateEngine aggregateEngine) {
        return new ProjectionEngine(List.of(
            new ExerciseHistoryReducer(new PersonalRecordDetector()),
            new CurrentWorkoutReducer(),
            new WorkoutHistoryReducer(),
            new TemplateReducer()
        ), aggregateEngine);
    }

    public AggregateEngine aggregateEngine() {
        return aggregateEngine;
    }

    public Reduction apply(UserViews prior, EventRecord event) {
        ReductionContext context = new ReductionContext(prior);
        UserViews.Builder next = prior.toBuilder();
        for (ProjectionReducer<?> reducer : reducers) {
            applyReducer(reducer, prior, next, event, context);
        }

        Optional<CompletedWorkout> completed = context.completedWorkout().map(ProjectionEngine::toCompletedWorkout);
        completed.ifPresent(workout ->
            next.aggregates(aggregateEngine.applyCompletedWorkout(prior.aggregates(), workout)));

        return new Reduction(next.build(), Collections.unmodifiableMap(new LinkedHashMap<>(context.derived())),
            completed.orElse(null));
    }

    @SuppressWarnings("unchecked")
    private <S> void applyReducer(ProjectionReducer<S> reducer, UserViews prior, UserViews.Builder next,
                                  EventRecord event, ReductionContext context) {
        for (String key : reducer.keysFor(event, context)) {
            Optional<ProjectionEntry> existing = prior.projection(key);
            S state = existing.map(e -> (S) e.data()).orElseGet(() -> reducer.initialState(key));
            S reduced = reducer.reduce(key, state, event, context);
            if (reduced == state) {
                continue;
            }
            if (reduced == null) {
                next.remove(key);
            } else {
                next.put(new ProjectionEntry(key, reduced, event.timestamp()));
            }
        }
    }

    static CompletedWorkout toCompletedWorkout(WorkoutHistoryEntry entry) {
        return new CompletedWorkout(
            entry.workoutId(),
            entry.completedAt(),
            entry.exercises().stream().map(CurrentWorkout.ExerciseEntry::exerciseId).collect(Collectors.toSet()),
            entry.stats().totalSets(),
            entry.stats().totalVolume(),
            entry.stats().prCount());
    }

    /**
     * @param views     the snapshot after the event
     * @param derived   values computed while folding, returned to the emitter
     * @param completed the aggregate contribution when the event finished a workout, else null
     */
    public record Reduction(UserViews views, Map<String, Object> derived, CompletedWorkout completed) {}
}
