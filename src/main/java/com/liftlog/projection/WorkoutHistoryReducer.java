package com.liftlog.projection;

import com.liftlog.contract.EventType;
import com.liftlog.store.EventRecord;

import java.util.ArrayList;
import java.util.List;

/** Completed workouts, newest first. Discarded workouts never appear. */
public class WorkoutHistoryReducer implements ProjectionReducer<List<WorkoutHistoryEntry>> {

    @Override
    public List<String> keysFor(EventRecord event, ReductionContext context) {
        if (event.type() == EventType.WORKOUT_COMPLETED && context.completedWorkout().isPresent()) {
            return List.of(ProjectionKeys.WORKOUT_HISTORY);
        }
        return List.of();
    }

    @Override
    public List<WorkoutHistoryEntry> initialState(String key) {
        return List.of();
    }

    @Override
    public List<WorkoutHistoryEntry> reduce(String key, List<WorkoutHistoryEntry> prior, EventRecord event,
                                            ReductionContext context) {
        List<WorkoutHistoryEntry> next = new ArrayList<>(prior.size() + 1);
        next.add(context.completedWorkout().orElseThrow());
        next.addAll(prior);
        return List.copyOf(next);
    }
}
