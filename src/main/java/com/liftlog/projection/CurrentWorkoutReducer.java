package com.liftlog.projection;

import com.liftlog.contract.EventPayload;
import com.liftlog.store.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * State machine for the workout in progress: NoWorkout (no row) and Active.
 *
 * Events for a workout that is not the active one leave the state unchanged.
 * Set corrections that point at a set this workout does not hold are accepted
 * but reported as reference misses.
 */
public class CurrentWorkoutReducer implements ProjectionReducer<CurrentWorkout> {

    private static final Logger log = LoggerFactory.getLogger(CurrentWorkoutReducer.class);

    @Override
    public List<String> keysFor(EventRecord event, ReductionContext context) {
        return switch (event.type()) {
            case WORKOUT_STARTED, EXERCISE_ADDED, SET_LOGGED, SET_MODIFIED, SET_DELETED,
                 WORKOUT_COMPLETED, WORKOUT_DISCARDED -> List.of(ProjectionKeys.CURRENT_WORKOUT);
            case TEMPLATE_CREATED, TEMPLATE_UPDATED, TEMPLATE_DELETED -> List.of();
        };
    }

    @Override
    public CurrentWorkout initialState(String key) {
        return null;
    }

    @Override
    public CurrentWorkout reduce(String key, CurrentWorkout prior, EventRecord event, ReductionContext context) {
        EventPayload payload = event.payload();
        if (payload instanceof EventPayload.WorkoutStarted started) {
            return start(started, event);
        }
        if (payload instanceof EventPayload.SetModified modified) {
            return modify(prior, modified, context);
        }
        if (payload instanceof EventPayload.SetDeleted deleted) {
            return delete(prior, deleted, context);
        }
        if (prior == null || !prior.workoutId().equals(workoutIdOf(payload))) {
            log.debug("ignoring {} for inactive workout {}", event.type().getValue(), workoutIdOf(payload));
            return prior;
        }
        if (payload instanceof EventPayload.ExerciseAdded added) {
            return prior.withExercise(added.exerciseId()).withFocus(added.exerciseId());
        }
        if (payload instanceof EventPayload.SetLogged set) {
            Optional<String> target = context.targetExercise(event);
            if (target.isEmpty()) {
                return prior;
            }
            CurrentWorkout.SetEntry entry = new CurrentWorkout.SetEntry(
                event.eventId(), set.weight(), set.reps(), set.unit(), event.timestamp(), context.personalRecord());
            return prior.withSetAppended(target.get(), entry).withFocus(target.get());
        }
        if (payload instanceof EventPayload.WorkoutCompleted completed) {
            context.recordCompletion(new WorkoutHistoryEntry(
                prior.workoutId(), prior.name(), prior.startedAt(), event.timestamp(),
                prior.fromTemplateId(), completed.notes(), prior.exercises(),
                WorkoutStats.of(prior.exercises())));
            return null;
        }
        if (payload instanceof EventPayload.WorkoutDiscarded) {
            return null;
        }
        return prior;
    }

    private CurrentWorkout start(EventPayload.WorkoutStarted started, EventRecord event) {
        CurrentWorkout workout = new CurrentWorkout(
            started.workoutId(), started.name(), event.timestamp(), started.fromTemplateId(),
            FocusResolver.initialFocus(started.exerciseIds()), List.of());
        for (String exerciseId : started.exerciseIds()) {
            workout = workout.withExercise(exerciseId);
        }
        return workout;
    }

    private CurrentWorkout modify(CurrentWorkout prior, EventPayload.SetModified modified, ReductionContext context) {
        Optional<CurrentWorkout.SetEntry> original = findInWorkout(prior, modified.workoutId(), modified.originalEventId());
        if (original.isEmpty()) {
            context.referenceMiss(modified.originalEventId());
            return prior;
        }
        CurrentWorkout.SetEntry set = original.get();
        CurrentWorkout.SetEntry patched = new CurrentWorkout.SetEntry(
            set.eventId(),
            modified.weight() != null ? modified.weight() : set.weight(),
            modified.reps() != null ? modified.reps() : set.reps(),
            modified.unit() != null ? modified.unit() : set.unit(),
            set.loggedAt(),
            set.personalRecord());
        return prior.withSetReplaced(set.eventId(), patched);
    }

    private CurrentWorkout delete(CurrentWorkout prior, EventPayload.SetDeleted deleted, ReductionContext context) {
        if (findInWorkout(prior, deleted.workoutId(), deleted.originalEventId()).isEmpty()) {
            context.referenceMiss(deleted.originalEventId());
            return prior;
        }
        return prior.withSetReplaced(deleted.originalEventId(), null);
    }

    private Optional<CurrentWorkout.SetEntry> findInWorkout(CurrentWorkout workout, String workoutId, String eventId) {
        if (workout == null || !workout.workoutId().equals(workoutId)) {
            return Optional.empty();
        }
        return workout.findSet(eventId);
    }

    private static String workoutIdOf(EventPayload payload) {
        if (payload instanceof EventPayload.ExerciseAdded p) {
            return p.workoutId();
        }
        if (payload instanceof EventPayload.SetLogged p) {
            return p.workoutId();
        }
        if (payload instanceof EventPayload.WorkoutCompleted p) {
            return p.workoutId();
        }
        if (payload instanceof EventPayload.WorkoutDiscarded p) {
            return p.workoutId();
        }
        return null;
    }
}
