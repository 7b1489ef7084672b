package com.liftlog.engine;

import com.liftlog.contract.EventPayload;
import com.liftlog.contract.ValidationException;
import com.liftlog.projection.CurrentWorkout;
import com.liftlog.projection.FocusResolver;
import com.liftlog.projection.UserViews;
import com.liftlog.projection.WorkoutTemplate;

import java.util.Optional;

/**
 * Checks a validated payload against the user's committed views and fills in
 * what the caller may leave out (the focused exercise, a template's exercise
 * list). Must run under the user's lock so the views cannot move underneath it.
 *
 * Set corrections are never rejected here; a stale reference is a no-op later.
 */
public class WorkoutPreconditions {

    public EventPayload resolve(EventPayload payload, UserViews views) {
        Optional<CurrentWorkout> active = views.currentWorkout();

        if (payload instanceof EventPayload.WorkoutStarted started) {
            if (active.isPresent()) {
                throw new WorkoutStateException("workout_id",
                    "cannot start while workout " + active.get().workoutId() + " is active");
            }
            if (started.fromTemplateId() != null && started.exerciseIds().isEmpty()) {
                return views.template(started.fromTemplateId())
                    .map(WorkoutTemplate::exerciseIds)
                    .map(started::withExerciseIds)
                    .orElse(started);
            }
            return started;
        }
        if (payload instanceof EventPayload.ExerciseAdded added) {
            requireActive(active, added.workoutId());
            return added;
        }
        if (payload instanceof EventPayload.SetLogged set) {
            CurrentWorkout workout = requireActive(active, set.workoutId());
            if (set.exerciseId() != null) {
                return set;
            }
            String focus = FocusResolver.resolve(workout, null)
                .orElseThrow(() -> new ValidationException("exercise_id", "required when no exercise is in focus"));
            return set.withExerciseId(focus);
        }
        if (payload instanceof EventPayload.WorkoutCompleted completed) {
            requireActive(active, completed.workoutId());
            return completed;
        }
        if (payload instanceof EventPayload.WorkoutDiscarded discarded) {
            requireActive(active, discarded.workoutId());
            return discarded;
        }
        return payload;
    }

    private CurrentWorkout requireActive(Optional<CurrentWorkout> active, String workoutId) {
        if (active.isEmpty()) {
            throw new WorkoutStateException("workout_id", "has no active workout");
        }
        if (!active.get().workoutId().equals(workoutId)) {
            throw new WorkoutStateException("workout_id",
                "does not match the active workout " + active.get().workoutId());
        }
        return active.get();
    }
}
