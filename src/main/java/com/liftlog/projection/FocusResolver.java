package com.liftlog.projection;

import java.util.List;
import java.util.Optional;

/**
 * Decides which exercise is "in focus" so a set can be logged without naming it.
 * Focus moves to whatever exercise was last added or logged against; a workout
 * started with a list of exercises focuses the first of them.
 */
public final class FocusResolver {

    private FocusResolver() {
    }

    public static Optional<String> resolve(CurrentWorkout workout, String requestedExerciseId) {
        if (requestedExerciseId != null) {
            return Optional.of(requestedExerciseId);
        }
        return workout == null ? Optional.empty() : Optional.ofNullable(workout.focusExercise());
    }

    public static String initialFocus(List<String> exerciseIds) {
        return exerciseIds.isEmpty() ? null : exerciseIds.get(0);
    }
}
