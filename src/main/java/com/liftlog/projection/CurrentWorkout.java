package com.liftlog.projection;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.liftlog.contract.WeightUnit;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The workout in progress for one user. Every "with" method returns a new
 * instance; the lists are never mutated after construction.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CurrentWorkout(
    String workoutId,
    String name,
    Instant startedAt,
    String fromTemplateId,
    String focusExercise,
    List<ExerciseEntry> exercises
) {

    public CurrentWorkout {
        exercises = List.copyOf(exercises);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record ExerciseEntry(String exerciseId, List<SetEntry> sets) {
        public ExerciseEntry {
            sets = List.copyOf(sets);
        }
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SetEntry(
        String eventId,
        BigDecimal weight,
        int reps,
        WeightUnit unit,
        Instant loggedAt,
        @JsonProperty("is_pr") boolean personalRecord
    ) {
        public BigDecimal volumeKg() {
            return unit.toKilograms(weight).multiply(BigDecimal.valueOf(reps));
        }
    }

    public boolean hasExercise(String exerciseId) {
        return exercises.stream().anyMatch(e -> e.exerciseId().equals(exerciseId));
    }

    /** Appends an empty entry unless the exercise is already present; first mention wins the position. */
    public CurrentWorkout withExercise(String exerciseId) {
        if (hasExercise(exerciseId)) {
            return this;
        }
        List<ExerciseEntry> next = new ArrayList<>(exercises);
        next.add(new ExerciseEntry(exerciseId, List.of()));
        return new CurrentWorkout(workoutId, name, startedAt, fromTemplateId, focusExercise, next);
    }

    public CurrentWorkout withFocus(String exerciseId) {
        return new CurrentWorkout(workoutId, name, startedAt, fromTemplateId, exerciseId, exercises);
    }

    public CurrentWorkout withSetAppended(String exerciseId, SetEntry set) {
        CurrentWorkout withEntry = withExercise(exerciseId);
        List<ExerciseEntry> next = new ArrayList<>(withEntry.exercises.size());
        for (ExerciseEntry entry : withEntry.exercises) {
            if (entry.exerciseId().equals(exerciseId)) {
                List<SetEntry> sets = new ArrayList<>(entry.sets());
                sets.add(set);
                next.add(new ExerciseEntry(exerciseId, sets));
            } else {
                next.add(entry);
            }
        }
        return new CurrentWorkout(workoutId, name, startedAt, fromTemplateId, focusExercise, next);
    }

    public Optional<SetEntry> findSet(String eventId) {
        return exercises.stream()
            .flatMap(e -> e.sets().stream())
            .filter(s -> s.eventId().equals(eventId))
            .findFirst();
    }

    /** Replaces the set with the same event id, or removes it when {@code replacement} is null. */
    public CurrentWorkout withSetReplaced(String eventId, SetEntry replacement) {
        List<ExerciseEntry> next = new ArrayList<>(exercises.size());
        for (ExerciseEntry entry : exercises) {
            List<SetEntry> sets = new ArrayList<>(entry.sets().size());
            for (SetEntry set : entry.sets()) {
                if (!set.eventId().equals(eventId)) {
                    sets.add(set);
                } else if (replacement != null) {
                    sets.add(replacement);
                }
            }
            next.add(new ExerciseEntry(entry.exerciseId(), sets));
        }
        return new CurrentWorkout(workoutId, name, startedAt, fromTemplateId, focusExercise, next);
    }
}
