package com.liftlog.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkoutHistoryEntry(
    String workoutId,
    String name,
    Instant startedAt,
    Instant completedAt,
    String fromTemplateId,
    String notes,
    List<CurrentWorkout.ExerciseEntry> exercises,
    WorkoutStats stats
) {

    public WorkoutHistoryEntry {
        exercises = List.copyOf(exercises);
    }
}
