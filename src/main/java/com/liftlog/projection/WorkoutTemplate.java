package com.liftlog.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkoutTemplate(
    String templateId,
    String name,
    List<String> exerciseIds,
    String sourceWorkoutId,
    Instant createdAt,
    Instant lastUsedAt,
    int useCount
) {

    public WorkoutTemplate {
        exerciseIds = List.copyOf(exerciseIds);
    }

    public WorkoutTemplate patched(String newName, List<String> newExerciseIds) {
        return new WorkoutTemplate(templateId,
            newName != null ? newName : name,
            newExerciseIds != null ? newExerciseIds : exerciseIds,
            sourceWorkoutId, createdAt, lastUsedAt, useCount);
    }

    public WorkoutTemplate used(Instant at) {
        return new WorkoutTemplate(templateId, name, exerciseIds, sourceWorkoutId, createdAt, at, useCount + 1);
    }
}
