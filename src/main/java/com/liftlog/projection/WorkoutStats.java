package com.liftlog.projection;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;

/** Totals for a finished workout. Volume is in kilograms. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WorkoutStats(int exerciseCount, int totalSets, BigDecimal totalVolume, int prCount) {

    public static WorkoutStats of(List<CurrentWorkout.ExerciseEntry> exercises) {
        int totalSets = 0;
        int prCount = 0;
        BigDecimal volume = BigDecimal.ZERO;
        for (CurrentWorkout.ExerciseEntry exercise : exercises) {
            for (CurrentWorkout.SetEntry set : exercise.sets()) {
                totalSets++;
                volume = volume.add(set.volumeKg());
                if (set.personalRecord()) {
                    prCount++;
                }
            }
        }
        return new WorkoutStats(exercises.size(), totalSets, volume, prCount);
    }
}
