package com.liftlog.aggregate;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.math.BigDecimal;
import java.util.List;
import java.util.TreeSet;

/**
 * Running totals for one period. Every field is a sum or a sorted set union, so
 * the value does not depend on the order workouts were folded in.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AggregateBucket(
    PeriodType periodType,
    String periodKey,
    int workoutCount,
    int totalSets,
    BigDecimal totalVolume,
    int prCount,
    List<String> exerciseIds
) {

    public AggregateBucket {
        exerciseIds = List.copyOf(new TreeSet<>(exerciseIds));
    }

    public static AggregateBucket empty(PeriodType periodType, String periodKey) {
        return new AggregateBucket(periodType, periodKey, 0, 0, BigDecimal.ZERO, 0, List.of());
    }

    public String key() {
        return periodType.getValue() + ":" + periodKey;
    }

    public AggregateBucket plus(CompletedWorkout workout) {
        TreeSet<String> exercises = new TreeSet<>(exerciseIds);
        exercises.addAll(workout.exerciseIds());
        return new AggregateBucket(periodType, periodKey,
            workoutCount + 1,
            totalSets + workout.totalSets(),
            totalVolume.add(workout.totalVolume()),
            prCount + workout.prCount(),
            List.copyOf(exercises));
    }
}
