package com.liftlog.projection;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.liftlog.contract.WeightUnit;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Every set ever logged for one exercise, oldest first, plus the current best.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ExerciseHistory(String exerciseId, List<LoggedSet> sets, PersonalBest best) {

    public ExerciseHistory {
        sets = List.copyOf(sets);
    }

    public static ExerciseHistory empty(String exerciseId) {
        return new ExerciseHistory(exerciseId, List.of(), null);
    }

    public ExerciseHistory withSet(LoggedSet set, PersonalBest newBest) {
        List<LoggedSet> next = new ArrayList<>(sets);
        next.add(set);
        return new ExerciseHistory(exerciseId, next, newBest);
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record LoggedSet(
        String eventId,
        String workoutId,
        BigDecimal weight,
        int reps,
        WeightUnit unit,
        Instant loggedAt,
        @JsonProperty("is_pr") boolean personalRecord
    ) {}

    /** Best (weight, reps) as logged; comparisons use the kilogram-normalized weight. */
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record PersonalBest(
        BigDecimal weight,
        int reps,
        WeightUnit unit,
        String eventId,
        Instant achievedAt
    ) {
        public BigDecimal weightKg() {
            return unit.toKilograms(weight);
        }
    }
}
