package com.liftlog.aggregate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * What a workout-completed fact contributes to its period buckets.
 */
public record CompletedWorkout(
    String workoutId,
    Instant completedAt,
    Set<String> exerciseIds,
    int totalSets,
    BigDecimal totalVolume,
    int prCount
) {

    public CompletedWorkout {
        exerciseIds = Collections.unmodifiableSortedSet(new TreeSet<>(exerciseIds));
    }
}
