package com.liftlog.aggregate;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Folds completed workouts into daily, weekly, monthly and yearly buckets.
 *
 * {@link #applyCompletedWorkout} is the incremental path used on every
 * workout-completed fact; {@link #recompute} rebuilds the same buckets from
 * scratch. Both must agree for any set of workouts.
 */
public class AggregateEngine {

    private final ZoneId zone;

    public AggregateEngine(ZoneId zone) {
        this.zone = zone;
    }

    /** The bucket keys a completion at {@code timestamp} contributes to, one per period type. */
    public List<String> bucketKeys(Instant timestamp) {
        LocalDate date = timestamp.atZone(zone).toLocalDate();
        return List.of(
            PeriodType.DAILY.key(date),
            PeriodType.WEEKLY.key(date),
            PeriodType.MONTHLY.key(date),
            PeriodType.YEARLY.key(date));
    }

    /** Returns a new bucket map; {@code buckets} is left untouched. */
    public SortedMap<String, AggregateBucket> applyCompletedWorkout(Map<String, AggregateBucket> buckets,
                                                                    CompletedWorkout workout) {
        TreeMap<String, AggregateBucket> next = new TreeMap<>(buckets);
        LocalDate date = workout.completedAt().atZone(zone).toLocalDate();
        for (PeriodType periodType : PeriodType.values()) {
            String key = periodType.key(date);
            AggregateBucket bucket = next.getOrDefault(key, AggregateBucket.empty(periodType, periodType.periodKey(date)));
            next.put(key, bucket.plus(workout));
        }
        return Collections.unmodifiableSortedMap(next);
    }

    public SortedMap<String, AggregateBucket> recompute(Iterable<CompletedWorkout> workouts) {
        SortedMap<String, AggregateBucket> buckets = new TreeMap<>();
        for (CompletedWorkout workout : workouts) {
            buckets = applyCompletedWorkout(buckets, workout);
        }
        return buckets;
    }
}
