package com.liftlog.aggregate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

class AggregateEngineTest {

    private final AggregateEngine engine = new AggregateEngine(ZoneOffset.UTC);

    private static CompletedWorkout workout(String id, String completedAt, int sets, String volume, int prs,
                                            String... exercises) {
        return new CompletedWorkout(id, Instant.parse(completedAt), Set.of(exercises), sets,
            new BigDecimal(volume), prs);
    }

    @Test
    @DisplayName("a completion lands in one bucket per period type")
    void bucketKeys_coverEveryPeriod() {
        assertEquals(List.of("daily:2024-01-15", "weekly:2024-W03", "monthly:2024-01", "yearly:2024"),
            engine.bucketKeys(Instant.parse("2024-01-15T18:30:00Z")));
    }

    @Test
    @DisplayName("late December can belong to week 1 of the next ISO year")
    void weeklyKey_usesIsoWeekBasedYear() {
        assertEquals(List.of("daily:2024-12-30", "weekly:2025-W01", "monthly:2024-12", "yearly:2024"),
            engine.bucketKeys(Instant.parse("2024-12-30T07:00:00Z")));
        assertEquals("weekly:2020-W53", engine.bucketKeys(Instant.parse("2021-01-03T12:00:00Z")).get(1));
    }

    @Test
    void zoneDecidesTheDay() {
        AggregateEngine tokyo = new AggregateEngine(ZoneId.of("Asia/Tokyo"));
        assertEquals("daily:2024-01-16", tokyo.bucketKeys(Instant.parse("2024-01-15T18:30:00Z")).get(0));
    }

    @Test
    void apply_accumulatesTotals() {
        SortedMap<String, AggregateBucket> buckets = engine.applyCompletedWorkout(Collections.emptySortedMap(),
            workout("w1", "2024-01-15T10:00:00Z", 2, "1600", 1, "bench-press"));
        buckets = engine.applyCompletedWorkout(buckets,
            workout("w2", "2024-01-17T10:00:00Z", 3, "900.5", 0, "squat", "bench-press"));

        AggregateBucket week = buckets.get("weekly:2024-W03");
        assertEquals(PeriodType.WEEKLY, week.periodType());
        assertEquals("2024-W03", week.periodKey());
        assertEquals(2, week.workoutCount());
        assertEquals(5, week.totalSets());
        assertEquals(new BigDecimal("2500.5"), week.totalVolume());
        assertEquals(1, week.prCount());
        assertEquals(List.of("bench-press", "squat"), week.exerciseIds());

        assertEquals(1, buckets.get("daily:2024-01-15").workoutCount());
        assertEquals(1, buckets.get("daily:2024-01-17").workoutCount());
        assertEquals(5, buckets.size());
    }

    @Test
    @DisplayName("the input map is never modified")
    void apply_isNonDestructive() {
        SortedMap<String, AggregateBucket> first = engine.applyCompletedWorkout(Collections.emptySortedMap(),
            workout("w1", "2024-01-15T10:00:00Z", 1, "100", 0, "squat"));
        engine.applyCompletedWorkout(first, workout("w2", "2024-01-15T11:00:00Z", 1, "100", 0, "squat"));
        assertEquals(1, first.get("daily:2024-01-15").workoutCount());
    }

    @Test
    @DisplayName("recompute from scratch equals the incremental result in any order")
    void recompute_isOrderIndependent() {
        List<CompletedWorkout> workouts = new ArrayList<>(List.of(
            workout("w1", "2024-01-01T10:00:00Z", 4, "1000.25", 1, "squat"),
            workout("w2", "2024-01-03T10:00:00Z", 2, "250", 0, "row"),
            workout("w3", "2024-02-10T10:00:00Z", 6, "3000", 2, "bench-press", "squat"),
            workout("w4", "2024-12-31T10:00:00Z", 0, "0", 0)));

        SortedMap<String, AggregateBucket> incremental = Collections.emptySortedMap();
        for (CompletedWorkout w : workouts) {
            incremental = engine.applyCompletedWorkout(incremental, w);
        }
        Collections.reverse(workouts);

        assertEquals(incremental, engine.recompute(workouts));
    }

    @Test
    void emptyWorkout_stillCountsAsAWorkout() {
        SortedMap<String, AggregateBucket> buckets = engine.applyCompletedWorkout(Collections.emptySortedMap(),
            workout("w1", "2024-05-05T10:00:00Z", 0, "0", 0));
        AggregateBucket day = buckets.get("daily:2024-05-05");
        assertEquals(1, day.workoutCount());
        assertEquals(0, day.totalSets());
        assertTrue(day.exerciseIds().isEmpty());
    }
}
