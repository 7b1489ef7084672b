package com.liftlog.engine;

import com.liftlog.aggregate.AggregateBucket;
import com.liftlog.aggregate.PeriodType;
import com.liftlog.projection.CanonicalJson;
import com.liftlog.projection.ProjectionEntry;
import com.liftlog.projection.ProjectionKeys;
import com.liftlog.projection.UserViews;
import com.liftlog.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Replaying the log through the reducers must reproduce exactly what the live
 * emit path built, byte for byte.
 */
class ReplayConsistencyTest {

    private EngineFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        recordThreeWeeksOfTraining();
    }

    private void emit(String type, Map<String, Object> payload) {
        fixture.clock.advance(Duration.ofMinutes(7));
        fixture.engine.emit("u1", type, payload);
    }

    private void recordThreeWeeksOfTraining() {
        emit("template-created", Map.of("template_id", "push", "name", "Push",
            "exercise_ids", List.of("bench-press", "dip")));
        for (int week = 0; week < 3; week++) {
            String workoutId = "w" + week;
            emit("workout-started", Map.of("workout_id", workoutId, "from_template_id", "push"));
            emit("set-logged", Map.of("workout_id", workoutId, "weight", 100 + week, "reps", 8));
            Map<String, Object> dip = Map.of("workout_id", workoutId, "exercise_id", "dip",
                "weight", 20.5, "reps", 10, "unit", "lb");
            emit("set-logged", dip);
            emit("set-logged", Map.of("workout_id", workoutId, "weight", 0, "reps", 12));
            emit("exercise-added", Map.of("workout_id", workoutId, "exercise_id", "fly"));
            emit("set-deleted", Map.of("workout_id", workoutId, "original_event_id", "unknown"));
            emit("workout-completed", Map.of("workout_id", workoutId, "notes", "week " + week));
            fixture.clock.advance(Duration.ofDays(7));
        }
        emit("template-updated", Map.of("template_id", "push", "name", "Push A"));
        emit("workout-started", Map.of("workout_id", "w9"));
        emit("workout-discarded", Map.of("workout_id", "w9"));
        emit("workout-started", Map.of("workout_id", "w10", "exercise_ids", List.of("squat")));
        emit("set-logged", Map.of("workout_id", "w10", "weight", 140, "reps", 3));
    }

    private static void assertSameBytes(UserViews expected, UserViews actual) {
        assertEquals(expected.projections().keySet(), actual.projections().keySet());
        assertEquals(expected.aggregates().keySet(), actual.aggregates().keySet());
        expected.projections().forEach((key, entry) ->
            assertEquals(CanonicalJson.text(entry), CanonicalJson.text(actual.projections().get(key)), key));
        expected.aggregates().forEach((key, bucket) ->
            assertEquals(CanonicalJson.text(bucket), CanonicalJson.text(actual.aggregates().get(key)), key));
    }

    @Test
    @DisplayName("rebuildAll over live views finds no divergence and changes nothing")
    void rebuildAll_matchesLiveViews() {
        UserViews live = fixture.viewStore.load("u1");

        RebuildReport report = fixture.replay.rebuildAll("u1");

        assertEquals(fixture.eventStore.count("u1"), report.eventsReplayed());
        assertTrue(report.divergedKeys().isEmpty());
        assertTrue(report.restoredKeys().isEmpty());
        assertSameBytes(live, fixture.viewStore.load("u1"));
    }

    @Test
    @DisplayName("views lost entirely are restored from the log")
    void rebuild_restoresLostViews() {
        UserViews live = fixture.viewStore.load("u1");
        fixture.viewStore.clear("u1");

        RebuildReport report = fixture.replay.rebuildAll("u1");

        assertEquals(live.projections().size() + live.aggregates().size(), report.restoredKeys().size());
        assertSameBytes(live, fixture.viewStore.load("u1"));
        assertTrue(fixture.viewStore.load("u1").currentWorkout().isPresent());
    }

    @Test
    @DisplayName("recomputing aggregates from scratch reproduces the live buckets")
    void recomputeAggregates_matchesIncremental() {
        UserViews live = fixture.viewStore.load("u1");
        Map<String, AggregateBucket> recomputed = fixture.replay.recomputeAggregates("u1");

        assertEquals(live.aggregates().keySet(), recomputed.keySet());
        live.aggregates().forEach((key, bucket) ->
            assertEquals(CanonicalJson.text(bucket), CanonicalJson.text(recomputed.get(key)), key));
        assertEquals(3, recomputed.get("monthly:2024-01").workoutCount());
    }

    @Test
    @DisplayName("a divergent live view halts the rebuild without overwriting anything")
    void divergence_haltsRebuild() {
        UserViews live = fixture.viewStore.load("u1");
        ProjectionEntry templates = live.projection(ProjectionKeys.TEMPLATES).orElseThrow();
        UserViews tampered = live.toBuilder()
            .put(new ProjectionEntry(ProjectionKeys.TEMPLATES, List.of(), templates.updatedAt()))
            .build();
        fixture.viewStore.commit("u1", tampered);

        RebuildDivergenceException ex = assertThrows(RebuildDivergenceException.class,
            () -> fixture.replay.rebuildAll("u1"));

        assertEquals(List.of(ProjectionKeys.TEMPLATES), ex.getDivergedKeys());
        assertSame(tampered, fixture.viewStore.load("u1"));
    }

    @Test
    @DisplayName("force replaces diverged views and reports them")
    void force_overwritesDivergence() {
        UserViews live = fixture.viewStore.load("u1");
        TreeMap<String, AggregateBucket> buckets = new TreeMap<>(live.aggregates());
        buckets.put("yearly:2024", AggregateBucket.empty(PeriodType.YEARLY, "2024"));
        fixture.viewStore.commit("u1", live.withAggregates(buckets));

        RebuildReport report = fixture.replay.rebuild("u1", RebuildScope.ALL, true);

        assertEquals(List.of("yearly:2024"), report.divergedKeys());
        assertTrue(report.forced());
        assertSameBytes(live, fixture.viewStore.load("u1"));
    }

    @Test
    @DisplayName("a projections-only rebuild leaves aggregates alone")
    void scopedRebuild_touchesOnlyItsScope() {
        UserViews live = fixture.viewStore.load("u1");
        fixture.viewStore.commit("u1", live.withAggregates(Map.of()));

        RebuildReport report = fixture.replay.rebuild("u1", RebuildScope.PROJECTIONS, false);

        assertEquals(0, report.aggregateKeys());
        assertTrue(fixture.viewStore.load("u1").aggregates().isEmpty());

        fixture.replay.rebuild("u1", RebuildScope.AGGREGATES, false);
        assertSameBytes(live, fixture.viewStore.load("u1"));
    }

    @Test
    @DisplayName("an interrupted replay leaves the previous views in place")
    void cancelledReplay_isAllOrNothing() {
        fixture.viewStore.clear("u1");
        Thread.currentThread().interrupt();
        try {
            assertThrows(ReplayCancelledException.class, () -> fixture.replay.rebuildAll("u1"));
        } finally {
            Thread.interrupted();
        }
        assertSame(UserViews.EMPTY, fixture.viewStore.load("u1"));

        fixture.replay.rebuildAll("u1");
        assertFalse(fixture.viewStore.load("u1").projections().isEmpty());
    }

    @Test
    void rebuildingAnEmptyLog_yieldsEmptyViews() {
        RebuildReport report = fixture.replay.rebuildAll("nobody");
        assertEquals(0, report.eventsReplayed());
        assertTrue(fixture.viewStore.load("nobody").projections().isEmpty());
    }
}
