package com.liftlog.store;

import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;
import com.liftlog.contract.WeightUnit;
import com.liftlog.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class JdbcEventStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T08:00:00.123456Z");

    private EmbeddedDatabase database;
    private MutableClock clock;
    private JdbcEventStore store;

    @BeforeEach
    void setUp() {
        database = new EmbeddedDatabaseBuilder()
            .generateUniqueName(true)
            .setType(EmbeddedDatabaseType.H2)
            .addScript("schema.sql")
            .build();
        clock = new MutableClock(START);
        store = new JdbcEventStore(new JdbcTemplate(database), new EventPayloadCodec(), clock, 1);
    }

    @AfterEach
    void tearDown() {
        database.shutdown();
    }

    private EventRecord append(String userId, EventPayload payload) {
        return store.append(store.stamp(userId, payload));
    }

    @Test
    @DisplayName("payloads and microsecond timestamps survive a write and read")
    void appendedRecord_readsBackEqual() {
        EventRecord started = append("u1", new EventPayload.WorkoutStarted("w1", "Push day", "t1",
            List.of("bench-press", "dip")));
        clock.advance(Duration.ofSeconds(30));
        EventRecord set = append("u1", new EventPayload.SetLogged("w1", "bench-press",
            new BigDecimal("102.50"), 8, WeightUnit.KG));

        List<EventRecord> stored = store.list("u1", EventFilter.all()).toList();
        assertEquals(List.of(started, set), stored);
        assertEquals(new BigDecimal("102.50"), stored.get(1).payloadAs(EventPayload.SetLogged.class).weight());
    }

    @Test
    void list_filtersByTypeRangeAndOrder() {
        EventRecord started = append("u1", new EventPayload.WorkoutStarted("w1", null, null, null));
        clock.advance(Duration.ofMinutes(1));
        EventRecord added = append("u1", new EventPayload.ExerciseAdded("w1", "squat"));
        clock.advance(Duration.ofMinutes(1));
        EventRecord completed = append("u1", new EventPayload.WorkoutCompleted("w1", "felt strong"));

        assertEquals(List.of(completed, added, started),
            store.list("u1", EventFilter.all().reversed()).toList());
        assertEquals(List.of(started, completed),
            store.list("u1", EventFilter.all().withTypes(EventType.WORKOUT_STARTED, EventType.WORKOUT_COMPLETED))
                .toList());
        assertEquals(List.of(started, added),
            store.list("u1", EventFilter.all().between(START, completed.timestamp())).toList());
        assertEquals(List.of(completed), store.list("u1", EventFilter.all().reversed().limitedTo(1)).toList());
    }

    @Test
    void stamp_neverGoesBehindThePersistedLog() {
        EventRecord first = append("u1", new EventPayload.WorkoutStarted("w1", null, null, null));
        clock.set(START.minus(Duration.ofHours(1)));

        EventRecord second = store.stamp("u1", new EventPayload.WorkoutDiscarded("w1", null));

        assertEquals(first.timestamp(), second.timestamp());
    }

    @Test
    void countsAndUsers() {
        append("u1", new EventPayload.WorkoutStarted("w1", null, null, null));
        append("u2", new EventPayload.WorkoutStarted("w2", null, null, null));
        append("u2", new EventPayload.WorkoutDiscarded("w2", "gym closed"));

        assertEquals(1, store.count("u1"));
        assertEquals(2, store.count("u2"));
        assertEquals(Set.of("u1", "u2"), store.userIds());
    }

    @Test
    @DisplayName("a failing database surfaces as StorageFailureException and nothing is kept")
    void append_onBrokenDatabase_reportsStorageFailure() {
        EventRecord stamped = store.stamp("u1", new EventPayload.WorkoutStarted("w1", null, null, null));
        new JdbcTemplate(database).execute("DROP TABLE events");

        assertThrows(StorageFailureException.class, () -> store.append(stamped));
    }
}
