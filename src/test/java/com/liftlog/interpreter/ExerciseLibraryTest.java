package com.liftlog.interpreter;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExerciseLibraryTest {

    @Test
    void bundledLibrary_resolvesNamesIdsAndAliases() {
        ExerciseLibrary library = ExerciseLibrary.fromClasspath("exercises.json");

        assertFalse(library.exercises().isEmpty());
        assertEquals("pull-up", library.lookup("Pull Ups").orElseThrow().id());
        assertEquals("lat-pulldown", library.lookup("lat_pulldown").orElseThrow().id());
        assertEquals("bench-press", library.lookup("Bench Press").orElseThrow().id());
        assertTrue(library.lookup("zercher carry").isEmpty());
    }

    @Test
    void duplicateIds_areRejected() {
        ExerciseLibrary.Exercise squat = new ExerciseLibrary.Exercise("squat", "Squat", "legs", null);
        assertThrows(IllegalArgumentException.class, () -> new ExerciseLibrary(List.of(squat, squat)));
    }

    @Test
    void missingResource_failsLoudly() {
        assertThrows(IllegalStateException.class, () -> ExerciseLibrary.fromClasspath("no-such-library.json"));
    }
}
