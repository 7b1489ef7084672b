package com.liftlog.interpreter;

import com.liftlog.contract.ValidationException;
import com.liftlog.engine.QueryKind;
import com.liftlog.engine.WorkoutStateException;
import com.liftlog.projection.CurrentWorkout;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ShorthandCommandInterpreterTest {

    private final ExerciseLibrary library = new ExerciseLibrary(List.of(
        new ExerciseLibrary.Exercise("bench-press", "Bench Press", "chest", List.of("bench", "bp")),
        new ExerciseLibrary.Exercise("overhead-press", "Overhead Press", "shoulders", List.of("ohp"))));
    private final ShorthandCommandInterpreter interpreter = new ShorthandCommandInterpreter(library);
    private final CurrentWorkout active = new CurrentWorkout("w1", null, Instant.EPOCH, null, "squat", List.of());

    private InterpretedCommand.Emit emit(String text, CurrentWorkout current) {
        return assertInstanceOf(InterpretedCommand.Emit.class, interpreter.interpret(text, current));
    }

    @Test
    @DisplayName("'100 for 8' logs a set against the focused exercise")
    void bareSet_leavesExerciseToFocus() {
        InterpretedCommand.Emit command = emit("100 for 8", active);

        assertEquals("set-logged", command.eventType());
        assertEquals(Map.of("workout_id", "w1", "weight", new BigDecimal("100"), "reps", 8), command.payload());
    }

    @Test
    void namedSetWithUnit() {
        InterpretedCommand.Emit command = emit("Bench Press 102.5 x 5 lbs", active);

        assertEquals("bench-press", command.payload().get("exercise_id"));
        assertEquals(new BigDecimal("102.5"), command.payload().get("weight"));
        assertEquals(5, command.payload().get("reps"));
        assertEquals("lb", command.payload().get("unit"));
    }

    @Test
    void compactForm() {
        assertEquals(6, emit("60x6", active).payload().get("reps"));
    }

    @Test
    void addExercise() {
        InterpretedCommand.Emit command = emit("add romanian deadlift", active);
        assertEquals("exercise-added", command.eventType());
        assertEquals("romanian-deadlift", command.payload().get("exercise_id"));
    }

    @Test
    @DisplayName("start keeps the name as typed")
    void startWithName() {
        InterpretedCommand.Emit command = emit("start  Leg Day", null);
        assertEquals("workout-started", command.eventType());
        assertEquals(Map.of("name", "Leg Day"), command.payload());
    }

    @Test
    void finishWithNotes() {
        InterpretedCommand.Emit command = emit("finish Felt strong today", active);
        assertEquals("workout-completed", command.eventType());
        assertEquals("Felt strong today", command.payload().get("notes"));
        assertEquals("w1", command.payload().get("workout_id"));
    }

    @Test
    void discard() {
        assertEquals("workout-discarded", emit("discard", active).eventType());
    }

    @Test
    @DisplayName("commands that need a workout are a state conflict when none is active")
    void noActiveWorkout_isAStateConflict() {
        for (String text : List.of("100 for 8", "finish", "add squat", "discard")) {
            WorkoutStateException ex = assertThrows(WorkoutStateException.class,
                () -> interpreter.interpret(text, null), text);
            assertEquals("workout_id", ex.getField());
        }
    }

    @Test
    @DisplayName("keywords take precedence over the set form")
    void startWithSetLikeName_startsAWorkout() {
        InterpretedCommand.Emit command = emit("start 100 for 8", null);
        assertEquals("workout-started", command.eventType());
        assertEquals("100 for 8", command.payload().get("name"));
    }

    @Test
    @DisplayName("aliases from the exercise library resolve to the library id")
    void aliases_resolveThroughLibrary() {
        assertEquals("bench-press", emit("bp 100x5", active).payload().get("exercise_id"));
        assertEquals("overhead-press", emit("add OHP", active).payload().get("exercise_id"));
        assertEquals("exercise_history:bench-press",
            ((InterpretedCommand.Query) interpreter.interpret("show exercise bench", active)).key());
        assertEquals("cable-fly", emit("add cable fly", active).payload().get("exercise_id"));
    }

    @Test
    void showQueries() {
        InterpretedCommand.Query query = assertInstanceOf(InterpretedCommand.Query.class,
            interpreter.interpret("show exercise bench press", active));
        assertEquals(QueryKind.PROJECTION, query.kind());
        assertEquals("exercise_history:bench-press", query.key());

        assertEquals("workout_history",
            ((InterpretedCommand.Query) interpreter.interpret("show history", null)).key());
    }

    @Test
    void gibberish_isRejectedWithTheField() {
        ValidationException ex = assertThrows(ValidationException.class,
            () -> interpreter.interpret("make me strong", active));
        assertEquals("text", ex.getField());
    }
}
