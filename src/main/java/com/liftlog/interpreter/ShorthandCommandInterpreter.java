package com.liftlog.interpreter;

import com.liftlog.contract.EventType;
import com.liftlog.contract.ValidationException;
import com.liftlog.engine.QueryKind;
import com.liftlog.engine.WorkoutStateException;
import com.liftlog.projection.CurrentWorkout;
import com.liftlog.projection.ProjectionKeys;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic gym shorthand:
 * <pre>
 *   start [name]                      workout-started
 *   add bench press                   exercise-added
 *   100 for 8 | 100x8 [kg|lb]         set-logged against the focused exercise
 *   bench press 100 for 8 [kg|lb]     set-logged against a named exercise
 *   finish [notes] | done             workout-completed
 *   discard [reason]                  workout-discarded
 *   show current | history | templates | exercise bench press
 * </pre>
 * Exercise names are looked up in the {@link ExerciseLibrary} by name or alias;
 * unknown names become ids by lower-casing and joining words with '-'.
 * Keywords win over the set form, so {@code start 100 for 8} names a workout.
 */
@Component
public class ShorthandCommandInterpreter implements CommandInterpreter {

    private static final Pattern SET = Pattern.compile(
        "^(?:(?<exercise>[a-z][a-z0-9 _.-]*?)\\s+)?(?<weight>\\d+(?:\\.\\d+)?)\\s*(?:x|for)\\s*(?<reps>\\d+)"
            + "(?:\\s*(?<unit>kg|kgs|lb|lbs))?$");
    private static final Pattern START = Pattern.compile("^start(?:\\s+(?<name>.+))?$");
    private static final Pattern ADD = Pattern.compile("^add\\s+(?<exercise>.+)$");
    private static final Pattern FINISH = Pattern.compile("^(?:finish|done|complete)(?:\\s+(?<notes>.+))?$");
    private static final Pattern DISCARD = Pattern.compile("^discard(?:\\s+(?<reason>.+))?$");
    private static final Pattern SHOW = Pattern.compile("^show\\s+(?<what>.+)$");

    private final ExerciseLibrary library;

    public ShorthandCommandInterpreter(ExerciseLibrary library) {
        this.library = library;
    }

    @Override
    public InterpretedCommand interpret(String text, CurrentWorkout current) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("text", "is required");
        }
        String original = text.strip().replaceAll("\\s+", " ");
        String normalized = original.toLowerCase(Locale.ROOT);

        Matcher m = START.matcher(normalized);
        if (m.matches()) {
            Map<String, Object> payload = new LinkedHashMap<>();
            if (m.group("name") != null) {
                payload.put("name", tail(original, m.start("name")));
            }
            return emit(EventType.WORKOUT_STARTED, payload);
        }
        m = ADD.matcher(normalized);
        if (m.matches()) {
            Map<String, Object> payload = workoutPayload(current);
            payload.put("exercise_id", exerciseId(m.group("exercise")));
            return emit(EventType.EXERCISE_ADDED, payload);
        }
        m = FINISH.matcher(normalized);
        if (m.matches()) {
            Map<String, Object> payload = workoutPayload(current);
            if (m.group("notes") != null) {
                payload.put("notes", tail(original, m.start("notes")));
            }
            return emit(EventType.WORKOUT_COMPLETED, payload);
        }
        m = DISCARD.matcher(normalized);
        if (m.matches()) {
            Map<String, Object> payload = workoutPayload(current);
            if (m.group("reason") != null) {
                payload.put("reason", tail(original, m.start("reason")));
            }
            return emit(EventType.WORKOUT_DISCARDED, payload);
        }
        m = SHOW.matcher(normalized);
        if (m.matches()) {
            return show(m.group("what"));
        }
        m = SET.matcher(normalized);
        if (m.matches()) {
            Map<String, Object> payload = workoutPayload(current);
            if (m.group("exercise") != null) {
                payload.put("exercise_id", exerciseId(m.group("exercise")));
            }
            payload.put("weight", new BigDecimal(m.group("weight")));
            payload.put("reps", Integer.parseInt(m.group("reps")));
            if (m.group("unit") != null) {
                payload.put("unit", m.group("unit").startsWith("lb") ? "lb" : "kg");
            }
            return emit(EventType.SET_LOGGED, payload);
        }
        throw new ValidationException("text", "is not a recognized command");
    }

    private InterpretedCommand show(String what) {
        if (what.equals("current") || what.equals("workout")) {
            return new InterpretedCommand.Query(QueryKind.PROJECTION, ProjectionKeys.CURRENT_WORKOUT);
        }
        if (what.equals("history")) {
            return new InterpretedCommand.Query(QueryKind.PROJECTION, ProjectionKeys.WORKOUT_HISTORY);
        }
        if (what.equals("templates")) {
            return new InterpretedCommand.Query(QueryKind.PROJECTION, ProjectionKeys.TEMPLATES);
        }
        if (what.startsWith("exercise ")) {
            String id = exerciseId(what.substring("exercise ".length()));
            return new InterpretedCommand.Query(QueryKind.PROJECTION, ProjectionKeys.exerciseHistory(id));
        }
        throw new ValidationException("text", "is not a recognized command");
    }

    private static Map<String, Object> workoutPayload(CurrentWorkout current) {
        if (current == null) {
            throw new WorkoutStateException("workout_id", "has no active workout");
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workout_id", current.workoutId());
        return payload;
    }

    private static InterpretedCommand emit(EventType type, Map<String, Object> payload) {
        return new InterpretedCommand.Emit(type.getValue(), payload);
    }

    private String exerciseId(String spoken) {
        return library.lookup(spoken)
            .map(ExerciseLibrary.Exercise::id)
            .orElseGet(() -> toExerciseId(spoken));
    }

    static String toExerciseId(String name) {
        return name.strip().toLowerCase(Locale.ROOT).replaceAll("[\\s_]+", "-");
    }

    private static String tail(String original, int start) {
        return original.substring(start).strip();
    }
}
