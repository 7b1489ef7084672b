package com.liftlog.contract;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Closed set of facts the log accepts. Wire names are kebab-case;
 * {@link #fromValue(String)} also accepts PascalCase and SCREAMING_SNAKE spellings.
 */
public enum EventType {
    WORKOUT_STARTED("workout-started", EventPayload.WorkoutStarted.class),
    EXERCISE_ADDED("exercise-added", EventPayload.ExerciseAdded.class),
    SET_LOGGED("set-logged", EventPayload.SetLogged.class),
    SET_MODIFIED("set-modified", EventPayload.SetModified.class),
    SET_DELETED("set-deleted", EventPayload.SetDeleted.class),
    WORKOUT_COMPLETED("workout-completed", EventPayload.WorkoutCompleted.class),
    WORKOUT_DISCARDED("workout-discarded", EventPayload.WorkoutDiscarded.class),
    TEMPLATE_CREATED("template-created", EventPayload.TemplateCreated.class),
    TEMPLATE_UPDATED("template-updated", EventPayload.TemplateUpdated.class),
    TEMPLATE_DELETED("template-deleted", EventPayload.TemplateDeleted.class);

    private final String value;
    private final Class<? extends EventPayload> payloadClass;

    EventType(String value, Class<? extends EventPayload> payloadClass) {
        this.value = value;
        this.payloadClass = payloadClass;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Class<? extends EventPayload> payloadClass() {
        return payloadClass;
    }

    @JsonCreator
    public static EventType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new UnknownEventTypeException(raw);
        }
        String folded = fold(raw);
        return Arrays.stream(values())
            .filter(v -> fold(v.value).equals(folded))
            .findFirst()
            .orElseThrow(() -> new UnknownEventTypeException(raw));
    }

    private static String fold(String text) {
        return text.replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
