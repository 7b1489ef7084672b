package com.liftlog.contract;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure gate in front of the event log: turns a raw payload map into the typed
 * {@link EventPayload} variant for the event type, applying defaults, or throws
 * {@link ValidationException} naming the offending field.
 *
 * Never consults the log or any projection.
 */
@Component
public class PayloadValidator {

    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._:-]{0,127}$");

    private static final int MAX_NAME_LENGTH = 200;
    private static final int MAX_REASON_LENGTH = 500;
    private static final int MAX_NOTES_LENGTH = 2000;

    public EventPayload validate(String rawType, Map<String, Object> payload, WeightUnit defaultUnit) {
        return validate(EventType.fromValue(rawType), payload, defaultUnit);
    }

    public EventPayload validate(EventType type, Map<String, Object> payload, WeightUnit defaultUnit) {
        if (type == null) {
            throw new UnknownEventTypeException(null);
        }
        if (payload == null) {
            throw new ValidationException("payload", "is required");
        }
        WeightUnit unitDefault = defaultUnit != null ? defaultUnit : WeightUnit.KG;

        return switch (type) {
            case WORKOUT_STARTED -> new EventPayload.WorkoutStarted(
                requireId(payload, "workout_id"),
                optionalText(payload, "name", MAX_NAME_LENGTH),
                optionalId(payload, "from_template_id"),
                optionalIdList(payload, "exercise_ids"));
            case EXERCISE_ADDED -> new EventPayload.ExerciseAdded(
                requireId(payload, "workout_id"),
                requireId(payload, "exercise_id"));
            case SET_LOGGED -> new EventPayload.SetLogged(
                requireId(payload, "workout_id"),
                optionalId(payload, "exercise_id"),
                requireWeight(payload, "weight"),
                requireReps(payload, "reps"),
                optionalUnit(payload, "unit", unitDefault));
            case SET_MODIFIED -> validateSetModified(payload);
            case SET_DELETED -> new EventPayload.SetDeleted(
                requireId(payload, "workout_id"),
                requireId(payload, "original_event_id"),
                optionalText(payload, "reason", MAX_REASON_LENGTH));
            case WORKOUT_COMPLETED -> new EventPayload.WorkoutCompleted(
                requireId(payload, "workout_id"),
                optionalText(payload, "notes", MAX_NOTES_LENGTH));
            case WORKOUT_DISCARDED -> new EventPayload.WorkoutDiscarded(
                requireId(payload, "workout_id"),
                optionalText(payload, "reason", MAX_REASON_LENGTH));
            case TEMPLATE_CREATED -> new EventPayload.TemplateCreated(
                requireId(payload, "template_id"),
                requireText(payload, "name", MAX_NAME_LENGTH),
                optionalIdList(payload, "exercise_ids"),
                optionalId(payload, "source_workout_id"));
            case TEMPLATE_UPDATED -> validateTemplateUpdated(payload);
            case TEMPLATE_DELETED -> new EventPayload.TemplateDeleted(
                requireId(payload, "template_id"));
        };
    }

    /** User ids follow the same identifier format as payload ids. */
    public String checkUserId(String userId) {
        if (userId == null) {
            throw new ValidationException("user_id", "is required");
        }
        return checkId(userId, "user_id");
    }

    private EventPayload.SetModified validateSetModified(Map<String, Object> payload) {
        String workoutId = requireId(payload, "workout_id");
        String originalEventId = requireId(payload, "original_event_id");
        BigDecimal weight = optionalWeight(payload, "weight");
        Integer reps = optionalReps(payload, "reps");
        WeightUnit unit = optionalUnit(payload, "unit", null);
        if (weight == null && reps == null && unit == null) {
            throw new ValidationException("weight", "or reps or unit must be provided");
        }
        return new EventPayload.SetModified(workoutId, originalEventId, weight, reps, unit);
    }

    private EventPayload.TemplateUpdated validateTemplateUpdated(Map<String, Object> payload) {
        String templateId = requireId(payload, "template_id");
        String name = payload.get("name") != null
            ? requireText(payload, "name", MAX_NAME_LENGTH)
            : null;
        List<String> exerciseIds = payload.get("exercise_ids") != null
            ? optionalIdList(payload, "exercise_ids")
            : null;
        if (name == null && exerciseIds == null) {
            throw new ValidationException("name", "or exercise_ids must be provided");
        }
        return new EventPayload.TemplateUpdated(templateId, name, exerciseIds);
    }

    private String requireId(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            throw new ValidationException(field, "is required");
        }
        return checkId(value, field);
    }

    private String optionalId(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        return value == null ? null : checkId(value, field);
    }

    private String checkId(Object value, String field) {
        if (!(value instanceof String text) || !IDENTIFIER.matcher(text).matches()) {
            throw new ValidationException(field,
                "must be an identifier of 1-128 letters, digits, '.', '_', ':' or '-' starting with a letter or digit");
        }
        return text;
    }

    private List<String> optionalIdList(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw new ValidationException(field, "must be an array of identifiers");
        }
        // duplicates collapse onto their first occurrence
        Set<String> ids = new LinkedHashSet<>();
        for (Object element : list) {
            ids.add(checkId(element, field));
        }
        return new ArrayList<>(ids);
    }

    private String requireText(Map<String, Object> payload, String field, int maxLength) {
        Object value = payload.get(field);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new ValidationException(field, "is required");
        }
        return checkLength(text.strip(), field, maxLength);
    }

    private String optionalText(Map<String, Object> payload, String field, int maxLength) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ValidationException(field, "must be a string");
        }
        return checkLength(text, field, maxLength);
    }

    private String checkLength(String text, String field, int maxLength) {
        if (text.length() > maxLength) {
            throw new ValidationException(field, "must be at most " + maxLength + " characters");
        }
        return text;
    }

    private BigDecimal requireWeight(Map<String, Object> payload, String field) {
        BigDecimal weight = optionalWeight(payload, field);
        if (weight == null) {
            throw new ValidationException(field, "is required");
        }
        return weight;
    }

    private BigDecimal optionalWeight(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        BigDecimal weight = toDecimal(value, field);
        if (weight.signum() < 0) {
            throw new ValidationException(field, "must be >= 0");
        }
        return weight;
    }

    private BigDecimal toDecimal(Object value, String field) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return BigDecimal.valueOf(((Number) value).longValue());
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (Double.isNaN(number) || Double.isInfinite(number)) {
                throw new ValidationException(field, "must be a finite number");
            }
            return BigDecimal.valueOf(number);
        }
        throw new ValidationException(field, "must be a number");
    }

    private int requireReps(Map<String, Object> payload, String field) {
        Integer reps = optionalReps(payload, field);
        if (reps == null) {
            throw new ValidationException(field, "is required");
        }
        return reps;
    }

    private Integer optionalReps(Map<String, Object> payload, String field) {
        Object value = payload.get(field);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Integer) && !(value instanceof Long)
                && !(value instanceof Short) && !(value instanceof Byte)) {
            throw new ValidationException(field, "must be an integer");
        }
        long reps = ((Number) value).longValue();
        if (reps < 0) {
            throw new ValidationException(field, "must be >= 0");
        }
        if (reps > Integer.MAX_VALUE) {
            throw new ValidationException(field, "must be <= " + Integer.MAX_VALUE);
        }
        return (int) reps;
    }

    private WeightUnit optionalUnit(Map<String, Object> payload, String field, WeightUnit defaultUnit) {
        Object value = payload.get(field);
        if (value == null) {
            return defaultUnit;
        }
        if (value instanceof String text) {
            for (WeightUnit unit : WeightUnit.values()) {
                if (unit.getValue().equalsIgnoreCase(text)) {
                    return unit;
                }
            }
        }
        throw new ValidationException(field, "must be one of: kg, lb");
    }
}
