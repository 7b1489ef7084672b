package com.liftlog.contract;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Normalized payload of an accepted fact. One variant per {@link EventType};
 * instances only come out of {@link PayloadValidator} or from the log itself.
 */
public sealed interface EventPayload {

    EventType type();

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WorkoutStarted(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("name") String name,
        @JsonProperty("from_template_id") String fromTemplateId,
        @JsonProperty("exercise_ids") List<String> exerciseIds
    ) implements EventPayload {
        public WorkoutStarted {
            exerciseIds = exerciseIds == null ? List.of() : List.copyOf(exerciseIds);
        }

        @Override
        public EventType type() {
            return EventType.WORKOUT_STARTED;
        }

        public WorkoutStarted withExerciseIds(List<String> templateExerciseIds) {
            return new WorkoutStarted(workoutId, name, fromTemplateId, templateExerciseIds);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ExerciseAdded(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("exercise_id") String exerciseId
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.EXERCISE_ADDED;
        }
    }

    /** {@code exerciseId} is null only before the boundary resolves the focus exercise. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SetLogged(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("exercise_id") String exerciseId,
        @JsonProperty("weight") BigDecimal weight,
        @JsonProperty("reps") int reps,
        @JsonProperty("unit") WeightUnit unit
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.SET_LOGGED;
        }

        public SetLogged withExerciseId(String resolvedExerciseId) {
            return new SetLogged(workoutId, resolvedExerciseId, weight, reps, unit);
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SetModified(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("original_event_id") String originalEventId,
        @JsonProperty("weight") BigDecimal weight,
        @JsonProperty("reps") Integer reps,
        @JsonProperty("unit") WeightUnit unit
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.SET_MODIFIED;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record SetDeleted(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("original_event_id") String originalEventId,
        @JsonProperty("reason") String reason
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.SET_DELETED;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WorkoutCompleted(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("notes") String notes
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.WORKOUT_COMPLETED;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record WorkoutDiscarded(
        @JsonProperty("workout_id") String workoutId,
        @JsonProperty("reason") String reason
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.WORKOUT_DISCARDED;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TemplateCreated(
        @JsonProperty("template_id") String templateId,
        @JsonProperty("name") String name,
        @JsonProperty("exercise_ids") List<String> exerciseIds,
        @JsonProperty("source_workout_id") String sourceWorkoutId
    ) implements EventPayload {
        public TemplateCreated {
            exerciseIds = exerciseIds == null ? List.of() : List.copyOf(exerciseIds);
        }

        @Override
        public EventType type() {
            return EventType.TEMPLATE_CREATED;
        }
    }

    /** Null fields are left untouched when the patch is applied. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TemplateUpdated(
        @JsonProperty("template_id") String templateId,
        @JsonProperty("name") String name,
        @JsonProperty("exercise_ids") List<String> exerciseIds
    ) implements EventPayload {
        public TemplateUpdated {
            exerciseIds = exerciseIds == null ? null : List.copyOf(exerciseIds);
        }

        @Override
        public EventType type() {
            return EventType.TEMPLATE_UPDATED;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record TemplateDeleted(
        @JsonProperty("template_id") String templateId
    ) implements EventPayload {
        @Override
        public EventType type() {
            return EventType.TEMPLATE_DELETED;
        }
    }
}
