package com.liftlog.projection;

import com.liftlog.contract.EventPayload;
import com.liftlog.store.EventRecord;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scratch state shared by the reducers while one event is folded: the views as
 * they were before the event, plus what earlier reducers worked out for later
 * ones (the PR verdict, the finished workout) and for the caller.
 */
public final class ReductionContext {

    private final UserViews prior;
    private final Map<String, Object> derived = new LinkedHashMap<>();
    private PersonalRecordDetector.Detection detection;
    private WorkoutHistoryEntry completedWorkout;

    ReductionContext(UserViews prior) {
        this.prior = prior;
    }

    public UserViews prior() {
        return prior;
    }

    /** Exercise a set-logged event is for: the explicit id, else the focused exercise. */
    public Optional<String> targetExercise(EventRecord event) {
        EventPayload.SetLogged set = event.payloadAs(EventPayload.SetLogged.class);
        return FocusResolver.resolve(prior.currentWorkout().orElse(null), set.exerciseId());
    }

    void recordDetection(String exerciseId, PersonalRecordDetector.Detection detection) {
        this.detection = detection;
        derived.put("exercise_id", exerciseId);
        derived.put("is_pr", detection.personalRecord());
        if (detection.personalRecord() && detection.previousBest() != null) {
            derived.put("previous_best", detection.previousBest());
        }
    }

    public boolean personalRecord() {
        return detection != null && detection.personalRecord();
    }

    void recordCompletion(WorkoutHistoryEntry entry) {
        this.completedWorkout = entry;
        derived.put("summary", entry.stats());
    }

    public Optional<WorkoutHistoryEntry> completedWorkout() {
        return Optional.ofNullable(completedWorkout);
    }

    /** Marks the event as accepted but without effect because {@code reference} was not found. */
    void referenceMiss(String reference) {
        derived.put("no_op", true);
        derived.put("reference_miss", reference);
    }

    Map<String, Object> derived() {
        return derived;
    }
}
