package com.liftlog.projection;

import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;
import com.liftlog.store.EventRecord;

import java.util.List;

/**
 * Appends every logged set to its exercise's history and keeps the best set.
 * Also the place where the PR verdict for a set is made, so it runs before the
 * current-workout reducer copies that verdict onto the set.
 */
public class ExerciseHistoryReducer implements ProjectionReducer<ExerciseHistory> {

    private final PersonalRecordDetector detector;

    public ExerciseHistoryReducer(PersonalRecordDetector detector) {
        this.detector = detector;
    }

    @Override
    public List<String> keysFor(EventRecord event, ReductionContext context) {
        if (event.type() != EventType.SET_LOGGED) {
            return List.of();
        }
        return context.targetExercise(event)
            .map(exerciseId -> List.of(ProjectionKeys.exerciseHistory(exerciseId)))
            .orElse(List.of());
    }

    @Override
    public ExerciseHistory initialState(String key) {
        return ExerciseHistory.empty(ProjectionKeys.exerciseIdOf(key));
    }

    @Override
    public ExerciseHistory reduce(String key, ExerciseHistory prior, EventRecord event, ReductionContext context) {
        EventPayload.SetLogged set = event.payloadAs(EventPayload.SetLogged.class);
        ExerciseHistory.PersonalBest candidate = new ExerciseHistory.PersonalBest(
            set.weight(), set.reps(), set.unit(), event.eventId(), event.timestamp());
        PersonalRecordDetector.Detection detection = detector.detect(prior.best(), candidate);
        context.recordDetection(prior.exerciseId(), detection);

        ExerciseHistory.LoggedSet logged = new ExerciseHistory.LoggedSet(
            event.eventId(), set.workoutId(), set.weight(), set.reps(), set.unit(),
            event.timestamp(), detection.personalRecord());
        return prior.withSet(logged, detection.best());
    }
}
