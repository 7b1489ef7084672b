package com.liftlog.projection;

import java.util.Comparator;

/**
 * A set is a personal record when it beats the stored best for its exercise:
 * heavier (in kilograms) wins, equal weight with more reps wins, a tie is not a
 * record. The first set ever logged for an exercise is always a record.
 */
public class PersonalRecordDetector {

    static final Comparator<ExerciseHistory.PersonalBest> ORDER = Comparator
        .comparing(ExerciseHistory.PersonalBest::weightKg)
        .thenComparingInt(ExerciseHistory.PersonalBest::reps);

    public record Detection(
        boolean personalRecord,
        ExerciseHistory.PersonalBest best,
        ExerciseHistory.PersonalBest previousBest
    ) {}

    public Detection detect(ExerciseHistory.PersonalBest stored, ExerciseHistory.PersonalBest candidate) {
        if (stored == null) {
            return new Detection(true, candidate, null);
        }
        if (ORDER.compare(candidate, stored) > 0) {
            return new Detection(true, candidate, stored);
        }
        return new Detection(false, stored, stored);
    }
}
