package com.liftlog.projection;

public final class ProjectionKeys {

    public static final String CURRENT_WORKOUT = "current_workout";
    public static final String WORKOUT_HISTORY = "workout_history";
    public static final String TEMPLATES = "templates";
    public static final String EXERCISE_HISTORY_PREFIX = "exercise_history:";

    private ProjectionKeys() {
    }

    public static String exerciseHistory(String exerciseId) {
        return EXERCISE_HISTORY_PREFIX + exerciseId;
    }

    public static String exerciseIdOf(String exerciseHistoryKey) {
        return exerciseHistoryKey.substring(EXERCISE_HISTORY_PREFIX.length());
    }
}
