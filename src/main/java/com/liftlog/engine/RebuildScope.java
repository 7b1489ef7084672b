package com.liftlog.engine;

import java.util.Arrays;

/** Which part of a user's views a rebuild replaces. */
public enum RebuildScope {
    ALL,
    PROJECTIONS,
    AGGREGATES;

    public boolean includesProjections() {
        return this != AGGREGATES;
    }

    public boolean includesAggregates() {
        return this != PROJECTIONS;
    }

    public static RebuildScope fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return ALL;
        }
        return Arrays.stream(values())
            .filter(scope -> scope.name().equalsIgnoreCase(raw.strip()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown rebuild scope: " + raw));
    }
}
