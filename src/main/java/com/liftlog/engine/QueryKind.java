package com.liftlog.engine;

import java.util.Arrays;

public enum QueryKind {
    PROJECTION,
    AGGREGATE;

    public static QueryKind fromValue(String raw) {
        return Arrays.stream(values())
            .filter(kind -> kind.name().equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown query kind: " + raw));
    }
}
