package com.liftlog.engine;

import java.util.List;

/**
 * Replaying the log produced views that differ from the live ones. Means a
 * reducer is not deterministic or was changed; nothing was overwritten.
 */
public class RebuildDivergenceException extends RuntimeException {

    private final String userId;
    private final List<String> divergedKeys;

    public RebuildDivergenceException(String userId, List<String> divergedKeys) {
        super("rebuild for user " + userId + " diverged on keys " + divergedKeys);
        this.userId = userId;
        this.divergedKeys = List.copyOf(divergedKeys);
    }

    public String getUserId() {
        return userId;
    }

    public List<String> getDivergedKeys() {
        return divergedKeys;
    }
}
