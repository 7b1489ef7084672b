package com.liftlog.projection;

/**
 * Holds the committed {@link UserViews} per user. Views are always rebuildable
 * from the event log, so this is never a source of truth.
 */
public interface ViewStore {

    /** The last committed snapshot, or {@link UserViews#EMPTY} for an unknown user. */
    UserViews load(String userId);

    void commit(String userId, UserViews views);

    void clear(String userId);
}
