package com.liftlog.engine;

/** A replay was interrupted between events. The previous views are still in place. */
public class ReplayCancelledException extends RuntimeException {

    private final String userId;
    private final int eventsReplayed;

    public ReplayCancelledException(String userId, int eventsReplayed) {
        super("rebuild for user " + userId + " cancelled after " + eventsReplayed + " events");
        this.userId = userId;
        this.eventsReplayed = eventsReplayed;
    }

    public String getUserId() {
        return userId;
    }

    public int getEventsReplayed() {
        return eventsReplayed;
    }
}
