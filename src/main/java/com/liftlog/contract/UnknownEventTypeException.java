package com.liftlog.contract;

/**
 * Thrown when a caller names an event type outside the closed set in {@link EventType}.
 */
public class UnknownEventTypeException extends RuntimeException {

    private final String eventType;

    public UnknownEventTypeException(String eventType) {
        super("unknown event_type: " + eventType);
        this.eventType = eventType;
    }

    public String getEventType() {
        return eventType;
    }
}
