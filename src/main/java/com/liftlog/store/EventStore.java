package com.liftlog.store;

import com.liftlog.contract.EventPayload;

import java.util.Set;

/**
 * Append-only, per-user ordered log of accepted facts.
 *
 * Callers serialize writes per user; implementations only need to keep
 * appends for one user in order.
 */
public interface EventStore {

    /**
     * Assigns a fresh event id and a timestamp no earlier than the user's last
     * appended event. Nothing is persisted.
     */
    EventRecord stamp(String userId, EventPayload payload);

    /** Persists a stamped record at the end of the user's log. */
    EventRecord append(EventRecord record);

    EventSequence list(String userId, EventFilter filter);

    long count(String userId);

    Set<String> userIds();
}
