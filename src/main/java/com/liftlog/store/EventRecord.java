package com.liftlog.store;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;

import java.time.Instant;

/**
 * An accepted fact as it sits in the log. Immutable; the store never rewrites one.
 */
public record EventRecord(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("user_id") String userId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") EventType type,
    @JsonProperty("payload") EventPayload payload,
    @JsonProperty("schema_version") int schemaVersion
) {

    public <T extends EventPayload> T payloadAs(Class<T> payloadClass) {
        return payloadClass.cast(payload);
    }
}
