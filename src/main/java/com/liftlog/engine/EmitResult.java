package com.liftlog.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;
import com.liftlog.store.EventRecord;

import java.time.Instant;
import java.util.Map;

/**
 * What the caller gets back for an accepted event: the fact as logged plus the
 * values computed while folding it ({@code is_pr}, completion summary, no-op
 * markers). {@code derived} is never part of the fact itself.
 */
public record EmitResult(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("timestamp") Instant timestamp,
    @JsonProperty("event_type") EventType eventType,
    @JsonProperty("schema_version") int schemaVersion,
    @JsonProperty("payload") EventPayload payload,
    @JsonProperty("derived") Map<String, Object> derived
) {

    static EmitResult of(EventRecord record, Map<String, Object> derived) {
        return new EmitResult(record.eventId(), record.timestamp(), record.type(), record.schemaVersion(),
            record.payload(), derived);
    }

    public boolean noOp() {
        return Boolean.TRUE.equals(derived.get("no_op"));
    }
}
