package com.liftlog.projection;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One row of a user's projection table. {@code updatedAt} is the timestamp of
 * the event that last changed {@code data}, never the wall clock.
 */
public record ProjectionEntry(
    @JsonProperty("key") String key,
    @JsonProperty("data") Object data,
    @JsonProperty("updated_at") Instant updatedAt
) {}
