package com.liftlog.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RebuildReport(
    @JsonProperty("user_id") String userId,
    @JsonProperty("scope") RebuildScope scope,
    @JsonProperty("events_replayed") int eventsReplayed,
    @JsonProperty("projection_keys") int projectionKeys,
    @JsonProperty("aggregate_keys") int aggregateKeys,
    @JsonProperty("restored_keys") List<String> restoredKeys,
    @JsonProperty("diverged_keys") List<String> divergedKeys,
    @JsonProperty("forced") boolean forced
) {

    public RebuildReport {
        restoredKeys = List.copyOf(restoredKeys);
        divergedKeys = List.copyOf(divergedKeys);
    }
}
