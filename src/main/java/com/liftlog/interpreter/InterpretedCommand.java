package com.liftlog.interpreter;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.liftlog.engine.QueryKind;

import java.util.Map;

public sealed interface InterpretedCommand {

    record Emit(
        @JsonProperty("event_type") String eventType,
        @JsonProperty("payload") Map<String, Object> payload
    ) implements InterpretedCommand {}

    record Query(
        @JsonProperty("kind") QueryKind kind,
        @JsonProperty("key") String key
    ) implements InterpretedCommand {}
}
