package com.liftlog.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;

/**
 * JSON form of a payload as it is persisted. Decimal weights keep their exact
 * scale across a write/read cycle.
 */
public class EventPayloadCodec {

    private final ObjectMapper mapper = JsonMapper.builder()
        .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
        .build();

    public String encode(EventPayload payload) {
        try {
            return mapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("payload of type " + payload.type().getValue() + " is not serializable", ex);
        }
    }

    public EventPayload decode(EventType type, String json) {
        try {
            return mapper.readValue(json, type.payloadClass());
        } catch (JsonProcessingException ex) {
            throw new StorageFailureException("stored payload of type " + type.getValue() + " is unreadable", ex);
        }
    }
}
