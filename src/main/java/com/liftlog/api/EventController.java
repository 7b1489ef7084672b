package com.liftlog.api;

import com.liftlog.contract.EventType;
import com.liftlog.engine.EmitResult;
import com.liftlog.engine.WorkoutEventEngine;
import com.liftlog.store.EventFilter;
import com.liftlog.store.EventRecord;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * POST /v1/users/{userId}/events          emit one event
 * GET  /v1/users/{userId}/events          list the log, newest first by default
 * GET  /v1/users/{userId}/events/stream   accepted events as server-sent events
 */
@RestController
@RequestMapping("/v1/users/{userId}/events")
public class EventController {

    private static final int MAX_LIMIT = 1000;

    private final WorkoutEventEngine engine;

    public EventController(WorkoutEventEngine engine) {
        this.engine = engine;
    }

    /**
     * Expected request body:
     * {
     *   "event_type": "set-logged",
     *   "payload": { "workout_id": "w1", "weight": 100, "reps": 8 }
     * }
     */
    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public EmitResult emit(@PathVariable String userId, @RequestBody Map<String, Object> request) {
        Object eventType = request.get("event_type");
        @SuppressWarnings("unchecked")
        Map<String, Object> payload = request.get("payload") instanceof Map
            ? (Map<String, Object>) request.get("payload")
            : null;
        return engine.emit(userId, eventType instanceof String s ? s : null, payload);
    }

    @GetMapping
    public List<EventRecord> list(@PathVariable String userId,
                                  @RequestParam(required = false) List<String> type,
                                  @RequestParam(required = false)
                                  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                  @RequestParam(required = false)
                                  @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
                                  @RequestParam(defaultValue = "desc") String order,
                                  @RequestParam(defaultValue = "100") int limit) {
        Set<EventType> types = EnumSet.noneOf(EventType.class);
        if (type != null) {
            type.forEach(raw -> types.add(EventType.fromValue(raw)));
        }
        EventFilter.Order direction = switch (order.toLowerCase()) {
            case "asc" -> EventFilter.Order.APPEND;
            case "desc" -> EventFilter.Order.REVERSE;
            default -> throw new IllegalArgumentException("order must be one of: asc, desc");
        };
        return engine.events(userId, new EventFilter(types, from, to, direction, Math.min(limit, MAX_LIMIT)));
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String userId) {
        SseEmitter emitter = new SseEmitter(0L);
        String subscriptionId = engine.subscribe(userId, result -> {
            try {
                emitter.send(SseEmitter.event()
                    .id(result.eventId())
                    .name(result.eventType().getValue())
                    .data(result));
            } catch (IOException ex) {
                emitter.completeWithError(ex);
            }
        });

        emitter.onCompletion(() -> engine.unsubscribe(subscriptionId));
        emitter.onTimeout(() -> engine.unsubscribe(subscriptionId));
        emitter.onError(ex -> engine.unsubscribe(subscriptionId));
        return emitter;
    }
}
