package com.liftlog.engine;

import com.liftlog.aggregate.AggregateBucket;
import com.liftlog.config.LiftLogProperties;
import com.liftlog.contract.EventPayload;
import com.liftlog.contract.EventType;
import com.liftlog.contract.PayloadValidator;
import com.liftlog.projection.ProjectionEngine;
import com.liftlog.projection.ProjectionEntry;
import com.liftlog.projection.UserViews;
import com.liftlog.projection.ViewStore;
import com.liftlog.store.EventFilter;
import com.liftlog.store.EventRecord;
import com.liftlog.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The only write path into a user's log. An emit validates, checks the workout
 * lifecycle, folds the event into a fresh view snapshot, appends, and then
 * swaps the snapshot in, all under the user's lock. Folding happens before the
 * append so a failed append leaves both the log and the views as they were.
 * Subscribers are notified before the lock is released, so each one sees a
 * user's events in append order. A slow subscriber delays that user's next emit.
 *
 * Reads never lock; they see the last committed snapshot.
 */
@Service
public class WorkoutEventEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkoutEventEngine.class);

    private final PayloadValidator validator;
    private final EventStore eventStore;
    private final ViewStore viewStore;
    private final ProjectionEngine projectionEngine;
    private final WorkoutPreconditions preconditions;
    private final UserLockRegistry locks;
    private final LiftLogProperties properties;
    private final ConcurrentHashMap<String, Subscription> subscribers = new ConcurrentHashMap<>();

    public WorkoutEventEngine(PayloadValidator validator,
                              EventStore eventStore,
                              ViewStore viewStore,
                              ProjectionEngine projectionEngine,
                              WorkoutPreconditions preconditions,
                              UserLockRegistry locks,
                              LiftLogProperties properties) {
        this.validator = validator;
        this.eventStore = eventStore;
        this.viewStore = viewStore;
        this.projectionEngine = projectionEngine;
        this.preconditions = preconditions;
        this.locks = locks;
        this.properties = properties;
    }

    public EmitResult emit(String userId, String eventType, Map<String, Object> payload) {
        validator.checkUserId(userId);
        EventType type = EventType.fromValue(eventType);
        EventPayload validated = validator.validate(type, withGeneratedIds(type, payload),
            properties.preferredUnit(userId));

        EmitResult result;
        ReentrantLock lock = locks.lockFor(userId);
        lock.lock();
        try {
            UserViews prior = viewStore.load(userId);
            EventPayload resolved = preconditions.resolve(validated, prior);
            EventRecord stamped = eventStore.stamp(userId, resolved);
            ProjectionEngine.Reduction reduction = projectionEngine.apply(prior, stamped);
            EventRecord appended = eventStore.append(stamped);
            viewStore.commit(userId, reduction.views());
            result = EmitResult.of(appended, reduction.derived());
            notifySubscribers(userId, result);
        } finally {
            lock.unlock();
        }

        if (result.noOp()) {
            log.warn("Accepted {} for user={} as no-op, reference {} not found",
                type.getValue(), userId, result.derived().get("reference_miss"));
        } else {
            log.info("Accepted {} event_id={} for user={}", type.getValue(), result.eventId(), userId);
        }
        if (type == EventType.WORKOUT_COMPLETED) {
            log.info("Workout completed for user={} summary={}", userId, result.derived().get("summary"));
        }
        return result;
    }

    public Optional<Object> query(String userId, QueryKind kind, String key) {
        return switch (kind) {
            case PROJECTION -> projection(userId, key).map(ProjectionEntry::data);
            case AGGREGATE -> aggregate(userId, key).map(bucket -> (Object) bucket);
        };
    }

    public Optional<ProjectionEntry> projection(String userId, String key) {
        return viewStore.load(userId).projection(key);
    }

    public Optional<AggregateBucket> aggregate(String userId, String key) {
        return viewStore.load(userId).aggregate(key);
    }

    public List<EventRecord> events(String userId, EventFilter filter) {
        return eventStore.list(userId, filter).toList();
    }

    public String subscribe(String userId, Consumer<EmitResult> listener) {
        String id = UUID.randomUUID().toString();
        subscribers.put(id, new Subscription(userId, listener));
        return id;
    }

    public void unsubscribe(String id) {
        subscribers.remove(id);
    }

    /** Ids the caller may omit are filled here, before validation, so the logged fact carries them. */
    private Map<String, Object> withGeneratedIds(EventType type, Map<String, Object> payload) {
        if (payload == null) {
            return null;
        }
        String idField = switch (type) {
            case WORKOUT_STARTED -> "workout_id";
            case TEMPLATE_CREATED -> "template_id";
            default -> null;
        };
        if (idField == null || payload.get(idField) != null) {
            return payload;
        }
        Map<String, Object> filled = new HashMap<>(payload);
        filled.put(idField, UUID.randomUUID().toString());
        return filled;
    }

    private void notifySubscribers(String userId, EmitResult result) {
        subscribers.values().forEach(subscription -> {
            if (!subscription.userId().equals(userId)) {
                return;
            }
            try {
                subscription.listener().accept(result);
            } catch (Exception ex) {
                log.warn("Subscriber notification failed for event={}: {}", result.eventId(), ex.getMessage());
            }
        });
    }

    private record Subscription(String userId, Consumer<EmitResult> listener) {}
}
