package com.liftlog.store;

import com.liftlog.contract.EventPayload;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.IntStream;

public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<EventRecord>> logs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final int schemaVersion;

    public InMemoryEventStore(Clock clock, int schemaVersion) {
        this.clock = clock;
        this.schemaVersion = schemaVersion;
    }

    @Override
    public EventRecord stamp(String userId, EventPayload payload) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MICROS);
        List<EventRecord> log = logs.get(userId);
        if (log != null && !log.isEmpty()) {
            Instant last = log.get(log.size() - 1).timestamp();
            if (now.isBefore(last)) {
                now = last;
            }
        }
        return new EventRecord(UUID.randomUUID().toString(), userId, now, payload.type(), payload, schemaVersion);
    }

    @Override
    public EventRecord append(EventRecord record) {
        CopyOnWriteArrayList<EventRecord> log = logs.computeIfAbsent(record.userId(), k -> new CopyOnWriteArrayList<>());
        if (!log.isEmpty() && record.timestamp().isBefore(log.get(log.size() - 1).timestamp())) {
            throw new IllegalStateException("timestamp " + record.timestamp()
                + " precedes the last event of user " + record.userId());
        }
        log.add(record);
        return record;
    }

    @Override
    public EventSequence list(String userId, EventFilter filter) {
        List<EventRecord> log = logs.getOrDefault(userId, new CopyOnWriteArrayList<>());
        // the log only grows, so indices below the captured size are stable
        int size = log.size();
        boolean reverse = filter.order() == EventFilter.Order.REVERSE;
        return new EventSequence(() -> IntStream.range(0, size)
            .mapToObj(i -> log.get(reverse ? size - 1 - i : i))
            .filter(filter::matches)
            .limit(filter.limit()));
    }

    @Override
    public long count(String userId) {
        List<EventRecord> log = logs.get(userId);
        return log == null ? 0 : log.size();
    }

    @Override
    public Set<String> userIds() {
        return Set.copyOf(logs.keySet());
    }
}
