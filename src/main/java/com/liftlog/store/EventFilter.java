package com.liftlog.store;

import com.liftlog.contract.EventType;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Set;

/**
 * Selection over one user's log: optional type set, optional half-open time
 * range {@code [from, to)}, direction and an upper bound on the number of records.
 */
public record EventFilter(Set<EventType> types, Instant from, Instant to, Order order, int limit) {

    public enum Order {
        APPEND,
        REVERSE
    }

    public EventFilter {
        types = types == null || types.isEmpty() ? Set.of() : Set.copyOf(types);
        order = order == null ? Order.APPEND : order;
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }

    public static EventFilter all() {
        return new EventFilter(Set.of(), null, null, Order.APPEND, Integer.MAX_VALUE);
    }

    public EventFilter withTypes(EventType first, EventType... rest) {
        return new EventFilter(EnumSet.of(first, rest), from, to, order, limit);
    }

    public EventFilter between(Instant fromInclusive, Instant toExclusive) {
        return new EventFilter(types, fromInclusive, toExclusive, order, limit);
    }

    public EventFilter reversed() {
        return new EventFilter(types, from, to, Order.REVERSE, limit);
    }

    public EventFilter limitedTo(int maxRecords) {
        return new EventFilter(types, from, to, order, maxRecords);
    }

    public boolean matches(EventRecord record) {
        if (!types.isEmpty() && !types.contains(record.type())) {
            return false;
        }
        if (from != null && record.timestamp().isBefore(from)) {
            return false;
        }
        return to == null || record.timestamp().isBefore(to);
    }
}
