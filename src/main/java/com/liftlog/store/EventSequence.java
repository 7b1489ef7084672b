package com.liftlog.store;

import java.util.Iterator;
import java.util.List;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Lazy, finite view over part of a log. Nothing is read until the sequence is
 * iterated, and every iteration starts again from the beginning.
 */
public final class EventSequence implements Iterable<EventRecord> {

    private final Supplier<Stream<EventRecord>> source;

    public EventSequence(Supplier<Stream<EventRecord>> source) {
        this.source = source;
    }

    public Stream<EventRecord> stream() {
        return source.get();
    }

    @Override
    public Iterator<EventRecord> iterator() {
        return stream().iterator();
    }

    public List<EventRecord> toList() {
        return stream().collect(Collectors.toList());
    }
}
