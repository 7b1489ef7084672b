package com.liftlog.projection;

import com.liftlog.store.EventRecord;

import java.util.List;

/**
 * A pure fold step for one family of projection keys.
 *
 * @param <S> state stored under the keys this reducer owns
 */
public interface ProjectionReducer<S> {

    /** Keys this event touches; empty when the reducer has nothing to do. */
    List<String> keysFor(EventRecord event, ReductionContext context);

    /** State to fold into when the key has no row yet; may be null. */
    S initialState(String key);

    /** The next state for {@code key}, or null to remove the row. */
    S reduce(String key, S prior, EventRecord event, ReductionContext context);
}
