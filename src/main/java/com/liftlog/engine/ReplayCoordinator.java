package com.liftlog.engine;

import com.liftlog.aggregate.AggregateBucket;
import com.liftlog.aggregate.CompletedWorkout;
import com.liftlog.projection.CanonicalJson;
import com.liftlog.projection.ProjectionEngine;
import com.liftlog.projection.UserViews;
import com.liftlog.projection.ViewStore;
import com.liftlog.store.EventFilter;
import com.liftlog.store.EventRecord;
import com.liftlog.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Rebuilds a user's views by folding the whole log, in append order, through
 * the same {@link ProjectionEngine} the live path uses.
 *
 * The rebuilt snapshot is assembled off to the side and only committed once the
 * last event is applied, so an interrupted replay changes nothing. Unless
 * forced, any key whose rebuilt value differs from the live one aborts the
 * rebuild with {@link RebuildDivergenceException}.
 */
@Service
public class ReplayCoordinator {

    private static final Logger log = LoggerFactory.getLogger(ReplayCoordinator.class);

    private final EventStore eventStore;
    private final ViewStore viewStore;
    private final ProjectionEngine projectionEngine;
    private final UserLockRegistry locks;

    public ReplayCoordinator(EventStore eventStore,
                             ViewStore viewStore,
                             ProjectionEngine projectionEngine,
                             UserLockRegistry locks) {
        this.eventStore = eventStore;
        this.viewStore = viewStore;
        this.projectionEngine = projectionEngine;
        this.locks = locks;
    }

    public RebuildReport rebuildAll(String userId) {
        return rebuild(userId, RebuildScope.ALL, false);
    }

    public RebuildReport rebuild(String userId, RebuildScope scope, boolean force) {
        ReentrantLock lock = locks.lockFor(userId);
        lock.lock();
        try {
            log.info("Rebuild started for user={} scope={} force={}", userId, scope, force);
            UserViews live = viewStore.load(userId);
            Replay replay = replay(userId);
            UserViews rebuilt = replay.views();

            List<String> diverged = new ArrayList<>();
            List<String> restored = new ArrayList<>();
            UserViews target = live;
            if (scope.includesProjections()) {
                compare(live.projections(), rebuilt.projections(), diverged, restored);
                target = target.withProjections(rebuilt.projections());
            }
            if (scope.includesAggregates()) {
                compare(live.aggregates(), rebuilt.aggregates(), diverged, restored);
                target = target.withAggregates(rebuilt.aggregates());
            }

            if (!diverged.isEmpty()) {
                if (!force) {
                    log.error("Rebuild diverged for user={} keys={}", userId, diverged);
                    throw new RebuildDivergenceException(userId, diverged);
                }
                log.warn("Forced rebuild for user={} overwrites diverged keys={}", userId, diverged);
            }
            viewStore.commit(userId, target);

            RebuildReport report = new RebuildReport(userId, scope, replay.eventCount(),
                target.projections().size(), target.aggregates().size(), restored, diverged, force);
            log.info("Rebuild finished for user={} events={} projections={} aggregates={} restored={}",
                userId, report.eventsReplayed(), report.projectionKeys(), report.aggregateKeys(),
                restored.size());
            return report;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Buckets recomputed from scratch by scanning every completed workout in the
     * log. Nothing is committed; callers compare this with the live buckets.
     */
    public SortedMap<String, AggregateBucket> recomputeAggregates(String userId) {
        return projectionEngine.aggregateEngine().recompute(replay(userId).completedWorkouts());
    }

    private Replay replay(String userId) {
        UserViews views = UserViews.EMPTY;
        List<CompletedWorkout> completed = new ArrayList<>();
        int count = 0;
        for (EventRecord event : eventStore.list(userId, EventFilter.all())) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Rebuild cancelled for user={} after {} events", userId, count);
                throw new ReplayCancelledException(userId, count);
            }
            ProjectionEngine.Reduction reduction = projectionEngine.apply(views, event);
            views = reduction.views();
            if (reduction.completed() != null) {
                completed.add(reduction.completed());
            }
            count++;
        }
        return new Replay(views, completed, count);
    }

    /** Keys whose live and rebuilt values differ go to {@code diverged}; keys only in the rebuild go to {@code restored}. */
    private static <V> void compare(Map<String, V> live, Map<String, V> rebuilt,
                                    List<String> diverged, List<String> restored) {
        for (Map.Entry<String, V> entry : live.entrySet()) {
            V replayed = rebuilt.get(entry.getKey());
            if (replayed == null
                    || !Arrays.equals(CanonicalJson.bytes(entry.getValue()), CanonicalJson.bytes(replayed))) {
                diverged.add(entry.getKey());
            }
        }
        for (String key : rebuilt.keySet()) {
            if (!live.containsKey(key)) {
                restored.add(key);
            }
        }
    }

    private record Replay(UserViews views, List<CompletedWorkout> completedWorkouts, int eventCount) {}
}
