package com.liftlog.projection;

import com.liftlog.aggregate.AggregateBucket;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable snapshot of everything derived for one user: the projection rows
 * and the aggregate buckets. Writers build a new snapshot and swap it in, so a
 * reader always sees a snapshot from before or after an event, never between.
 */
public final class UserViews {

    public static final UserViews EMPTY = new UserViews(new TreeMap<>(), new TreeMap<>());

    private final SortedMap<String, ProjectionEntry> projections;
    private final SortedMap<String, AggregateBucket> aggregates;

    private UserViews(SortedMap<String, ProjectionEntry> projections, SortedMap<String, AggregateBucket> aggregates) {
        this.projections = Collections.unmodifiableSortedMap(projections);
        this.aggregates = Collections.unmodifiableSortedMap(aggregates);
    }

    public SortedMap<String, ProjectionEntry> projections() {
        return projections;
    }

    public SortedMap<String, AggregateBucket> aggregates() {
        return aggregates;
    }

    public Optional<ProjectionEntry> projection(String key) {
        return Optional.ofNullable(projections.get(key));
    }

    public Optional<AggregateBucket> aggregate(String key) {
        return Optional.ofNullable(aggregates.get(key));
    }

    public Optional<CurrentWorkout> currentWorkout() {
        return projection(ProjectionKeys.CURRENT_WORKOUT).map(e -> (CurrentWorkout) e.data());
    }

    @SuppressWarnings("unchecked")
    public List<WorkoutHistoryEntry> workoutHistory() {
        return projection(ProjectionKeys.WORKOUT_HISTORY)
            .map(e -> (List<WorkoutHistoryEntry>) e.data())
            .orElse(List.of());
    }

    @SuppressWarnings("unchecked")
    public List<WorkoutTemplate> templates() {
        return projection(ProjectionKeys.TEMPLATES)
            .map(e -> (List<WorkoutTemplate>) e.data())
            .orElse(List.of());
    }

    public Optional<WorkoutTemplate> template(String templateId) {
        return templates().stream().filter(t -> t.templateId().equals(templateId)).findFirst();
    }

    public Optional<ExerciseHistory> exerciseHistory(String exerciseId) {
        return projection(ProjectionKeys.exerciseHistory(exerciseId)).map(e -> (ExerciseHistory) e.data());
    }

    public UserViews withProjections(Map<String, ProjectionEntry> replacement) {
        return new UserViews(new TreeMap<>(replacement), new TreeMap<>(aggregates));
    }

    public UserViews withAggregates(Map<String, AggregateBucket> replacement) {
        return new UserViews(new TreeMap<>(projections), new TreeMap<>(replacement));
    }

    public Builder toBuilder() {
        return new Builder(projections, aggregates);
    }

    public static final class Builder {

        private final TreeMap<String, ProjectionEntry> projections;
        private TreeMap<String, AggregateBucket> aggregates;

        private Builder(Map<String, ProjectionEntry> projections, Map<String, AggregateBucket> aggregates) {
            this.projections = new TreeMap<>(projections);
            this.aggregates = new TreeMap<>(aggregates);
        }

        public Builder put(ProjectionEntry entry) {
            projections.put(entry.key(), entry);
            return this;
        }

        public Builder remove(String key) {
            projections.remove(key);
            return this;
        }

        public Builder aggregates(Map<String, AggregateBucket> replacement) {
            aggregates = new TreeMap<>(replacement);
            return this;
        }

        public UserViews build() {
            return new UserViews(new TreeMap<>(projections), new TreeMap<>(aggregates));
        }
    }
}
