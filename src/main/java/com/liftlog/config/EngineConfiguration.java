package com.liftlog.config;

import com.liftlog.aggregate.AggregateEngine;
import com.liftlog.engine.UserLockRegistry;
import com.liftlog.engine.WorkoutPreconditions;
import com.liftlog.interpreter.ExerciseLibrary;
import com.liftlog.projection.InMemoryViewStore;
import com.liftlog.projection.ProjectionEngine;
import com.liftlog.projection.ViewStore;
import com.liftlog.store.EventPayloadCodec;
import com.liftlog.store.EventStore;
import com.liftlog.store.InMemoryEventStore;
import com.liftlog.store.JdbcEventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(LiftLogProperties.class)
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public EventPayloadCodec eventPayloadCodec() {
        return new EventPayloadCodec();
    }

    @Bean
    public EventStore eventStore(LiftLogProperties properties,
                                 Clock clock,
                                 EventPayloadCodec codec,
                                 ObjectProvider<JdbcTemplate> jdbcTemplate) {
        log.info("Using {} event store", properties.getStore());
        return switch (properties.getStore()) {
            case MEMORY -> new InMemoryEventStore(clock, properties.getSchemaVersion());
            case JDBC -> new JdbcEventStore(jdbcTemplate.getObject(), codec, clock, properties.getSchemaVersion());
        };
    }

    @Bean
    public ViewStore viewStore() {
        return new InMemoryViewStore();
    }

    @Bean
    public AggregateEngine aggregateEngine(LiftLogProperties properties) {
        return new AggregateEngine(ZoneId.of(properties.getAggregateZone()));
    }

    @Bean
    public ProjectionEngine projectionEngine(AggregateEngine aggregateEngine) {
        return ProjectionEngine.standard(aggregateEngine);
    }

    @Bean
    public WorkoutPreconditions workoutPreconditions() {
        return new WorkoutPreconditions();
    }

    @Bean
    public UserLockRegistry userLockRegistry() {
        return new UserLockRegistry();
    }

    @Bean
    public ExerciseLibrary exerciseLibrary(LiftLogProperties properties) {
        ExerciseLibrary library = ExerciseLibrary.fromClasspath(properties.getExerciseLibrary());
        log.info("Loaded {} exercises from {}", library.exercises().size(), properties.getExerciseLibrary());
        return library;
    }
}
