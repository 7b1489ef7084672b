package com.liftlog.api;

import com.liftlog.aggregate.AggregateBucket;
import com.liftlog.engine.WorkoutEventEngine;
import com.liftlog.projection.ProjectionEntry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Read side.
 *
 * GET /v1/users/{userId}/projections/{key}   e.g. current_workout, exercise_history:bench-press
 * GET /v1/users/{userId}/aggregates/{key}    e.g. weekly:2024-W03
 */
@RestController
@RequestMapping("/v1/users/{userId}")
public class ViewController {

    private final WorkoutEventEngine engine;

    public ViewController(WorkoutEventEngine engine) {
        this.engine = engine;
    }

    @GetMapping("/projections/{key}")
    public ResponseEntity<ProjectionEntry> projection(@PathVariable String userId, @PathVariable String key) {
        return engine.projection(userId, key)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/aggregates/{key}")
    public ResponseEntity<AggregateBucket> aggregate(@PathVariable String userId, @PathVariable String key) {
        return engine.aggregate(userId, key)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
