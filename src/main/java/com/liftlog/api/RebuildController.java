package com.liftlog.api;

import com.liftlog.engine.RebuildReport;
import com.liftlog.engine.RebuildScope;
import com.liftlog.engine.ReplayCoordinator;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** POST /v1/admin/users/{userId}/rebuild?scope=all|projections|aggregates&force=false */
@RestController
@RequestMapping("/v1/admin/users/{userId}")
public class RebuildController {

    private final ReplayCoordinator replayCoordinator;

    public RebuildController(ReplayCoordinator replayCoordinator) {
        this.replayCoordinator = replayCoordinator;
    }

    @PostMapping("/rebuild")
    public RebuildReport rebuild(@PathVariable String userId,
                                 @RequestParam(required = false) String scope,
                                 @RequestParam(defaultValue = "false") boolean force) {
        return replayCoordinator.rebuild(userId, RebuildScope.fromValue(scope), force);
    }
}
