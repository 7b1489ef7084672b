package com.liftlog.config;

import com.liftlog.engine.ReplayCoordinator;
import com.liftlog.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Set;

/** Views live in memory, so after a restart they are rebuilt from the persisted log. */
@Component
public class StartupRebuildRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupRebuildRunner.class);

    private final LiftLogProperties properties;
    private final EventStore eventStore;
    private final ReplayCoordinator replayCoordinator;

    public StartupRebuildRunner(LiftLogProperties properties,
                                EventStore eventStore,
                                ReplayCoordinator replayCoordinator) {
        this.properties = properties;
        this.eventStore = eventStore;
        this.replayCoordinator = replayCoordinator;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.isRebuildOnStartup()) {
            return;
        }
        Set<String> userIds = eventStore.userIds();
        if (userIds.isEmpty()) {
            return;
        }
        log.info("Rebuilding views for {} users from the event log", userIds.size());
        userIds.forEach(replayCoordinator::rebuildAll);
    }
}
