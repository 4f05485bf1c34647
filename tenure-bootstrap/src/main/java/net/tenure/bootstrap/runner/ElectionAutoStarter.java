package net.tenure.bootstrap.runner;

import net.tenure.core.engine.ElectionEngine;
import net.tenure.core.model.BackendKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/** Starts an election on a configured backend once the application is up. */
public class ElectionAutoStarter implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(ElectionAutoStarter.class);

    private final ElectionEngine engine;
    private final BackendKind backend;

    public ElectionAutoStarter(ElectionEngine engine, String backend) {
        this.engine = engine;
        this.backend = BackendKind.from(backend);
    }

    public BackendKind backend() {
        return backend;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("[Tenure] auto-start: {} backend, {} node(s)", backend.label(), engine.nodes().size());
        engine.startElection(backend);
    }
}
