package com.baton.coordinator.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Startup check: load and compile the workflow configuration once, so a
 * broken transitions file stops the process here instead of failing the
 * first session.
 */
@Component
public class WorkflowConfigCheck implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(WorkflowConfigCheck.class);

    private final WorkflowConfigLoader loader;

    public WorkflowConfigCheck(WorkflowConfigLoader loader) {
        this.loader = loader;
    }

    @Override
    public void run(String... args) {
        WorkflowConfig config = loader.load();
        log.info("Workflow config v{} ready: {} roles, limits {}/{}",
                config.version(), config.transitions().size(),
                config.limits().maxIterations(), config.limits().hardIterationCap());
    }
}
