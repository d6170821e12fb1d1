package com.baton.coordinator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads the workflow configuration document.
 *
 * Called once per session creation. The result is copied into the session,
 * so the running engine never goes back to the file.
 */
@Component
public class WorkflowConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(WorkflowConfigLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper   objectMapper;
    private final String         location;

    public WorkflowConfigLoader(ResourceLoader resourceLoader,
                                ObjectMapper objectMapper,
                                @Value("${coordinator.workflow-config:classpath:workflow/transitions.json}")
                                String location) {
        this.resourceLoader = resourceLoader;
        this.objectMapper   = objectMapper;
        this.location       = location;
    }

    /**
     * Load and validate the current document.
     *
     * @throws IllegalStateException when the document is missing, unreadable or invalid
     */
    public WorkflowConfig load() {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("workflow config not found at " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            WorkflowConfig config = objectMapper.readValue(in, WorkflowConfig.class);
            // Compile once here so a broken document fails before a session is created with it.
            int rows = config.compile().transitions().size();
            log.debug("Loaded workflow config v{} from {} ({} transitions)", config.version(), location, rows);
            return config;
        } catch (IOException e) {
            throw new IllegalStateException("cannot read workflow config at " + location + ": " + e.getMessage(), e);
        }
    }
}
