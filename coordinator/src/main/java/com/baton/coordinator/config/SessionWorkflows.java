package com.baton.coordinator.config;

import com.baton.coordinator.engine.WorkflowSnapshot;
import com.baton.coordinator.model.StateSnapshot;
import com.baton.coordinator.store.CoordinationException;
import com.baton.coordinator.store.CoordinationStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-session workflow snapshots.
 *
 * At session creation the current configuration document is written into
 * the session's global state ({@value #STATE_TYPE}). Every later routing
 * call compiles that stored copy once and reuses the immutable result, so
 * editing {@code transitions.json} never changes a running session. A
 * session whose stored copy is gone is not routed with the current file.
 */
@Component
public class SessionWorkflows {

    public static final String STATE_TYPE = "workflow_config";

    private static final Logger log = LoggerFactory.getLogger(SessionWorkflows.class);

    private final ConcurrentHashMap<String, WorkflowSnapshot> cache = new ConcurrentHashMap<>();

    private final CoordinationStore    store;
    private final WorkflowConfigLoader loader;
    private final ObjectMapper         objectMapper;

    public SessionWorkflows(CoordinationStore store, WorkflowConfigLoader loader, ObjectMapper objectMapper) {
        this.store        = store;
        this.loader       = loader;
        this.objectMapper = objectMapper;
    }

    /** Store the current configuration as the session's snapshot and cache it. */
    public WorkflowSnapshot snapshotFor(String sessionId) {
        WorkflowConfig config = loader.load();
        try {
            store.upsertState(sessionId, StateSnapshot.GLOBAL_SCOPE, STATE_TYPE,
                    objectMapper.writeValueAsString(config));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialise workflow config: " + e.getOriginalMessage(), e);
        }
        WorkflowSnapshot snapshot = config.compile();
        cache.put(sessionId, snapshot);
        return snapshot;
    }

    /**
     * The snapshot taken when the session was created.
     *
     * @throws CoordinationException STATE_INCONSISTENCY when the stored copy is
     *                               missing or cannot be compiled
     */
    public WorkflowSnapshot forSession(String sessionId) {
        return cache.computeIfAbsent(sessionId, this::loadStored);
    }

    private WorkflowSnapshot loadStored(String sessionId) {
        StateSnapshot stored = store.getState(sessionId, StateSnapshot.GLOBAL_SCOPE, STATE_TYPE)
                .orElseThrow(() -> inconsistent(sessionId, "has no stored workflow config", null));
        try {
            return objectMapper.readValue(stored.getPayload(), WorkflowConfig.class).compile();
        } catch (JsonProcessingException | IllegalStateException e) {
            throw inconsistent(sessionId, "has an unusable stored workflow config: " + e.getMessage(), e);
        }
    }

    private static CoordinationException inconsistent(String sessionId, String problem, Exception cause) {
        log.error("Session {} {}", sessionId, problem);
        return new CoordinationException(CoordinationException.Kind.STATE_INCONSISTENCY,
                "session " + sessionId + " " + problem, cause);
    }
}
