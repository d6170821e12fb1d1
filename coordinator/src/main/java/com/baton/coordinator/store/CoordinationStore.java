package com.baton.coordinator.store;

import com.baton.coordinator.event.EventPayload;
import com.baton.coordinator.event.EventPayloadCodec;
import com.baton.coordinator.model.*;
import com.baton.coordinator.repository.EventRepository;
import com.baton.coordinator.repository.SessionRepository;
import com.baton.coordinator.repository.StateSnapshotRepository;
import com.baton.coordinator.repository.TaskGroupRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Durable home of sessions, task groups, events and state snapshots.
 *
 * Every identifier is checked before anything is written, so a malformed id
 * never reaches a table. Writes go through {@link SessionWriteGuard} and are
 * therefore serialised per session and atomic. Event appends are idempotent
 * on their dedup key.
 *
 * Reads of optional data (state snapshots, group lookups) return an empty
 * value rather than raising.
 */
@Service
public class CoordinationStore {

    private static final Logger log = LoggerFactory.getLogger(CoordinationStore.class);

    private final SessionRepository       sessionRepo;
    private final TaskGroupRepository     groupRepo;
    private final EventRepository         eventRepo;
    private final StateSnapshotRepository stateRepo;
    private final EventPayloadCodec       codec;
    private final SessionWriteGuard       guard;
    private final ObjectMapper            objectMapper;

    public CoordinationStore(SessionRepository sessionRepo,
                             TaskGroupRepository groupRepo,
                             EventRepository eventRepo,
                             StateSnapshotRepository stateRepo,
                             EventPayloadCodec codec,
                             SessionWriteGuard guard,
                             ObjectMapper objectMapper) {
        this.sessionRepo  = sessionRepo;
        this.groupRepo    = groupRepo;
        this.eventRepo    = eventRepo;
        this.stateRepo    = stateRepo;
        this.codec        = codec;
        this.guard        = guard;
        this.objectMapper = objectMapper;
    }

    // ------------------------------------------------------------------
    // Sessions
    // ------------------------------------------------------------------

    /**
     * Create a session with its original scope.
     *
     * @throws CoordinationException CONFLICT if the id is taken, VALIDATION_ERROR on a bad id or scope
     */
    public Session createSession(String sessionId, List<ScopeItem> scope,
                                 ExecutionMode executionMode, TestingMode testingMode) {
        Identifiers.sessionId(sessionId);
        List<ScopeItem> items = scope == null ? List.of() : scope;
        Set<String> seen = new HashSet<>();
        for (ScopeItem item : items) {
            if (item == null) {
                throw CoordinationException.validation("scope items cannot be null");
            }
            Identifiers.scopeItemId(item.id());
            if (!seen.add(item.id())) {
                throw CoordinationException.validation("duplicate scope item id '" + item.id() + "'");
            }
        }

        return guard.inTransaction(sessionId, () -> {
            if (sessionRepo.existsById(sessionId)) {
                throw new CoordinationException(CoordinationException.Kind.CONFLICT,
                        "session " + sessionId + " already exists");
            }
            Session session = sessionRepo.save(new Session(sessionId, items,
                    executionMode == null ? ExecutionMode.SINGLE_TRACK : executionMode,
                    testingMode == null ? TestingMode.FULL : testingMode));
            log.info("Created session {} ({} scope items, {}, testing {})",
                    sessionId, items.size(), session.getExecutionMode(), session.getTestingMode());
            return session;
        });
    }

    @Transactional(readOnly = true)
    public Optional<Session> getSession(String sessionId) {
        Identifiers.sessionId(sessionId);
        return sessionRepo.findById(sessionId);
    }

    /** @throws CoordinationException NOT_FOUND for an unknown session */
    @Transactional(readOnly = true)
    public Session requireSession(String sessionId) {
        return getSession(sessionId).orElseThrow(() ->
                CoordinationException.notFound("session " + sessionId + " does not exist"));
    }

    /** Mark the session completed. Closing a closed session is a no-op. */
    public Session closeSession(String sessionId) {
        Identifiers.sessionId(sessionId);
        return guard.inTransaction(sessionId, () -> {
            Session session = requireSession(sessionId);
            if (!session.isClosed()) {
                session.close();
                session = sessionRepo.save(session);
                log.info("Closed session {}", sessionId);
            }
            return session;
        });
    }

    // ------------------------------------------------------------------
    // Task groups
    // ------------------------------------------------------------------

    /**
     * Create the group if it does not exist, otherwise apply the non-null fields.
     *
     * A status given here may not sign a group off or move it out of a
     * terminal status. Those changes only come from routed reports and reviews.
     *
     * @throws CoordinationException VALIDATION_ERROR on a bad id, a missing name on create,
     *                               complexity outside 1..10, a decreasing review iteration
     *                               or a refused status change;
     *                               NOT_FOUND for an unknown session
     */
    public TaskGroup upsertTaskGroup(String sessionId, TaskGroupUpdate update) {
        Identifiers.sessionId(sessionId);
        if (update == null) {
            throw CoordinationException.validation("task group fields are required");
        }
        Identifiers.groupId(update.groupId());
        if (update.complexity() != null && (update.complexity() < 1 || update.complexity() > 10)) {
            throw CoordinationException.validation("complexity must be between 1 and 10, was " + update.complexity());
        }
        if (update.reviewIteration() != null && update.reviewIteration() < 0) {
            throw CoordinationException.validation("review_iteration cannot be negative");
        }
        if (update.scopeItemIds() != null) {
            update.scopeItemIds().forEach(Identifiers::scopeItemId);
        }

        return guard.inTransaction(sessionId, () -> {
            requireSession(sessionId);
            TaskGroup group = groupRepo.findBySessionIdAndGroupId(sessionId, update.groupId())
                    .orElseGet(() -> {
                        if (update.name() == null || update.name().isBlank()) {
                            throw CoordinationException.validation("name is required to create group " + update.groupId());
                        }
                        return new TaskGroup(sessionId, update.groupId(), update.name());
                    });

            if (update.name() != null && !update.name().isBlank()) group.setName(update.name());
            if (update.status() != null && update.status() != group.getStatus()) {
                checkManualStatusChange(group, update.status());
                group.setStatus(update.status());
            }
            if (update.assignedRole() != null) group.setAssignedRole(update.assignedRole());
            if (update.complexity() != null)   group.setComplexity(update.complexity());
            if (update.scopeItemIds() != null) group.setScopeItemIds(update.scopeItemIds());
            if (update.reviewIteration() != null) {
                try {
                    group.setReviewIteration(update.reviewIteration());
                } catch (IllegalArgumentException e) {
                    throw CoordinationException.validation(e.getMessage() + " for group " + update.groupId());
                }
            }
            return groupRepo.save(group);
        });
    }

    private static void checkManualStatusChange(TaskGroup group, GroupStatus target) {
        if (group.getStatus().isTerminal()) {
            throw CoordinationException.validation("group %s is %s and cannot be moved to %s"
                    .formatted(group.getGroupId(), group.getStatus(), target));
        }
        if (target.isSignedOff()) {
            throw CoordinationException.validation("group %s can only reach %s through a review"
                    .formatted(group.getGroupId(), target));
        }
    }

    @Transactional(readOnly = true)
    public Optional<TaskGroup> getTaskGroup(String sessionId, String groupId) {
        Identifiers.sessionId(sessionId);
        Identifiers.groupId(groupId);
        return groupRepo.findBySessionIdAndGroupId(sessionId, groupId);
    }

    /** @throws CoordinationException NOT_FOUND for an unknown group */
    @Transactional(readOnly = true)
    public TaskGroup requireTaskGroup(String sessionId, String groupId) {
        return getTaskGroup(sessionId, groupId).orElseThrow(() ->
                CoordinationException.notFound("task group " + groupId + " does not exist in session " + sessionId));
    }

    @Transactional(readOnly = true)
    public List<TaskGroup> listTaskGroups(String sessionId) {
        Identifiers.sessionId(sessionId);
        return groupRepo.findBySessionIdOrderByCreatedAtAsc(sessionId);
    }

    @Transactional(readOnly = true)
    public List<TaskGroup> listTaskGroups(String sessionId, GroupStatus status) {
        Identifiers.sessionId(sessionId);
        return groupRepo.findBySessionIdAndStatusOrderByCreatedAtAsc(sessionId, status);
    }

    /** Persist counters and status changed by the engine on an already loaded group. */
    public TaskGroup saveGroup(TaskGroup group) {
        return guard.inTransaction(group.getSessionId(), () -> groupRepo.save(group));
    }

    // ------------------------------------------------------------------
    // Events
    // ------------------------------------------------------------------

    /**
     * Append an event. Repeating an append with the same dedup key stores
     * nothing and returns the earlier row.
     *
     * @param groupId null for session-level events
     * @throws CoordinationException VALIDATION_ERROR on a bad id or payload,
     *                               NOT_FOUND for an unknown session or group,
     *                               CONFLICT when the key belongs to another session
     */
    public AppendResult appendEvent(String sessionId, String groupId,
                                    EventPayload payload, String dedupKey) {
        Identifiers.sessionId(sessionId);
        if (groupId != null) {
            Identifiers.groupId(groupId);
        }
        Identifiers.dedupKey(dedupKey);
        String json = codec.encode(payload);

        return guard.inTransaction(sessionId, () -> {
            Optional<Event> existing = eventRepo.findByDedupKey(dedupKey);
            if (existing.isPresent()) {
                Event earlier = existing.get();
                if (!earlier.getSessionId().equals(sessionId)) {
                    throw new CoordinationException(CoordinationException.Kind.CONFLICT,
                            "dedup_key " + dedupKey + " is already used by another session");
                }
                log.debug("Duplicate event {} ignored (session={})", dedupKey, sessionId);
                return new AppendResult(earlier, true);
            }

            requireSession(sessionId);
            if (groupId != null) {
                requireTaskGroup(sessionId, groupId);
            }
            Event stored = eventRepo.saveAndFlush(new Event(sessionId, groupId, payload.type(), json, dedupKey));
            log.debug("Appended {} event {} (session={}, group={})",
                    payload.type(), stored.getId(), sessionId, groupId);
            return new AppendResult(stored, false);
        });
    }

    /** Events of a session in append order, filtered by {@code query}. Unknown sessions yield an empty list. */
    @Transactional(readOnly = true)
    public List<Event> findEvents(String sessionId, EventQuery query) {
        Identifiers.sessionId(sessionId);
        EventQuery q = query == null ? EventQuery.all() : query;
        if (q.groupId() != null) {
            Identifiers.groupId(q.groupId());
        }
        if (q.limit() != null && q.limit() < 1) {
            throw CoordinationException.validation("limit must be positive");
        }

        List<Event> rows;
        if (q.groupId() != null && q.type() != null) {
            rows = eventRepo.findBySessionIdAndGroupIdAndEventTypeOrderByIdAsc(sessionId, q.groupId(), q.type());
        } else if (q.groupId() != null) {
            rows = eventRepo.findBySessionIdAndGroupIdOrderByIdAsc(sessionId, q.groupId());
        } else if (q.type() != null) {
            rows = eventRepo.findBySessionIdAndEventTypeOrderByIdAsc(sessionId, q.type());
        } else {
            rows = eventRepo.findBySessionIdOrderByIdAsc(sessionId);
        }

        Stream<Event> filtered = rows.stream();
        if (q.since() != null) {
            filtered = filtered.filter(e -> !e.getCreatedAt().isBefore(q.since()));
        }
        List<Event> result = filtered.toList();
        if (q.limit() != null && result.size() > q.limit()) {
            result = result.subList(result.size() - q.limit(), result.size());
        }
        return result;
    }

    /** Latest event of one type for one group, if any. */
    @Transactional(readOnly = true)
    public Optional<Event> latestEvent(String sessionId, String groupId, EventType type) {
        List<Event> events = findEvents(sessionId, new EventQuery(groupId, type, null, 1));
        return events.isEmpty() ? Optional.empty() : Optional.of(events.get(0));
    }

    @Transactional(readOnly = true)
    public Optional<Event> findByDedupKey(String dedupKey) {
        Identifiers.dedupKey(dedupKey);
        return eventRepo.findByDedupKey(dedupKey);
    }

    // ------------------------------------------------------------------
    // State snapshots
    // ------------------------------------------------------------------

    /**
     * Replace the snapshot for (session, scope, type). The payload must be a
     * JSON document; it is stored as given and never merged with the old one.
     */
    public StateSnapshot upsertState(String sessionId, String scope, String stateType, String payloadJson) {
        Identifiers.sessionId(sessionId);
        Identifiers.scope(scope);
        Identifiers.stateType(stateType);
        if (payloadJson == null || payloadJson.isBlank()) {
            throw CoordinationException.validation("state payload cannot be empty");
        }
        try {
            objectMapper.readTree(payloadJson);
        } catch (JsonProcessingException e) {
            throw CoordinationException.validation("state payload is not valid JSON: " + e.getOriginalMessage());
        }

        return guard.inTransaction(sessionId, () -> {
            requireSession(sessionId);
            StateSnapshot snapshot = stateRepo.findBySessionIdAndScopeAndStateType(sessionId, scope, stateType)
                    .map(existing -> {
                        existing.replace(payloadJson);
                        return existing;
                    })
                    .orElseGet(() -> new StateSnapshot(sessionId, scope, stateType, payloadJson));
            return stateRepo.save(snapshot);
        });
    }

    /**
     * Latest snapshot, or empty when none was written. A read failure is
     * logged and also reported as empty.
     */
    public Optional<StateSnapshot> getState(String sessionId, String scope, String stateType) {
        Identifiers.sessionId(sessionId);
        Identifiers.scope(scope);
        Identifiers.stateType(stateType);
        try {
            return stateRepo.findBySessionIdAndScopeAndStateType(sessionId, scope, stateType);
        } catch (DataAccessException e) {
            log.warn("Reading state {}/{} of session {} failed, treating as absent: {}",
                    scope, stateType, sessionId, e.getMessage());
            return Optional.empty();
        }
    }
}
