package com.baton.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Latest-wins state blob for one (session, scope, state type).
 *
 * scope is a group id or {@link #GLOBAL_SCOPE}. Writes replace the payload
 * entirely; nothing is ever merged.
 *
 * DB table: state_snapshots  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "state_snapshots",
       uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "scope", "state_type"}))
public class StateSnapshot {

    public static final String GLOBAL_SCOPE = "global";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    @Column(nullable = false, updatable = false)
    private String scope;

    @Column(name = "state_type", nullable = false, updatable = false)
    private String stateType;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected StateSnapshot() {}   // required by JPA

    public StateSnapshot(String sessionId, String scope, String stateType, String payload) {
        this.sessionId = sessionId;
        this.scope     = scope;
        this.stateType = stateType;
        this.payload   = payload;
    }

    public UUID    getId()        { return id; }
    public String  getSessionId() { return sessionId; }
    public String  getScope()     { return scope; }
    public String  getStateType() { return stateType; }
    public String  getPayload()   { return payload; }
    public Instant getUpdatedAt() { return updatedAt; }

    /** Full replacement of the stored payload. */
    public void replace(String payload) {
        this.payload   = payload;
        this.updatedAt = Instant.now();
    }
}
