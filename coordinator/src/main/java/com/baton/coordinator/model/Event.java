package com.baton.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;

/**
 * Immutable, append-only record of something that happened in a session.
 *
 * payload is the JSON form of the typed payload named by event_type.
 * dedup_key is unique: appending the same key twice stores one row.
 * The identity id gives a total order, which is what "latest" means for
 * events written in the same instant.
 *
 * DB table: events  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "events")
public class Event {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    // Null for session-level events (scope changes, completion, validator verdicts).
    @Column(name = "group_id", updatable = false)
    private String groupId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false)
    private EventType eventType;

    @Column(nullable = false, updatable = false, columnDefinition = "TEXT")
    private String payload;

    @Column(name = "dedup_key", nullable = false, updatable = false, unique = true)
    private String dedupKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected Event() {}   // required by JPA

    public Event(String sessionId, String groupId, EventType eventType,
                 String payload, String dedupKey) {
        this.sessionId = sessionId;
        this.groupId   = groupId;
        this.eventType = eventType;
        this.payload   = payload;
        this.dedupKey  = dedupKey;
    }

    public Long      getId()        { return id; }
    public String    getSessionId() { return sessionId; }
    public String    getGroupId()   { return groupId; }
    public EventType getEventType() { return eventType; }
    public String    getPayload()   { return payload; }
    public String    getDedupKey()  { return dedupKey; }
    public Instant   getCreatedAt() { return createdAt; }
}
