package com.baton.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;

/**
 * One coordinated delivery run.
 *
 * Holds the originally agreed scope so the validator gate can detect silent
 * scope reduction. The session id is chosen by the caller (one id per project
 * run) and validated before it reaches this table.
 *
 * DB table: sessions  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sessions")
public class Session {

    @Id
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SessionStatus status = SessionStatus.ACTIVE;

    @Enumerated(EnumType.STRING)
    @Column(name = "execution_mode", nullable = false)
    private ExecutionMode executionMode = ExecutionMode.SINGLE_TRACK;

    @Enumerated(EnumType.STRING)
    @Column(name = "testing_mode", nullable = false)
    private TestingMode testingMode = TestingMode.FULL;

    // JSON array of {id, description}.
    @Convert(converter = ScopeItemListConverter.class)
    @Column(name = "original_scope", nullable = false, columnDefinition = "TEXT")
    private List<ScopeItem> originalScope = List.of();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    // Set only when the validator gate accepts the session.
    @Column(name = "closed_at")
    private Instant closedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Session() {}   // required by JPA

    public Session(String id, List<ScopeItem> originalScope,
                   ExecutionMode executionMode, TestingMode testingMode) {
        this.id            = id;
        this.originalScope = List.copyOf(originalScope);
        this.executionMode = executionMode;
        this.testingMode   = testingMode;
    }

    // ------------------------------------------------------------------
    // Getters / lifecycle
    // ------------------------------------------------------------------

    public String          getId()            { return id; }
    public SessionStatus   getStatus()        { return status; }
    public ExecutionMode   getExecutionMode() { return executionMode; }
    public TestingMode     getTestingMode()   { return testingMode; }
    public List<ScopeItem> getOriginalScope() { return originalScope; }
    public Instant         getCreatedAt()     { return createdAt; }
    public Instant         getClosedAt()      { return closedAt; }

    public boolean isClosed() {
        return status == SessionStatus.COMPLETED;
    }

    public void close() {
        this.status   = SessionStatus.COMPLETED;
        this.closedAt = Instant.now();
    }
}
