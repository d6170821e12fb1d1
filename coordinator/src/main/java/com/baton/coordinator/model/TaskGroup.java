package com.baton.coordinator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * A unit of work tracked through the group status state machine.
 *
 * Created by the manager while planning, mutated by every later role turn,
 * never deleted. The review counters drive the progress tracker:
 *   review_iteration      - completed review passes, never decreases
 *   blocking_issues_count - unresolved blocking issues after the latest pass
 *   no_progress_count     - consecutive passes where that count did not drop
 *
 * DB table: task_groups  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "task_groups",
       uniqueConstraints = @UniqueConstraint(columnNames = {"session_id", "group_id"}))
public class TaskGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "session_id", nullable = false, updatable = false)
    private String sessionId;

    @Column(name = "group_id", nullable = false, updatable = false)
    private String groupId;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GroupStatus status = GroupStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(name = "assigned_role")
    private Role assignedRole = Role.IMPLEMENTER;

    @Column(name = "review_iteration", nullable = false)
    private int reviewIteration = 0;

    @Column(name = "no_progress_count", nullable = false)
    private int noProgressCount = 0;

    @Column(name = "blocking_issues_count", nullable = false)
    private int blockingIssuesCount = 0;

    @Column(nullable = false)
    private int complexity = 1;

    // Ids of the session scope items this group delivers.
    @Convert(converter = StringListConverter.class)
    @Column(name = "scope_items", nullable = false, columnDefinition = "TEXT")
    private List<String> scopeItemIds = List.of();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TaskGroup() {}   // required by JPA

    public TaskGroup(String sessionId, String groupId, String name) {
        this.sessionId = sessionId;
        this.groupId   = groupId;
        this.name      = name;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()                  { return id; }
    public String       getSessionId()           { return sessionId; }
    public String       getGroupId()             { return groupId; }
    public String       getName()                { return name; }
    public GroupStatus  getStatus()              { return status; }
    public Role         getAssignedRole()        { return assignedRole; }
    public int          getReviewIteration()     { return reviewIteration; }
    public int          getNoProgressCount()     { return noProgressCount; }
    public int          getBlockingIssuesCount() { return blockingIssuesCount; }
    public int          getComplexity()          { return complexity; }
    public List<String> getScopeItemIds()        { return scopeItemIds; }
    public Instant      getCreatedAt()           { return createdAt; }
    public Instant      getUpdatedAt()           { return updatedAt; }

    public void setName(String name)                   { this.name = name; }
    public void setStatus(GroupStatus status)          { this.status = status; }
    public void setAssignedRole(Role assignedRole)     { this.assignedRole = assignedRole; }
    public void setNoProgressCount(int v)              { this.noProgressCount = v; }
    public void setBlockingIssuesCount(int v)          { this.blockingIssuesCount = v; }
    public void setComplexity(int complexity)          { this.complexity = complexity; }
    public void setScopeItemIds(List<String> ids)      { this.scopeItemIds = List.copyOf(ids); }

    /**
     * Move the review iteration forward.
     *
     * @throws IllegalArgumentException if {@code iteration} is lower than the stored value
     */
    public void setReviewIteration(int iteration) {
        if (iteration < reviewIteration) {
            throw new IllegalArgumentException("review_iteration cannot decrease (%d -> %d)"
                    .formatted(reviewIteration, iteration));
        }
        this.reviewIteration = iteration;
    }

    /** Security and auth work always goes through the quality checker. */
    public boolean isSecuritySensitive() {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);
        return lower.contains("security") || lower.contains("auth");
    }
}
