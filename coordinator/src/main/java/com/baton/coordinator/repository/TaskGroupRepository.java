package com.baton.coordinator.repository;

import com.baton.coordinator.model.GroupStatus;
import com.baton.coordinator.model.TaskGroup;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * CRUD + lookup queries for the task_groups table.
 */
public interface TaskGroupRepository extends JpaRepository<TaskGroup, UUID> {

    Optional<TaskGroup> findBySessionIdAndGroupId(String sessionId, String groupId);

    /** All groups of a session, in creation order. */
    List<TaskGroup> findBySessionIdOrderByCreatedAtAsc(String sessionId);

    List<TaskGroup> findBySessionIdAndStatusOrderByCreatedAtAsc(String sessionId, GroupStatus status);
}
