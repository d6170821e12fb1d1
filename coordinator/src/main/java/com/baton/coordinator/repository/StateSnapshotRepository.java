package com.baton.coordinator.repository;

import com.baton.coordinator.model.StateSnapshot;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * CRUD operations for the state_snapshots table.
 */
public interface StateSnapshotRepository extends JpaRepository<StateSnapshot, UUID> {

    Optional<StateSnapshot> findBySessionIdAndScopeAndStateType(String sessionId, String scope, String stateType);
}
