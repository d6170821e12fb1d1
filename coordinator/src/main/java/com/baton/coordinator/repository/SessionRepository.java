package com.baton.coordinator.repository;

import com.baton.coordinator.model.Session;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * CRUD operations for the sessions table.
 *
 * Spring Data JPA generates the implementation at startup.
 */
public interface SessionRepository extends JpaRepository<Session, String> {
}
