package com.baton.coordinator.repository;

import com.baton.coordinator.model.Event;
import com.baton.coordinator.model.EventType;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

/**
 * Append and query operations for the events table.
 *
 * There is deliberately no update path: events are written once through
 * {@link #save} and only read afterwards. Every list comes back in append
 * order (ascending id), so the last element is the latest event.
 */
public interface EventRepository extends JpaRepository<Event, Long> {

    Optional<Event> findByDedupKey(String dedupKey);

    List<Event> findBySessionIdOrderByIdAsc(String sessionId);

    List<Event> findBySessionIdAndEventTypeOrderByIdAsc(String sessionId, EventType eventType);

    List<Event> findBySessionIdAndGroupIdOrderByIdAsc(String sessionId, String groupId);

    List<Event> findBySessionIdAndGroupIdAndEventTypeOrderByIdAsc(String sessionId, String groupId,
                                                                  EventType eventType);
}
