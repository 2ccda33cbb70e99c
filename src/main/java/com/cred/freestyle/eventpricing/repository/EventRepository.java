package com.cred.freestyle.eventpricing.repository;

import com.cred.freestyle.eventpricing.domain.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Event entity.
 * Provides data access methods for events with support for pessimistic locking.
 *
 * @author Event Pricing Team
 */
@Repository
public interface EventRepository extends JpaRepository<Event, String> {

    /**
     * Find event by ID with pessimistic write lock (SELECT ... FOR UPDATE).
     * The row stays locked until the surrounding transaction ends, which serializes
     * bookings and cancellations against the same event across application nodes.
     *
     * @param eventId Event ID
     * @return Optional containing the locked event if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Event e WHERE e.eventId = :eventId")
    Optional<Event> findByIdForUpdate(@Param("eventId") String eventId);

    /**
     * Find active events that have not started yet, soonest first.
     *
     * @param now Current time
     * @return Upcoming active events
     */
    @Query("SELECT e FROM Event e WHERE e.isActive = true AND e.eventDate > :now ORDER BY e.eventDate ASC")
    List<Event> findUpcomingActiveEvents(@Param("now") Instant now);

    /**
     * IDs of active events that have not started yet.
     * Used by the price refresh job, which locks each event separately.
     *
     * @param now Current time
     * @return Event IDs
     */
    @Query("SELECT e.eventId FROM Event e WHERE e.isActive = true AND e.eventDate > :now ORDER BY e.eventDate ASC")
    List<String> findUpcomingActiveEventIds(@Param("now") Instant now);
}
