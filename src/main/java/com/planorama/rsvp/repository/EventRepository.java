package com.planorama.rsvp.repository;

import com.planorama.rsvp.domain.model.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Event entity.
 *
 * @author Planorama Team
 */
@Repository
public interface EventRepository extends JpaRepository<Event, String> {

    /**
     * Find an event only if it belongs to the given organizer.
     *
     * @param eventId Event ID
     * @param createdBy Organizer user ID
     * @return Optional containing the event if found and owned
     */
    Optional<Event> findByEventIdAndCreatedBy(String eventId, String createdBy);

    /**
     * Find all events of an organizer, newest first.
     *
     * @param createdBy Organizer user ID
     * @return List of events
     */
    List<Event> findByCreatedByOrderByCreatedAtDesc(String createdBy);

    /**
     * Find event by ID with pessimistic write lock (SELECT ... FOR UPDATE).
     * Every RSVP admission for the event takes this lock first, which serializes the
     * read-sum-check-insert sequence across all application instances.
     * Must be called inside a transaction.
     *
     * @param eventId Event ID
     * @return Optional containing the locked event if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Event e WHERE e.eventId = :eventId")
    Optional<Event> findByIdForUpdate(@Param("eventId") String eventId);
}
