package com.planorama.rsvp.repository;

import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Rsvp entity.
 *
 * @author Planorama Team
 */
@Repository
public interface RsvpRepository extends JpaRepository<Rsvp, String> {

    Optional<Rsvp> findByEventIdAndUserId(String eventId, String userId);

    Optional<Rsvp> findByEventIdAndTokenId(String eventId, String tokenId);

    List<Rsvp> findByEventIdOrderByCreatedAtDesc(String eventId);

    List<Rsvp> findByEventIdAndStatus(String eventId, RsvpStatus status);

    /**
     * Token-path RSVPs of an event for a batch of tokens.
     */
    List<Rsvp> findByEventIdAndTokenIdIn(String eventId, Collection<String> tokenIds);

    /**
     * User-path RSVPs of an event for a batch of accounts.
     */
    List<Rsvp> findByEventIdAndUserIdIn(String eventId, Collection<String> userIds);

    /**
     * Seats currently taken at an event: sum of (1 + companions) over GOING responses.
     *
     * @param eventId Event ID
     * @return Attendee count, 0 when nobody is going
     */
    @Query("SELECT COALESCE(SUM(1 + r.companions), 0L) FROM Rsvp r " +
           "WHERE r.eventId = :eventId AND r.status = com.planorama.rsvp.domain.model.RsvpStatus.GOING")
    long sumGoingAttendees(@Param("eventId") String eventId);

    /**
     * Seats taken per event for a batch of events (events with no GOING response are absent).
     *
     * @param eventIds Event IDs
     * @return Rows of [eventId (String), attendees (Long)]
     */
    @Query("SELECT r.eventId, SUM(1 + r.companions) FROM Rsvp r " +
           "WHERE r.eventId IN :eventIds AND r.status = com.planorama.rsvp.domain.model.RsvpStatus.GOING " +
           "GROUP BY r.eventId")
    List<Object[]> sumGoingAttendeesByEvent(@Param("eventIds") Collection<String> eventIds);
}
