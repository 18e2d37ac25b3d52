package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.DietaryPreference;
import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;
import com.planorama.rsvp.exception.AlreadyRespondedException;
import com.planorama.rsvp.exception.CapacityExceededException;
import com.planorama.rsvp.exception.FieldValidationException;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.infrastructure.messaging.RsvpEventPublisher;
import com.planorama.rsvp.infrastructure.messaging.events.RsvpDomainEvent;
import com.planorama.rsvp.infrastructure.metrics.CloudWatchMetricsService;
import com.planorama.rsvp.repository.EventRepository;
import com.planorama.rsvp.repository.InvitationTokenRepository;
import com.planorama.rsvp.repository.RsvpRepository;
import com.planorama.rsvp.service.result.DietaryStatistics;
import com.planorama.rsvp.service.result.TokenRsvpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * RSVP admission engine.
 *
 * Two identities can respond to an event:
 * - Organizer accounts (user path): one response per (event, user), replaced on every submission,
 *   no capacity check.
 * - Invitation tokens (token path): one response per (event, token), created once, counted
 *   against capacity when going.
 *
 * Concurrency:
 * - Every admission takes a pessimistic write lock on the event row first
 *   ({@link EventRepository#findByIdForUpdate(String)}), so the read-sum-check-insert sequence for one
 *   event runs serially across all instances while different events proceed in parallel.
 * - The unique constraints on (event, user) and (event, token) back this up at the database.
 *
 * @author Planorama Team
 */
@Service
public class RsvpService {

    private static final Logger logger = LoggerFactory.getLogger(RsvpService.class);

    private static final String PATH_TOKEN = "token";
    private static final String PATH_USER = "user";

    private final EventRepository eventRepository;
    private final RsvpRepository rsvpRepository;
    private final InvitationTokenRepository tokenRepository;
    private final RsvpEventPublisher eventPublisher;
    private final CloudWatchMetricsService metricsService;

    public RsvpService(
            EventRepository eventRepository,
            RsvpRepository rsvpRepository,
            InvitationTokenRepository tokenRepository,
            RsvpEventPublisher eventPublisher,
            CloudWatchMetricsService metricsService
    ) {
        this.eventRepository = eventRepository;
        this.rsvpRepository = rsvpRepository;
        this.tokenRepository = tokenRepository;
        this.eventPublisher = eventPublisher;
        this.metricsService = metricsService;
    }

    /**
     * Record an organizer's own response to one of their events, replacing any earlier one.
     *
     * @param userId Organizer user ID
     * @param eventId Event ID
     * @param status New status (going, maybe or not-going)
     * @return Saved RSVP
     * @throws ResourceNotFoundException if the event does not exist or is not owned by the user
     */
    @Transactional
    public Rsvp submitUserRsvp(String userId, String eventId, RsvpStatus status) {
        if (status == null) {
            throw new FieldValidationException("status", "Status is required");
        }

        // Event row lock serializes upserts by the same user
        eventRepository.findByIdForUpdate(eventId)
                .filter(event -> event.isOwnedBy(userId))
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        Rsvp rsvp = rsvpRepository.findByEventIdAndUserId(eventId, userId)
                .orElseGet(() -> Rsvp.forUser(eventId, userId, status));
        rsvp.setStatus(status);

        Rsvp saved = rsvpRepository.save(rsvp);

        logger.info("User RSVP recorded - event: {}, user: {}, status: {}", eventId, userId, status.getValue());
        metricsService.recordRsvpAdmitted(PATH_USER, status.getValue());
        eventPublisher.publish(RsvpDomainEvent.userRsvpUpserted(saved));

        return saved;
    }

    /**
     * The organizer's own response to one of their events.
     *
     * @param userId Organizer user ID
     * @param eventId Event ID
     * @return Optional containing the RSVP if the organizer responded
     */
    @Transactional(readOnly = true)
    public Optional<Rsvp> getUserRsvp(String userId, String eventId) {
        requireOwnedEvent(userId, eventId);
        return rsvpRepository.findByEventIdAndUserId(eventId, userId);
    }

    /**
     * All responses to an owned event, newest first.
     */
    @Transactional(readOnly = true)
    public List<Rsvp> listEventRsvps(String userId, String eventId) {
        requireOwnedEvent(userId, eventId);
        return rsvpRepository.findByEventIdOrderByCreatedAtDesc(eventId);
    }

    /**
     * Admit a guest response through an invitation token.
     *
     * Steps, all inside one transaction holding the event row lock:
     * 1. Reject a second response for the token (existing response returned unchanged)
     * 2. When going, check 1 + companions against the seats left
     * 3. Insert the response bound to the token, never to an account
     * 4. Write a supplied guest name back onto the token
     *
     * @param token Invitation secret
     * @param status going or not-going ("maybe" is not offered to guests)
     * @param companions Requested companions, clamped to [0, {@value Rsvp#MAX_TOKEN_COMPANIONS}]
     * @param guestName Optional name overriding the one on the invitation
     * @param dietaryPreference Optional guest preference
     * @param companionDietaryPreference Optional preference shared by the companions
     * @return Admitted response with its seat count and confirmation message
     * @throws ResourceNotFoundException if the token or its event does not exist
     * @throws FieldValidationException if the status is missing or "maybe"
     * @throws AlreadyRespondedException if the token already has a response
     * @throws CapacityExceededException if the response does not fit
     */
    @Transactional
    public TokenRsvpResult submitTokenRsvp(
            String token,
            RsvpStatus status,
            Integer companions,
            String guestName,
            DietaryPreference dietaryPreference,
            DietaryPreference companionDietaryPreference
    ) {
        long startTime = System.currentTimeMillis();

        if (status == null) {
            throw new FieldValidationException("status", "Status is required");
        }
        if (status == RsvpStatus.MAYBE) {
            metricsService.recordRsvpRejected("INVALID_STATUS");
            throw new FieldValidationException("status", "Status must be 'going' or 'not-going'");
        }

        InvitationToken invitation = tokenRepository.findByToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation", token));

        String eventId = invitation.getEventId();
        Event event = eventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));

        Optional<Rsvp> existing = rsvpRepository.findByEventIdAndTokenId(eventId, invitation.getTokenId());
        if (existing.isPresent()) {
            logger.warn("Duplicate token RSVP rejected - event: {}, token: {}", eventId, invitation.getTokenId());
            metricsService.recordRsvpRejected("ALREADY_RESPONDED");
            throw new AlreadyRespondedException(existing.get());
        }

        int admittedCompanions = Rsvp.clampCompanions(companions);

        if (status == RsvpStatus.GOING) {
            long currentAttendees = rsvpRepository.sumGoingAttendees(eventId);
            int requestedSpots = 1 + admittedCompanions;

            if (currentAttendees + requestedSpots > event.getCapacity()) {
                int remainingSpots = (int) Math.max(0, event.getCapacity() - currentAttendees);
                logger.warn("Capacity exceeded - event: {}, capacity: {}, current: {}, requested: {}",
                        eventId, event.getCapacity(), currentAttendees, requestedSpots);
                metricsService.recordRsvpRejected("CAPACITY_EXCEEDED");
                throw new CapacityExceededException(eventId, requestedSpots, remainingSpots);
            }
        }

        String trimmedName = guestName != null ? guestName.trim() : "";

        Rsvp rsvp = Rsvp.forToken(invitation, status, admittedCompanions);
        if (!trimmedName.isEmpty()) {
            rsvp.setGuestName(trimmedName);
        }
        rsvp.setDietaryPreference(dietaryPreference);
        rsvp.setCompanionDietaryPreference(companionDietaryPreference);

        Rsvp saved;
        try {
            saved = rsvpRepository.saveAndFlush(rsvp);
        } catch (DataIntegrityViolationException e) {
            // Unique (event, token) constraint; the transaction is rolled back with this exception
            logger.warn("Token RSVP insert hit unique constraint - event: {}, token: {}",
                    eventId, invitation.getTokenId());
            metricsService.recordRsvpRejected("ALREADY_RESPONDED");
            throw new AlreadyRespondedException(null);
        }

        if (!trimmedName.isEmpty()) {
            tokenRepository.updateName(invitation.getTokenId(), trimmedName);
        }

        TokenRsvpResult result = new TokenRsvpResult(saved);

        logger.info("Token RSVP admitted - event: {}, rsvp: {}, status: {}, attendees: {}",
                eventId, saved.getRsvpId(), status.getValue(), result.getTotalAttendees());
        metricsService.recordRsvpAdmitted(PATH_TOKEN, status.getValue());
        metricsService.recordAdmissionLatency(System.currentTimeMillis() - startTime);
        eventPublisher.publish(RsvpDomainEvent.tokenRsvpCreated(saved));

        return result;
    }

    /**
     * The response recorded for an invitation token, if any.
     *
     * @param token Invitation secret
     * @return Optional containing the response
     * @throws ResourceNotFoundException if the token does not exist
     */
    @Transactional(readOnly = true)
    public Optional<Rsvp> getTokenRsvpStatus(String token) {
        InvitationToken invitation = tokenRepository.findByToken(token)
                .orElseThrow(() -> new ResourceNotFoundException("Invitation", token));
        return rsvpRepository.findByEventIdAndTokenId(invitation.getEventId(), invitation.getTokenId());
    }

    /**
     * Dietary head counts over going responses of an owned event.
     * Each response counts its guest once and, when it brings companions, the companion preference once.
     *
     * @param userId Organizer user ID
     * @param eventId Event ID
     * @return Bucket counts
     */
    @Transactional(readOnly = true)
    public DietaryStatistics computeDietaryStatistics(String userId, String eventId) {
        requireOwnedEvent(userId, eventId);

        DietaryStatistics statistics = new DietaryStatistics();
        for (Rsvp rsvp : rsvpRepository.findByEventIdAndStatus(eventId, RsvpStatus.GOING)) {
            statistics.count(rsvp.getDietaryPreference());
            if (rsvp.getCompanions() != null && rsvp.getCompanions() > 0) {
                statistics.count(rsvp.getCompanionDietaryPreference());
            }
        }

        logger.debug("Dietary statistics for event {}: {} head counts", eventId, statistics.getTotal());
        return statistics;
    }

    private Event requireOwnedEvent(String userId, String eventId) {
        return eventRepository.findByEventIdAndCreatedBy(eventId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }
}
