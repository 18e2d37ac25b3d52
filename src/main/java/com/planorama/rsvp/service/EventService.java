package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.User;
import com.planorama.rsvp.exception.FieldValidationException;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.repository.EventRepository;
import com.planorama.rsvp.repository.RsvpRepository;
import com.planorama.rsvp.service.result.EventSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Service for organizer events.
 *
 * @author Planorama Team
 */
@Service
public class EventService {

    private static final Logger logger = LoggerFactory.getLogger(EventService.class);

    private final EventRepository eventRepository;
    private final RsvpRepository rsvpRepository;
    private final Clock clock;

    public EventService(EventRepository eventRepository, RsvpRepository rsvpRepository) {
        this(eventRepository, rsvpRepository, Clock.systemUTC());
    }

    EventService(EventRepository eventRepository, RsvpRepository rsvpRepository, Clock clock) {
        this.eventRepository = eventRepository;
        this.rsvpRepository = rsvpRepository;
        this.clock = clock;
    }

    /**
     * The organizer's events, newest first, each with its going head count.
     *
     * @param organizerId Organizer user ID
     * @return Events with attendee counts
     */
    @Transactional(readOnly = true)
    public List<EventSummary> listOrganizerEvents(String organizerId) {
        List<Event> events = eventRepository.findByCreatedByOrderByCreatedAtDesc(organizerId);
        if (events.isEmpty()) {
            return Collections.emptyList();
        }

        List<String> eventIds = events.stream().map(Event::getEventId).collect(Collectors.toList());
        Map<String, Long> counts = new HashMap<>();
        for (Object[] row : rsvpRepository.sumGoingAttendeesByEvent(eventIds)) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }

        return events.stream()
                .map(event -> new EventSummary(event, counts.getOrDefault(event.getEventId(), 0L)))
                .collect(Collectors.toList());
    }

    /**
     * Any event by ID, for guests opening a public event page.
     */
    @Transactional(readOnly = true)
    public Event getPublicEvent(String eventId) {
        return eventRepository.findById(eventId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    /**
     * An event owned by the organizer.
     *
     * @throws ResourceNotFoundException if the event does not exist or belongs to someone else
     */
    @Transactional(readOnly = true)
    public Event getOwnedEvent(String organizerId, String eventId) {
        return eventRepository.findByEventIdAndCreatedBy(eventId, organizerId)
                .orElseThrow(() -> new ResourceNotFoundException("Event", eventId));
    }

    /**
     * Create an event owned by the organizer.
     *
     * @param organizerId Organizer user ID
     * @param draft Event fields (ID, owner and timestamps are ignored)
     * @return Saved event
     * @throws FieldValidationException if the schedule is in the past
     */
    @Transactional
    public Event createEvent(String organizerId, Event draft) {
        requireFutureDate(draft.getScheduledAt(),
                "Cannot create an event for a past date. Please select a future date and time.");

        Event event = Event.builder()
                .createdBy(organizerId)
                .build();
        applyFields(event, draft);

        Event saved = eventRepository.save(event);
        logger.info("Event created: {} by organizer: {}, capacity: {}",
                saved.getEventId(), organizerId, saved.getCapacity());
        return saved;
    }

    /**
     * Replace the fields of an owned event. Ownership never changes.
     *
     * @throws ResourceNotFoundException if the event is not owned by the organizer
     * @throws FieldValidationException if the schedule is in the past
     */
    @Transactional
    public Event updateEvent(String organizerId, String eventId, Event changes) {
        requireFutureDate(changes.getScheduledAt(),
                "Cannot update event to a past date. Please select a future date and time.");

        Event event = getOwnedEvent(organizerId, eventId);
        applyFields(event, changes);

        Event saved = eventRepository.save(event);
        logger.info("Event updated: {} by organizer: {}", eventId, organizerId);
        return saved;
    }

    private void requireFutureDate(Instant scheduledAt, String message) {
        if (scheduledAt == null) {
            throw new FieldValidationException("date", "Date is required");
        }
        if (scheduledAt.isBefore(clock.instant())) {
            throw new FieldValidationException("date", message);
        }
    }

    private static void applyFields(Event event, Event source) {
        event.setTitle(source.getTitle());
        event.setDescription(source.getDescription() != null ? source.getDescription() : "");
        event.setScheduledAt(source.getScheduledAt());
        event.setLocation(source.getLocation());
        event.setCategory(source.getCategory());
        event.setCapacity(source.getCapacity());
        event.setAllowedCompanions(source.getAllowedCompanions() != null ? source.getAllowedCompanions() : 0);
        event.setHostName(source.getHostName());
        event.setHostMobile(source.getHostMobile());
        event.setHostEmail(User.normalizeEmail(source.getHostEmail()));
    }
}
