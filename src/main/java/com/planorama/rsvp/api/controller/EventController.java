package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.dto.EventRequest;
import com.planorama.rsvp.api.dto.EventResponse;
import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.security.SecurityUtils;
import com.planorama.rsvp.service.EventService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST controller for events.
 * Organizers manage their own events; guests read the public view.
 *
 * @author Planorama Team
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private static final Logger logger = LoggerFactory.getLogger(EventController.class);

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    /**
     * List the caller's events with their going head counts.
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<EventResponse>> listEvents() {
        String organizerId = SecurityUtils.requireCurrentUserId();

        List<EventResponse> events = eventService.listOrganizerEvents(organizerId).stream()
                .map(EventResponse::fromSummary)
                .collect(Collectors.toList());

        return ResponseEntity.ok(events);
    }

    /**
     * Event details for guests. Organizer-only fields are left out.
     *
     * @param eventId Event ID
     * @return Public view of the event
     */
    @GetMapping("/public/{eventId}")
    public ResponseEntity<EventResponse> getPublicEvent(@PathVariable String eventId) {
        logger.debug("Fetching public event: {}", eventId);
        return ResponseEntity.ok(EventResponse.publicView(eventService.getPublicEvent(eventId)));
    }

    @GetMapping("/{eventId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<EventResponse> getEvent(@PathVariable String eventId) {
        String organizerId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(EventResponse.fromEntity(eventService.getOwnedEvent(organizerId, eventId)));
    }

    /**
     * Create an event owned by the caller.
     *
     * @param request Event fields
     * @return Created event
     */
    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<EventResponse> createEvent(@Valid @RequestBody EventRequest request) {
        String organizerId = SecurityUtils.requireCurrentUserId();

        Event event = eventService.createEvent(organizerId, request.toEvent());
        return ResponseEntity.status(HttpStatus.CREATED).body(EventResponse.fromEntity(event));
    }

    /**
     * Replace the fields of one of the caller's events.
     *
     * @param eventId Event ID
     * @param request Event fields
     * @return Updated event
     */
    @PutMapping("/{eventId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<EventResponse> updateEvent(
            @PathVariable String eventId,
            @Valid @RequestBody EventRequest request
    ) {
        String organizerId = SecurityUtils.requireCurrentUserId();

        Event event = eventService.updateEvent(organizerId, eventId, request.toEvent());
        return ResponseEntity.ok(EventResponse.fromEntity(event));
    }
}
