package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.Event;

/**
 * An event with its current attendee count.
 *
 * @author Planorama Team
 */
public class EventSummary {

    private final Event event;
    private final long rsvpCount;

    public EventSummary(Event event, long rsvpCount) {
        this.event = event;
        this.rsvpCount = rsvpCount;
    }

    public Event getEvent() {
        return event;
    }

    public long getRsvpCount() {
        return rsvpCount;
    }
}
