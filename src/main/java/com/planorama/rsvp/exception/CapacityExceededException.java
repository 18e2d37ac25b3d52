package com.planorama.rsvp.exception;

/**
 * Exception thrown when admitting a response would push an event past its capacity.
 *
 * @author Planorama Team
 */
public class CapacityExceededException extends RuntimeException {

    private final String eventId;
    private final int requestedSpots;
    private final int remainingSpots;

    public CapacityExceededException(String eventId, int requestedSpots, int remainingSpots) {
        super(String.format("Event is full. Only %d %s remaining.",
                remainingSpots, remainingSpots == 1 ? "spot" : "spots"));
        this.eventId = eventId;
        this.requestedSpots = requestedSpots;
        this.remainingSpots = remainingSpots;
    }

    public String getEventId() {
        return eventId;
    }

    public int getRequestedSpots() {
        return requestedSpots;
    }

    public int getRemainingSpots() {
        return remainingSpots;
    }
}
