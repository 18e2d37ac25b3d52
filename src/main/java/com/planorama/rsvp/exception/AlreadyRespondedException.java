package com.planorama.rsvp.exception;

import com.planorama.rsvp.domain.model.Rsvp;

/**
 * Exception thrown when a guest submits a second response through the same invitation token.
 * Carries the response already on record, unchanged.
 *
 * @author Planorama Team
 */
public class AlreadyRespondedException extends RuntimeException {

    private final Rsvp existingRsvp;

    public AlreadyRespondedException(Rsvp existingRsvp) {
        super("You have already responded to this invitation");
        this.existingRsvp = existingRsvp;
    }

    public Rsvp getExistingRsvp() {
        return existingRsvp;
    }
}
