package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;

/**
 * Outcome of an admitted token response.
 *
 * @author Planorama Team
 */
public class TokenRsvpResult {

    private final Rsvp rsvp;
    private final int totalAttendees;
    private final String message;

    public TokenRsvpResult(Rsvp rsvp) {
        this.rsvp = rsvp;
        this.totalAttendees = rsvp.getTotalAttendees();
        this.message = confirmationMessage(rsvp);
    }

    static String confirmationMessage(Rsvp rsvp) {
        if (rsvp.getStatus() != RsvpStatus.GOING) {
            return "Thank you for your response.";
        }
        int companions = rsvp.getCompanions() != null ? rsvp.getCompanions() : 0;
        if (companions == 0) {
            return "RSVP confirmed! You have been registered.";
        }
        return String.format("RSVP confirmed! You and %d %s have been registered.",
                companions, companions == 1 ? "companion" : "companions");
    }

    public Rsvp getRsvp() {
        return rsvp;
    }

    public int getTotalAttendees() {
        return totalAttendees;
    }

    public String getMessage() {
        return message;
    }
}
