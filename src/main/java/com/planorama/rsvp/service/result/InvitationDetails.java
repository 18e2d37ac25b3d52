package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.InvitationToken;

/**
 * What a guest sees when opening an invitation link.
 *
 * @author Planorama Team
 */
public class InvitationDetails {

    private final InvitationToken token;
    private final Event event;

    public InvitationDetails(InvitationToken token, Event event) {
        this.token = token;
        this.event = event;
    }

    public InvitationToken getToken() {
        return token;
    }

    public Event getEvent() {
        return event;
    }
}
