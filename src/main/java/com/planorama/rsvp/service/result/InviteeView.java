package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.RsvpStatus;

/**
 * An invitation together with the response resolved for it (null status while pending).
 *
 * @author Planorama Team
 */
public class InviteeView {

    private final InvitationToken token;
    private final RsvpStatus rsvpStatus;
    private final int companions;

    public InviteeView(InvitationToken token, RsvpStatus rsvpStatus, int companions) {
        this.token = token;
        this.rsvpStatus = rsvpStatus;
        this.companions = companions;
    }

    public static InviteeView pending(InvitationToken token) {
        return new InviteeView(token, null, 0);
    }

    public boolean isPending() {
        return rsvpStatus == null;
    }

    public InvitationToken getToken() {
        return token;
    }

    public RsvpStatus getRsvpStatus() {
        return rsvpStatus;
    }

    public int getCompanions() {
        return companions;
    }
}
