package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.InvitationToken;

/**
 * A newly issued invitation and whether its email reached the transport.
 *
 * @author Planorama Team
 */
public class InvitationResult {

    private final InvitationToken token;
    private final boolean emailSent;

    public InvitationResult(InvitationToken token, boolean emailSent) {
        this.token = token;
        this.emailSent = emailSent;
    }

    public InvitationToken getToken() {
        return token;
    }

    public boolean isEmailSent() {
        return emailSent;
    }
}
