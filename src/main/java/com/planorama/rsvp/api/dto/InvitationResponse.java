package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.service.result.InvitationResult;

/**
 * Response DTO for a newly issued invitation.
 *
 * @author Planorama Team
 */
public class InvitationResponse {

    private InviteeResponse token;
    private boolean emailSent;

    public InvitationResponse() {
    }

    public static InvitationResponse fromResult(InvitationResult result) {
        InvitationResponse response = new InvitationResponse();
        response.setToken(InviteeResponse.fromToken(result.getToken()));
        response.setEmailSent(result.isEmailSent());
        return response;
    }

    // Getters and setters
    public InviteeResponse getToken() {
        return token;
    }

    public void setToken(InviteeResponse token) {
        this.token = token;
    }

    public boolean isEmailSent() {
        return emailSent;
    }

    public void setEmailSent(boolean emailSent) {
        this.emailSent = emailSent;
    }
}
