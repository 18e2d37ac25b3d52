package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.RsvpStatus;
import com.planorama.rsvp.service.result.InviteeView;

import java.time.Instant;

/**
 * Response DTO for one invitation with its resolved response.
 * rsvpStatus is null while the invitee has not responded.
 *
 * @author Planorama Team
 */
public class InviteeResponse {

    private String id;
    private String email;
    private String name;
    private String token;
    private Instant createdAt;
    private RsvpStatus rsvpStatus;
    private int companions;

    public InviteeResponse() {
    }

    public static InviteeResponse fromView(InviteeView view) {
        InviteeResponse response = fromToken(view.getToken());
        response.setRsvpStatus(view.getRsvpStatus());
        response.setCompanions(view.getCompanions());
        return response;
    }

    /**
     * A freshly issued invitation, which cannot have a response yet.
     */
    public static InviteeResponse fromToken(InvitationToken token) {
        InviteeResponse response = new InviteeResponse();
        response.setId(token.getTokenId());
        response.setEmail(token.getEmail());
        response.setName(token.getName());
        response.setToken(token.getToken());
        response.setCreatedAt(token.getCreatedAt());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public RsvpStatus getRsvpStatus() {
        return rsvpStatus;
    }

    public void setRsvpStatus(RsvpStatus rsvpStatus) {
        this.rsvpStatus = rsvpStatus;
    }

    public int getCompanions() {
        return companions;
    }

    public void setCompanions(int companions) {
        this.companions = companions;
    }
}
