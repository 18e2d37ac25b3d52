package com.planorama.rsvp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;

import java.time.Instant;

/**
 * Response DTO for a stored RSVP. Exactly one of userId and tokenId is present.
 *
 * @author Planorama Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RsvpResponse {

    private String id;
    private String eventId;
    private String userId;
    private String tokenId;
    private RsvpStatus status;
    private Integer companions;
    private String guestName;
    private String guestEmail;
    private Instant createdAt;

    public RsvpResponse() {
    }

    public static RsvpResponse fromEntity(Rsvp rsvp) {
        RsvpResponse response = new RsvpResponse();
        response.setId(rsvp.getRsvpId());
        response.setEventId(rsvp.getEventId());
        response.setUserId(rsvp.getUserId());
        response.setTokenId(rsvp.getTokenId());
        response.setStatus(rsvp.getStatus());
        response.setCompanions(rsvp.getCompanions());
        response.setGuestName(rsvp.getGuestName());
        response.setGuestEmail(rsvp.getGuestEmail());
        response.setCreatedAt(rsvp.getCreatedAt());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTokenId() {
        return tokenId;
    }

    public void setTokenId(String tokenId) {
        this.tokenId = tokenId;
    }

    public RsvpStatus getStatus() {
        return status;
    }

    public void setStatus(RsvpStatus status) {
        this.status = status;
    }

    public Integer getCompanions() {
        return companions;
    }

    public void setCompanions(Integer companions) {
        this.companions = companions;
    }

    public String getGuestName() {
        return guestName;
    }

    public void setGuestName(String guestName) {
        this.guestName = guestName;
    }

    public String getGuestEmail() {
        return guestEmail;
    }

    public void setGuestEmail(String guestEmail) {
        this.guestEmail = guestEmail;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
