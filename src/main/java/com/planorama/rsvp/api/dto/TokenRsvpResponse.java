package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.RsvpStatus;
import com.planorama.rsvp.service.result.TokenRsvpResult;

/**
 * Response DTO for an admitted guest response.
 *
 * @author Planorama Team
 */
public class TokenRsvpResponse {

    private String id;
    private RsvpStatus status;
    private Integer companions;
    private int totalAttendees;
    private String message;

    public TokenRsvpResponse() {
    }

    public static TokenRsvpResponse fromResult(TokenRsvpResult result) {
        TokenRsvpResponse response = new TokenRsvpResponse();
        response.setId(result.getRsvp().getRsvpId());
        response.setStatus(result.getRsvp().getStatus());
        response.setCompanions(result.getRsvp().getCompanions());
        response.setTotalAttendees(result.getTotalAttendees());
        response.setMessage(result.getMessage());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public int getTotalAttendees() {
        return totalAttendees;
    }

    public void setTotalAttendees(int totalAttendees) {
        this.totalAttendees = totalAttendees;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
