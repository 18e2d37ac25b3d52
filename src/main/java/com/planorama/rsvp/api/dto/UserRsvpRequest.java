package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.RsvpStatus;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO for an organizer's own response.
 *
 * @author Planorama Team
 */
public class UserRsvpRequest {

    @NotNull(message = "Status is required")
    private RsvpStatus status;

    public UserRsvpRequest() {
    }

    public UserRsvpRequest(RsvpStatus status) {
        this.status = status;
    }

    // Getters and setters
    public RsvpStatus getStatus() {
        return status;
    }

    public void setStatus(RsvpStatus status) {
        this.status = status;
    }
}
