package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.DietaryPreference;
import com.planorama.rsvp.domain.model.RsvpStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for a guest response through an invitation link.
 * Companions above the per-guest maximum are clamped, not rejected.
 *
 * @author Planorama Team
 */
public class TokenRsvpRequest {

    @NotNull(message = "Status is required")
    private RsvpStatus status;

    private Integer companions;

    @Size(max = 200, message = "Name too long")
    private String guestName;

    private DietaryPreference dietaryPreference;
    private DietaryPreference companionDietaryPreference;

    public TokenRsvpRequest() {
    }

    public TokenRsvpRequest(RsvpStatus status, Integer companions) {
        this.status = status;
        this.companions = companions;
    }

    // Getters and setters
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

    public DietaryPreference getDietaryPreference() {
        return dietaryPreference;
    }

    public void setDietaryPreference(DietaryPreference dietaryPreference) {
        this.dietaryPreference = dietaryPreference;
    }

    public DietaryPreference getCompanionDietaryPreference() {
        return companionDietaryPreference;
    }

    public void setCompanionDietaryPreference(DietaryPreference companionDietaryPreference) {
        this.companionDietaryPreference = companionDietaryPreference;
    }
}
