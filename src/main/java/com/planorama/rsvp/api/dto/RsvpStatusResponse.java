package com.planorama.rsvp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.planorama.rsvp.domain.model.DietaryPreference;
import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;

import java.time.Instant;

/**
 * Response DTO telling a guest whether their invitation already has a response.
 *
 * @author Planorama Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RsvpStatusResponse {

    private boolean hasResponded;
    private ResponseDetail rsvp;

    public RsvpStatusResponse() {
    }

    public static RsvpStatusResponse notResponded() {
        return new RsvpStatusResponse();
    }

    public static RsvpStatusResponse fromEntity(Rsvp rsvp) {
        RsvpStatusResponse response = new RsvpStatusResponse();
        response.setHasResponded(true);
        response.setRsvp(ResponseDetail.fromEntity(rsvp));
        return response;
    }

    // Getters and setters
    public boolean isHasResponded() {
        return hasResponded;
    }

    public void setHasResponded(boolean hasResponded) {
        this.hasResponded = hasResponded;
    }

    public ResponseDetail getRsvp() {
        return rsvp;
    }

    public void setRsvp(ResponseDetail rsvp) {
        this.rsvp = rsvp;
    }

    /**
     * The recorded response as the guest submitted it.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseDetail {

        private RsvpStatus status;
        private Integer companions;
        private int totalAttendees;
        private Instant respondedAt;
        private DietaryPreference dietaryPreference;
        private DietaryPreference companionDietaryPreference;

        public static ResponseDetail fromEntity(Rsvp rsvp) {
            ResponseDetail detail = new ResponseDetail();
            detail.status = rsvp.getStatus();
            detail.companions = rsvp.getCompanions();
            detail.totalAttendees = rsvp.getTotalAttendees();
            detail.respondedAt = rsvp.getCreatedAt();
            detail.dietaryPreference = rsvp.getDietaryPreference();
            detail.companionDietaryPreference = rsvp.getCompanionDietaryPreference();
            return detail;
        }

        public RsvpStatus getStatus() {
            return status;
        }

        public Integer getCompanions() {
            return companions;
        }

        public int getTotalAttendees() {
            return totalAttendees;
        }

        public Instant getRespondedAt() {
            return respondedAt;
        }

        public DietaryPreference getDietaryPreference() {
            return dietaryPreference;
        }

        public DietaryPreference getCompanionDietaryPreference() {
            return companionDietaryPreference;
        }
    }
}
