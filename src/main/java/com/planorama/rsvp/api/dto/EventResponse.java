package com.planorama.rsvp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.service.result.EventSummary;

import java.time.Instant;

/**
 * Response DTO for events. Fields that do not apply to a view are omitted.
 *
 * @author Planorama Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EventResponse {

    private String id;
    private String title;
    private String description;
    private Instant date;
    private String location;
    private String category;
    private Integer capacity;
    private Integer allowedCompanions;
    private String hostName;
    private String hostMobile;
    private String hostEmail;
    private String createdBy;
    private Long rsvpCount;
    private Instant createdAt;

    public EventResponse() {
    }

    /**
     * Full view for the owning organizer.
     *
     * @param event Event entity
     * @return EventResponse
     */
    public static EventResponse fromEntity(Event event) {
        EventResponse response = publicView(event);
        response.setHostMobile(event.getHostMobile());
        response.setCreatedBy(event.getCreatedBy());
        response.setCreatedAt(event.getCreatedAt());
        return response;
    }

    public static EventResponse fromSummary(EventSummary summary) {
        EventResponse response = fromEntity(summary.getEvent());
        response.setRsvpCount(summary.getRsvpCount());
        return response;
    }

    /**
     * Guest-facing view: no host mobile number, no owner.
     *
     * @param event Event entity
     * @return EventResponse
     */
    public static EventResponse publicView(Event event) {
        EventResponse response = new EventResponse();
        response.setId(event.getEventId());
        response.setTitle(event.getTitle());
        response.setDescription(event.getDescription() != null ? event.getDescription() : "");
        response.setDate(event.getScheduledAt());
        response.setLocation(event.getLocation());
        response.setCategory(event.getCategory());
        response.setCapacity(event.getCapacity());
        response.setAllowedCompanions(event.getAllowedCompanions());
        response.setHostName(event.getHostName());
        response.setHostEmail(event.getHostEmail());
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Instant getDate() {
        return date;
    }

    public void setDate(Instant date) {
        this.date = date;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public Integer getCapacity() {
        return capacity;
    }

    public void setCapacity(Integer capacity) {
        this.capacity = capacity;
    }

    public Integer getAllowedCompanions() {
        return allowedCompanions;
    }

    public void setAllowedCompanions(Integer allowedCompanions) {
        this.allowedCompanions = allowedCompanions;
    }

    public String getHostName() {
        return hostName;
    }

    public void setHostName(String hostName) {
        this.hostName = hostName;
    }

    public String getHostMobile() {
        return hostMobile;
    }

    public void setHostMobile(String hostMobile) {
        this.hostMobile = hostMobile;
    }

    public String getHostEmail() {
        return hostEmail;
    }

    public void setHostEmail(String hostEmail) {
        this.hostEmail = hostEmail;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
    }

    public Long getRsvpCount() {
        return rsvpCount;
    }

    public void setRsvpCount(Long rsvpCount) {
        this.rsvpCount = rsvpCount;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
