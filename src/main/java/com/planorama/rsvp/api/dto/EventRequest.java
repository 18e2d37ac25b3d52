package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.Event;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.Instant;

/**
 * Request DTO for creating or updating an event.
 *
 * @author Planorama Team
 */
public class EventRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 200, message = "Title too long")
    private String title;

    @Size(max = 2000, message = "Description too long")
    private String description;

    @NotNull(message = "Date is required")
    private Instant date;

    @NotBlank(message = "Location is required")
    @Size(max = 200, message = "Location too long")
    private String location;

    @NotBlank(message = "Category is required")
    @Size(max = 100, message = "Category too long")
    private String category;

    @NotNull(message = "Capacity is required")
    @Min(value = 1, message = "Capacity must be at least 1")
    private Integer capacity;

    @Min(value = 0, message = "Allowed companions cannot be negative")
    @Max(value = 10, message = "Allowed companions cannot exceed 10")
    private Integer allowedCompanions;

    @NotBlank(message = "Host name is required")
    @Size(max = 100, message = "Host name too long")
    private String hostName;

    @NotBlank(message = "Host mobile number is required")
    @Size(max = 20, message = "Host mobile number too long")
    private String hostMobile;

    @NotBlank(message = "Host email is required")
    @Email(message = "Invalid email format")
    @Size(max = 100, message = "Host email too long")
    private String hostEmail;

    public EventRequest() {
    }

    /**
     * Unsaved event carrying the submitted fields.
     */
    public Event toEvent() {
        return Event.builder()
                .title(title)
                .description(description)
                .scheduledAt(date)
                .location(location)
                .category(category)
                .capacity(capacity)
                .allowedCompanions(allowedCompanions)
                .hostName(hostName)
                .hostMobile(hostMobile)
                .hostEmail(hostEmail)
                .build();
    }

    // Getters and setters
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
}
