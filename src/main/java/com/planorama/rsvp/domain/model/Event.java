package com.planorama.rsvp.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Check;

import java.time.Instant;
import java.util.UUID;

/**
 * Event entity. Capacity is the maximum number of admitted attendees, primary guests plus companions.
 *
 * The row doubles as the per-event serialization point for token admissions:
 * see {@link com.planorama.rsvp.repository.EventRepository#findByIdForUpdate(String)}.
 *
 * @author Planorama Team
 */
@Entity
@Table(name = "events", indexes = {
    @Index(name = "idx_events_created_by", columnList = "created_by, created_at")
})
@Check(constraints = "capacity >= 1")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Event {

    @Id
    @Column(name = "event_id", nullable = false, length = 36)
    private String eventId;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "description", length = 2000)
    @Builder.Default
    private String description = "";

    @Column(name = "scheduled_at", nullable = false)
    private Instant scheduledAt;

    @Column(name = "location", nullable = false, length = 200)
    private String location;

    @Column(name = "category", nullable = false, length = 100)
    private String category;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;

    /**
     * Informational companion allowance shown to guests. Admission enforces its own hard cap.
     */
    @Column(name = "allowed_companions", nullable = false)
    @Builder.Default
    private Integer allowedCompanions = 0;

    @Column(name = "host_name", nullable = false, length = 100)
    private String hostName;

    @Column(name = "host_mobile", nullable = false, length = 20)
    private String hostMobile;

    @Column(name = "host_email", nullable = false, length = 100)
    private String hostEmail;

    /**
     * Owning organizer. Never changes after creation.
     */
    @Column(name = "created_by", nullable = false, updatable = false, length = 36)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (eventId == null) {
            eventId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isOwnedBy(String organizerId) {
        return createdBy != null && createdBy.equals(organizerId);
    }
}
