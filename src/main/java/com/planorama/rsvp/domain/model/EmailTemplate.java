package com.planorama.rsvp.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Styling and copy for invitation emails.
 *
 * A template belongs to an organizer and optionally to one of their events. A template without an
 * event is the organizer-level template; whether it is the organizer's default is recorded on
 * {@link User#getDefaultEmailTemplateId()}, not here.
 *
 * @author Planorama Team
 */
@Entity
@Table(name = "email_templates",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_templates_organizer_event", columnNames = {"organizer_id", "event_id"})
    })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmailTemplate {

    @Id
    @Column(name = "template_id", nullable = false, length = 36)
    private String templateId;

    @Column(name = "organizer_id", nullable = false, updatable = false, length = 36)
    private String organizerId;

    @Column(name = "event_id", updatable = false, length = 36)
    private String eventId;

    @Column(name = "logo_url", length = 2048)
    private String logoUrl;

    @Column(name = "host_name", length = 100)
    private String hostName;

    @Column(name = "primary_color", nullable = false, length = 7)
    private String primaryColor;

    @Column(name = "secondary_color", nullable = false, length = 7)
    private String secondaryColor;

    @Column(name = "text_color", nullable = false, length = 7)
    private String textColor;

    @Column(name = "event_details_background_color", nullable = false, length = 7)
    private String eventDetailsBackgroundColor;

    @Column(name = "font_family", nullable = false, length = 200)
    private String fontFamily;

    @Column(name = "header_text", nullable = false, length = 200)
    private String headerText;

    @Column(name = "sample_event_title", length = 200)
    private String sampleEventTitle;

    @Column(name = "footer_text", nullable = false, length = 500)
    private String footerText;

    @Column(name = "button_text", nullable = false, length = 100)
    private String buttonText;

    @Column(name = "button_radius", nullable = false, length = 10)
    private String buttonRadius;

    @Column(name = "show_emojis", nullable = false)
    @Builder.Default
    private Boolean showEmojis = true;

    @Column(name = "description_text", length = 1000)
    private String descriptionText;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (templateId == null) {
            templateId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
