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
 * Attendance response to an event.
 *
 * Every RSVP is bound to exactly one identity:
 * - user path: {@code userId} set, {@code tokenId} null (organizer account, upserted)
 * - token path: {@code tokenId} set, {@code userId} null (anonymous guest, created once)
 *
 * Uniqueness per identity is carried by the two unique constraints below. PostgreSQL treats NULLs
 * as distinct, so each constraint only binds the rows where its identity column is set.
 *
 * @author Planorama Team
 */
@Entity
@Table(name = "rsvps",
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_rsvps_event_user", columnNames = {"event_id", "user_id"}),
        @UniqueConstraint(name = "uk_rsvps_event_token", columnNames = {"event_id", "token_id"})
    },
    indexes = {
        @Index(name = "idx_rsvps_event_status", columnList = "event_id, status")
    })
@Check(constraints = "(user_id IS NULL) <> (token_id IS NULL)")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Rsvp {

    /**
     * Hard cap on companions a guest may bring through a token response.
     */
    public static final int MAX_TOKEN_COMPANIONS = 5;

    @Id
    @Column(name = "rsvp_id", nullable = false, length = 36)
    private String rsvpId;

    @Column(name = "event_id", nullable = false, updatable = false, length = 36)
    private String eventId;

    @Column(name = "user_id", updatable = false, length = 36)
    private String userId;

    @Column(name = "token_id", updatable = false, length = 36)
    private String tokenId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private RsvpStatus status;

    @Column(name = "companions", nullable = false)
    @Builder.Default
    private Integer companions = 0;

    @Column(name = "guest_name", length = 200)
    private String guestName;

    @Column(name = "guest_email", length = 255)
    private String guestEmail;

    @Enumerated(EnumType.STRING)
    @Column(name = "dietary_preference", length = 20)
    private DietaryPreference dietaryPreference;

    @Enumerated(EnumType.STRING)
    @Column(name = "companion_dietary_preference", length = 20)
    private DietaryPreference companionDietaryPreference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    /**
     * New organizer response bound to an account.
     */
    public static Rsvp forUser(String eventId, String userId, RsvpStatus status) {
        return Rsvp.builder()
                .eventId(eventId)
                .userId(userId)
                .status(status)
                .companions(0)
                .build();
    }

    /**
     * New guest response bound to an invitation token, never to an account.
     */
    public static Rsvp forToken(InvitationToken token, RsvpStatus status, int companions) {
        return Rsvp.builder()
                .eventId(token.getEventId())
                .tokenId(token.getTokenId())
                .status(status)
                .companions(companions)
                .guestEmail(token.getEmail())
                .guestName(token.getName())
                .build();
    }

    /**
     * Clamp a requested companion count to [0, {@value #MAX_TOKEN_COMPANIONS}].
     */
    public static int clampCompanions(Integer requested) {
        if (requested == null || requested < 0) {
            return 0;
        }
        return Math.min(requested, MAX_TOKEN_COMPANIONS);
    }

    @PrePersist
    protected void onCreate() {
        verifyIdentity();
        if (rsvpId == null) {
            rsvpId = UUID.randomUUID().toString();
        }
        if (companions == null) {
            companions = 0;
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        verifyIdentity();
        updatedAt = Instant.now();
    }

    /**
     * Seats this response occupies: 1 + companions when going, otherwise 0.
     */
    public int getTotalAttendees() {
        if (status != RsvpStatus.GOING) {
            return 0;
        }
        return 1 + (companions != null ? companions : 0);
    }

    public boolean isTokenResponse() {
        return tokenId != null;
    }

    private void verifyIdentity() {
        if ((userId == null) == (tokenId == null)) {
            throw new IllegalStateException(
                    "RSVP must be bound to exactly one of userId or tokenId (userId=" + userId + ", tokenId=" + tokenId + ")");
        }
    }
}
