package com.planorama.rsvp.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Invitation issued to one email address for one event.
 *
 * The secret {@code token} is the only credential a guest needs to respond. It is 256 bits of
 * SecureRandom output, hex encoded, and globally unique.
 *
 * @author Planorama Team
 */
@Entity
@Table(name = "invitation_tokens", indexes = {
    @Index(name = "idx_tokens_token", columnList = "token", unique = true),
    @Index(name = "idx_tokens_event_created", columnList = "event_id, created_at"),
    @Index(name = "idx_tokens_email", columnList = "email")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InvitationToken {

    @Id
    @Column(name = "token_id", nullable = false, length = 36)
    private String tokenId;

    @Column(name = "event_id", nullable = false, updatable = false, length = 36)
    private String eventId;

    /**
     * Normalized (trimmed, lowercase) invitee email.
     */
    @Column(name = "email", nullable = false, length = 255)
    private String email;

    /**
     * Display name; replaced by the name a guest submits with their response.
     */
    @Column(name = "name", length = 200)
    private String name;

    @Column(name = "token", nullable = false, unique = true, updatable = false, length = 64)
    private String token;

    /**
     * Registered account owning {@link #email}, if any. Set when the token is issued to an existing
     * account, or when the account signs up later.
     */
    @Column(name = "invitee_user_id", length = 36)
    private String inviteeUserId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (tokenId == null) {
            tokenId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
