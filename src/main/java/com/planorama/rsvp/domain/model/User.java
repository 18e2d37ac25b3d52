package com.planorama.rsvp.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Locale;
import java.util.UUID;

/**
 * Registered account. Organizers are users with the ADMIN role.
 *
 * @author Planorama Team
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_email", columnList = "email", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    @Id
    @Column(name = "user_id", nullable = false, length = 36)
    private String userId;

    /**
     * Normalized (trimmed, lowercase) email address.
     */
    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @ToString.Exclude
    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    @Builder.Default
    private Role role = Role.ADMIN;

    /**
     * Email template used when an event has no template of its own.
     * Null means the built-in defaults apply.
     */
    @Column(name = "default_email_template_id", length = 36)
    private String defaultEmailTemplateId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    protected void onCreate() {
        if (userId == null) {
            userId = UUID.randomUUID().toString();
        }
        createdAt = Instant.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    /**
     * Canonical form used for every stored and compared email: trimmed, lowercase.
     */
    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    public enum Role {
        ADMIN,
        USER
    }
}
