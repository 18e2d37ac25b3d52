package com.planorama.rsvp.testutil;

import com.planorama.rsvp.domain.model.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * Builder class for creating test data objects.
 * Provides fluent API for building domain models with sensible defaults.
 */
public class TestDataBuilder {

    /**
     * Builder for Event
     */
    public static class EventBuilder {
        private String eventId = UUID.randomUUID().toString();
        private String title = "Summer Garden Party";
        private String description = "Drinks and music in the garden";
        private Instant scheduledAt = Instant.now().plus(30, ChronoUnit.DAYS);
        private String location = "12 Rose Lane";
        private String category = "Party";
        private Integer capacity = 10;
        private Integer allowedCompanions = 2;
        private String hostName = "Alex Host";
        private String hostMobile = "+15550100";
        private String hostEmail = "host@example.com";
        private String createdBy = "org-1";

        public EventBuilder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public EventBuilder title(String title) {
            this.title = title;
            return this;
        }

        public EventBuilder scheduledAt(Instant scheduledAt) {
            this.scheduledAt = scheduledAt;
            return this;
        }

        public EventBuilder capacity(Integer capacity) {
            this.capacity = capacity;
            return this;
        }

        public EventBuilder createdBy(String createdBy) {
            this.createdBy = createdBy;
            return this;
        }

        public Event build() {
            return Event.builder()
                    .eventId(eventId)
                    .title(title)
                    .description(description)
                    .scheduledAt(scheduledAt)
                    .location(location)
                    .category(category)
                    .capacity(capacity)
                    .allowedCompanions(allowedCompanions)
                    .hostName(hostName)
                    .hostMobile(hostMobile)
                    .hostEmail(hostEmail)
                    .createdBy(createdBy)
                    .createdAt(Instant.now())
                    .build();
        }
    }

    /**
     * Builder for InvitationToken
     */
    public static class InvitationBuilder {
        private String tokenId = UUID.randomUUID().toString();
        private String eventId = "event-001";
        private String email = "guest@example.com";
        private String name = "Guest";
        private String token = UUID.randomUUID().toString().replace("-", "");
        private String inviteeUserId;
        private Instant createdAt = Instant.now();

        public InvitationBuilder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        public InvitationBuilder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public InvitationBuilder email(String email) {
            this.email = email;
            return this;
        }

        public InvitationBuilder name(String name) {
            this.name = name;
            return this;
        }

        public InvitationBuilder token(String token) {
            this.token = token;
            return this;
        }

        public InvitationBuilder inviteeUserId(String inviteeUserId) {
            this.inviteeUserId = inviteeUserId;
            return this;
        }

        public InvitationBuilder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public InvitationToken build() {
            return InvitationToken.builder()
                    .tokenId(tokenId)
                    .eventId(eventId)
                    .email(email)
                    .name(name)
                    .token(token)
                    .inviteeUserId(inviteeUserId)
                    .createdAt(createdAt)
                    .build();
        }
    }

    /**
     * Builder for Rsvp
     */
    public static class RsvpBuilder {
        private String rsvpId = UUID.randomUUID().toString();
        private String eventId = "event-001";
        private String userId;
        private String tokenId;
        private RsvpStatus status = RsvpStatus.GOING;
        private Integer companions = 0;
        private DietaryPreference dietaryPreference;
        private DietaryPreference companionDietaryPreference;

        public RsvpBuilder eventId(String eventId) {
            this.eventId = eventId;
            return this;
        }

        public RsvpBuilder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public RsvpBuilder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        public RsvpBuilder status(RsvpStatus status) {
            this.status = status;
            return this;
        }

        public RsvpBuilder companions(Integer companions) {
            this.companions = companions;
            return this;
        }

        public RsvpBuilder dietaryPreference(DietaryPreference dietaryPreference) {
            this.dietaryPreference = dietaryPreference;
            return this;
        }

        public RsvpBuilder companionDietaryPreference(DietaryPreference companionDietaryPreference) {
            this.companionDietaryPreference = companionDietaryPreference;
            return this;
        }

        public Rsvp build() {
            return Rsvp.builder()
                    .rsvpId(rsvpId)
                    .eventId(eventId)
                    .userId(userId)
                    .tokenId(tokenId)
                    .status(status)
                    .companions(companions)
                    .dietaryPreference(dietaryPreference)
                    .companionDietaryPreference(companionDietaryPreference)
                    .createdAt(Instant.now())
                    .updatedAt(Instant.now())
                    .build();
        }
    }

    /**
     * Builder for User
     */
    public static class UserBuilder {
        private String userId = UUID.randomUUID().toString();
        private String email = "organizer@example.com";
        private String passwordHash = "$2a$10$hash";
        private String defaultEmailTemplateId;

        public UserBuilder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public UserBuilder email(String email) {
            this.email = email;
            return this;
        }

        public UserBuilder passwordHash(String passwordHash) {
            this.passwordHash = passwordHash;
            return this;
        }

        public UserBuilder defaultEmailTemplateId(String defaultEmailTemplateId) {
            this.defaultEmailTemplateId = defaultEmailTemplateId;
            return this;
        }

        public User build() {
            return User.builder()
                    .userId(userId)
                    .email(email)
                    .passwordHash(passwordHash)
                    .role(User.Role.ADMIN)
                    .defaultEmailTemplateId(defaultEmailTemplateId)
                    .createdAt(Instant.now())
                    .build();
        }
    }

    public static EventBuilder event() {
        return new EventBuilder();
    }

    public static InvitationBuilder invitation() {
        return new InvitationBuilder();
    }

    public static RsvpBuilder rsvp() {
        return new RsvpBuilder();
    }

    public static UserBuilder user() {
        return new UserBuilder();
    }
}
