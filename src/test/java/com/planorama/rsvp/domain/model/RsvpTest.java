package com.planorama.rsvp.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Rsvp domain model.
 */
@DisplayName("Rsvp Domain Model Tests")
class RsvpTest {

    @Test
    @DisplayName("Going response occupies one seat plus companions")
    void getTotalAttendees_Going() {
        Rsvp rsvp = Rsvp.builder().status(RsvpStatus.GOING).companions(3).build();

        assertThat(rsvp.getTotalAttendees()).isEqualTo(4);
    }

    @Test
    @DisplayName("Not going and maybe occupy no seats regardless of companions")
    void getTotalAttendees_NotGoingOrMaybe() {
        Rsvp notGoing = Rsvp.builder().status(RsvpStatus.NOT_GOING).companions(3).build();
        Rsvp maybe = Rsvp.builder().status(RsvpStatus.MAYBE).companions(1).build();

        assertThat(notGoing.getTotalAttendees()).isZero();
        assertThat(maybe.getTotalAttendees()).isZero();
    }

    @Test
    @DisplayName("Companions are clamped to the allowed range")
    void clampCompanions() {
        assertThat(Rsvp.clampCompanions(null)).isZero();
        assertThat(Rsvp.clampCompanions(-2)).isZero();
        assertThat(Rsvp.clampCompanions(3)).isEqualTo(3);
        assertThat(Rsvp.clampCompanions(99)).isEqualTo(Rsvp.MAX_TOKEN_COMPANIONS);
    }

    @Test
    @DisplayName("Token response copies the invitation's identity and never an account")
    void forToken_BindsToInvitation() {
        // Given
        InvitationToken token = InvitationToken.builder()
                .tokenId("token-001")
                .eventId("event-001")
                .email("guest@example.com")
                .name("Guest")
                .inviteeUserId("user-9")
                .build();

        // When
        Rsvp rsvp = Rsvp.forToken(token, RsvpStatus.GOING, 2);

        // Then
        assertThat(rsvp.getEventId()).isEqualTo("event-001");
        assertThat(rsvp.getTokenId()).isEqualTo("token-001");
        assertThat(rsvp.getUserId()).isNull();
        assertThat(rsvp.getGuestEmail()).isEqualTo("guest@example.com");
        assertThat(rsvp.isTokenResponse()).isTrue();
    }

    @Test
    @DisplayName("Persisting without exactly one identity fails")
    void onCreate_RequiresExactlyOneIdentity() {
        Rsvp neither = Rsvp.builder().eventId("event-001").status(RsvpStatus.GOING).build();
        Rsvp both = Rsvp.builder().eventId("event-001").userId("u").tokenId("t").status(RsvpStatus.GOING).build();

        assertThatThrownBy(neither::onCreate).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(both::onCreate).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Persisting assigns an ID and timestamps")
    void onCreate_AssignsIdAndTimestamps() {
        Rsvp rsvp = Rsvp.forUser("event-001", "user-1", RsvpStatus.MAYBE);

        rsvp.onCreate();

        assertThat(rsvp.getRsvpId()).isNotBlank();
        assertThat(rsvp.getCreatedAt()).isNotNull();
        assertThat(rsvp.getUpdatedAt()).isEqualTo(rsvp.getCreatedAt());
    }
}
