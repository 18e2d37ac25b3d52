package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.DietaryPreference;
import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;
import com.planorama.rsvp.exception.AlreadyRespondedException;
import com.planorama.rsvp.exception.CapacityExceededException;
import com.planorama.rsvp.exception.FieldValidationException;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.infrastructure.messaging.RsvpEventPublisher;
import com.planorama.rsvp.infrastructure.messaging.events.RsvpDomainEvent;
import com.planorama.rsvp.infrastructure.metrics.CloudWatchMetricsService;
import com.planorama.rsvp.repository.EventRepository;
import com.planorama.rsvp.repository.InvitationTokenRepository;
import com.planorama.rsvp.repository.RsvpRepository;
import com.planorama.rsvp.service.result.DietaryStatistics;
import com.planorama.rsvp.service.result.TokenRsvpResult;
import com.planorama.rsvp.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for RsvpService.
 * Covers admission through invitation tokens and organizer responses with mocked repositories.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("RsvpService Unit Tests")
class RsvpServiceTest {

    @Mock
    private EventRepository eventRepository;

    @Mock
    private RsvpRepository rsvpRepository;

    @Mock
    private InvitationTokenRepository tokenRepository;

    @Mock
    private RsvpEventPublisher eventPublisher;

    @Mock
    private CloudWatchMetricsService metricsService;

    @InjectMocks
    private RsvpService rsvpService;

    private Event event;
    private InvitationToken invitation;

    @BeforeEach
    void setUp() {
        event = TestDataBuilder.event()
                .eventId("event-001")
                .capacity(10)
                .createdBy("org-1")
                .build();

        invitation = TestDataBuilder.invitation()
                .tokenId("token-001")
                .eventId("event-001")
                .email("guest@example.com")
                .name("Guest")
                .token("secret-001")
                .build();
    }

    private void givenOpenInvitation(long currentAttendees) {
        when(tokenRepository.findByToken("secret-001")).thenReturn(Optional.of(invitation));
        when(eventRepository.findByIdForUpdate("event-001")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndTokenId("event-001", "token-001")).thenReturn(Optional.empty());
        when(rsvpRepository.sumGoingAttendees("event-001")).thenReturn(currentAttendees);
    }

    // ========================================
    // submitTokenRsvp() Tests
    // ========================================

    @Test
    @DisplayName("submitTokenRsvp - Going with companions is admitted and counts 1 + companions")
    void submitTokenRsvp_GoingWithCompanions_Admitted() {
        // Given
        givenOpenInvitation(0L);
        when(rsvpRepository.saveAndFlush(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        TokenRsvpResult result = rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.GOING, 4, null, DietaryPreference.VEG, DietaryPreference.VEGAN);

        // Then
        assertThat(result.getTotalAttendees()).isEqualTo(5);
        assertThat(result.getMessage()).isEqualTo("RSVP confirmed! You and 4 companions have been registered.");

        Rsvp saved = result.getRsvp();
        assertThat(saved.getTokenId()).isEqualTo("token-001");
        assertThat(saved.getUserId()).isNull();
        assertThat(saved.getCompanions()).isEqualTo(4);
        assertThat(saved.getGuestEmail()).isEqualTo("guest@example.com");
        assertThat(saved.getDietaryPreference()).isEqualTo(DietaryPreference.VEG);
        assertThat(saved.getCompanionDietaryPreference()).isEqualTo(DietaryPreference.VEGAN);

        verify(metricsService).recordRsvpAdmitted("token", "going");
        verify(metricsService).recordAdmissionLatency(anyLong());
        verify(eventPublisher).publish(any(RsvpDomainEvent.class));
        verify(tokenRepository, never()).updateName(anyString(), anyString());
    }

    @Test
    @DisplayName("submitTokenRsvp - Request larger than the seats left is rejected with the remaining count")
    void submitTokenRsvp_ExceedsCapacity_ThrowsCapacityExceeded() {
        // Given: 5 of 10 seats already taken
        givenOpenInvitation(5L);

        // When / Then: 1 + 6 companions (clamped to 5) = 6 seats
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.GOING, 6, null, null, null))
                .isInstanceOf(CapacityExceededException.class)
                .satisfies(ex -> {
                    CapacityExceededException capacity = (CapacityExceededException) ex;
                    assertThat(capacity.getRemainingSpots()).isEqualTo(5);
                    assertThat(capacity.getRequestedSpots()).isEqualTo(6);
                });

        verify(rsvpRepository, never()).saveAndFlush(any());
        verify(metricsService).recordRsvpRejected("CAPACITY_EXCEEDED");
        verify(eventPublisher, never()).publish(any());
    }

    @Test
    @DisplayName("submitTokenRsvp - Request that exactly fills the event is admitted")
    void submitTokenRsvp_ExactlyFillsCapacity_Admitted() {
        // Given
        givenOpenInvitation(8L);
        when(rsvpRepository.saveAndFlush(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        TokenRsvpResult result = rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.GOING, 1, null, null, null);

        // Then
        assertThat(result.getTotalAttendees()).isEqualTo(2);
    }

    @Test
    @DisplayName("submitTokenRsvp - Not going is admitted without a capacity check even when full")
    void submitTokenRsvp_NotGoing_SkipsCapacity() {
        // Given
        when(tokenRepository.findByToken("secret-001")).thenReturn(Optional.of(invitation));
        when(eventRepository.findByIdForUpdate("event-001")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndTokenId("event-001", "token-001")).thenReturn(Optional.empty());
        when(rsvpRepository.saveAndFlush(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        TokenRsvpResult result = rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.NOT_GOING, 3, null, null, null);

        // Then
        assertThat(result.getTotalAttendees()).isZero();
        assertThat(result.getMessage()).isEqualTo("Thank you for your response.");
        verify(rsvpRepository, never()).sumGoingAttendees(anyString());
    }

    @Test
    @DisplayName("submitTokenRsvp - Maybe is not offered to guests")
    void submitTokenRsvp_Maybe_ThrowsFieldValidation() {
        // When / Then
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.MAYBE, 0, null, null, null))
                .isInstanceOf(FieldValidationException.class)
                .hasMessage("Status must be 'going' or 'not-going'");

        verify(metricsService).recordRsvpRejected("INVALID_STATUS");
        verify(eventRepository, never()).findByIdForUpdate(anyString());
    }

    @Test
    @DisplayName("submitTokenRsvp - Invalid status is reported before the token is looked up")
    void submitTokenRsvp_MaybeWithUnknownToken_ThrowsFieldValidation() {
        // When / Then
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "missing", RsvpStatus.MAYBE, 0, null, null, null))
                .isInstanceOf(FieldValidationException.class);

        verify(tokenRepository, never()).findByToken(anyString());
    }

    @Test
    @DisplayName("submitTokenRsvp - Missing status is reported before the token is looked up")
    void submitTokenRsvp_MissingStatusWithUnknownToken_ThrowsFieldValidation() {
        // When / Then
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "missing", null, 0, null, null, null))
                .isInstanceOf(FieldValidationException.class)
                .hasMessage("Status is required");

        verifyNoInteractions(tokenRepository);
    }

    @Test
    @DisplayName("submitTokenRsvp - Unknown token returns not found")
    void submitTokenRsvp_UnknownToken_ThrowsNotFound() {
        // Given
        when(tokenRepository.findByToken("missing")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "missing", RsvpStatus.GOING, 0, null, null, null))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    @DisplayName("submitTokenRsvp - Second response for the same token returns the existing one")
    void submitTokenRsvp_AlreadyResponded_ThrowsWithExisting() {
        // Given
        Rsvp existing = TestDataBuilder.rsvp()
                .eventId("event-001")
                .tokenId("token-001")
                .status(RsvpStatus.GOING)
                .companions(2)
                .build();

        when(tokenRepository.findByToken("secret-001")).thenReturn(Optional.of(invitation));
        when(eventRepository.findByIdForUpdate("event-001")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndTokenId("event-001", "token-001")).thenReturn(Optional.of(existing));

        // When / Then
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.NOT_GOING, 0, null, null, null))
                .isInstanceOf(AlreadyRespondedException.class)
                .satisfies(ex -> assertThat(((AlreadyRespondedException) ex).getExistingRsvp()).isSameAs(existing));

        verify(rsvpRepository, never()).saveAndFlush(any());
        verify(metricsService).recordRsvpRejected("ALREADY_RESPONDED");
    }

    @Test
    @DisplayName("submitTokenRsvp - Unique constraint race is reported as already responded")
    void submitTokenRsvp_UniqueViolation_ThrowsAlreadyResponded() {
        // Given
        givenOpenInvitation(0L);
        when(rsvpRepository.saveAndFlush(any(Rsvp.class)))
                .thenThrow(new DataIntegrityViolationException("uk_rsvps_event_token"));

        // When / Then
        assertThatThrownBy(() -> rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.GOING, 0, null, null, null))
                .isInstanceOf(AlreadyRespondedException.class);

        verify(eventPublisher, never()).publish(any());
    }

    @Test
    @DisplayName("submitTokenRsvp - Negative companions are clamped to zero")
    void submitTokenRsvp_NegativeCompanions_ClampedToZero() {
        // Given
        givenOpenInvitation(0L);
        when(rsvpRepository.saveAndFlush(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        TokenRsvpResult result = rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.GOING, -3, null, null, null);

        // Then
        assertThat(result.getRsvp().getCompanions()).isZero();
        assertThat(result.getTotalAttendees()).isEqualTo(1);
        assertThat(result.getMessage()).isEqualTo("RSVP confirmed! You have been registered.");
    }

    @Test
    @DisplayName("submitTokenRsvp - Supplied guest name overrides and is written back to the invitation")
    void submitTokenRsvp_GuestName_WrittenBackToToken() {
        // Given
        givenOpenInvitation(0L);
        when(rsvpRepository.saveAndFlush(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        TokenRsvpResult result = rsvpService.submitTokenRsvp(
                "secret-001", RsvpStatus.GOING, 0, "  Jamie Guest  ", null, null);

        // Then
        assertThat(result.getRsvp().getGuestName()).isEqualTo("Jamie Guest");
        verify(tokenRepository).updateName("token-001", "Jamie Guest");
    }

    // ========================================
    // getTokenRsvpStatus() Tests
    // ========================================

    @Test
    @DisplayName("getTokenRsvpStatus - Returns empty before the guest responds")
    void getTokenRsvpStatus_NoResponse_ReturnsEmpty() {
        // Given
        when(tokenRepository.findByToken("secret-001")).thenReturn(Optional.of(invitation));
        when(rsvpRepository.findByEventIdAndTokenId("event-001", "token-001")).thenReturn(Optional.empty());

        // When
        Optional<Rsvp> result = rsvpService.getTokenRsvpStatus("secret-001");

        // Then
        assertThat(result).isEmpty();
    }

    // ========================================
    // submitUserRsvp() Tests
    // ========================================

    @Test
    @DisplayName("submitUserRsvp - Replaces the organizer's earlier response")
    void submitUserRsvp_ExistingResponse_Updated() {
        // Given
        Rsvp existing = TestDataBuilder.rsvp()
                .eventId("event-001")
                .userId("org-1")
                .status(RsvpStatus.GOING)
                .build();

        when(eventRepository.findByIdForUpdate("event-001")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndUserId("event-001", "org-1")).thenReturn(Optional.of(existing));
        when(rsvpRepository.save(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        Rsvp result = rsvpService.submitUserRsvp("org-1", "event-001", RsvpStatus.MAYBE);

        // Then
        assertThat(result).isSameAs(existing);
        assertThat(result.getStatus()).isEqualTo(RsvpStatus.MAYBE);
        verify(metricsService).recordRsvpAdmitted("user", "maybe");
    }

    @Test
    @DisplayName("submitUserRsvp - First response creates a user-bound RSVP")
    void submitUserRsvp_FirstResponse_Created() {
        // Given
        when(eventRepository.findByIdForUpdate("event-001")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndUserId("event-001", "org-1")).thenReturn(Optional.empty());
        when(rsvpRepository.save(any(Rsvp.class))).thenAnswer(inv -> inv.getArgument(0));

        // When
        rsvpService.submitUserRsvp("org-1", "event-001", RsvpStatus.GOING);

        // Then
        ArgumentCaptor<Rsvp> captor = ArgumentCaptor.forClass(Rsvp.class);
        verify(rsvpRepository).save(captor.capture());
        assertThat(captor.getValue().getUserId()).isEqualTo("org-1");
        assertThat(captor.getValue().getTokenId()).isNull();
        assertThat(captor.getValue().getCompanions()).isZero();
    }

    @Test
    @DisplayName("submitUserRsvp - Event owned by someone else is not found")
    void submitUserRsvp_ForeignEvent_ThrowsNotFound() {
        // Given
        when(eventRepository.findByIdForUpdate("event-001")).thenReturn(Optional.of(event));

        // When / Then
        assertThatThrownBy(() -> rsvpService.submitUserRsvp("org-2", "event-001", RsvpStatus.GOING))
                .isInstanceOf(ResourceNotFoundException.class);

        verify(rsvpRepository, never()).save(any());
    }

    // ========================================
    // listEventRsvps() Tests
    // ========================================

    @Test
    @DisplayName("listEventRsvps - Returns responses of an owned event")
    void listEventRsvps_OwnedEvent_ReturnsResponses() {
        // Given
        Rsvp guest = TestDataBuilder.rsvp().tokenId("t-1").build();
        Rsvp organizer = TestDataBuilder.rsvp().userId("org-1").status(RsvpStatus.MAYBE).build();
        when(eventRepository.findByEventIdAndCreatedBy("event-001", "org-1")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdOrderByCreatedAtDesc("event-001")).thenReturn(Arrays.asList(guest, organizer));

        // When
        List<Rsvp> rsvps = rsvpService.listEventRsvps("org-1", "event-001");

        // Then
        assertThat(rsvps).containsExactly(guest, organizer);
    }

    @Test
    @DisplayName("listEventRsvps - Event of another organizer throws not found")
    void listEventRsvps_ForeignEvent_ThrowsNotFound() {
        // Given
        when(eventRepository.findByEventIdAndCreatedBy("event-001", "org-2")).thenReturn(Optional.empty());

        // When / Then
        assertThatThrownBy(() -> rsvpService.listEventRsvps("org-2", "event-001"))
                .isInstanceOf(ResourceNotFoundException.class);
        verify(rsvpRepository, never()).findByEventIdOrderByCreatedAtDesc(any());
    }

    // ========================================
    // computeDietaryStatistics() Tests
    // ========================================

    @Test
    @DisplayName("computeDietaryStatistics - Counts guests and companion groups of going responses")
    void computeDietaryStatistics_CountsGoingResponses() {
        // Given
        Rsvp withCompanions = TestDataBuilder.rsvp()
                .tokenId("t-1")
                .companions(2)
                .dietaryPreference(DietaryPreference.VEG)
                .companionDietaryPreference(DietaryPreference.VEGAN)
                .build();
        Rsvp alone = TestDataBuilder.rsvp()
                .tokenId("t-2")
                .companions(0)
                .dietaryPreference(DietaryPreference.NONVEG)
                .companionDietaryPreference(DietaryPreference.VEG)
                .build();
        Rsvp unspecified = TestDataBuilder.rsvp()
                .tokenId("t-3")
                .companions(0)
                .build();

        when(eventRepository.findByEventIdAndCreatedBy("event-001", "org-1")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndStatus("event-001", RsvpStatus.GOING))
                .thenReturn(Arrays.asList(withCompanions, alone, unspecified));

        // When
        DietaryStatistics stats = rsvpService.computeDietaryStatistics("org-1", "event-001");

        // Then
        assertThat(stats.getVeg()).isEqualTo(1);
        assertThat(stats.getVegan()).isEqualTo(1);
        assertThat(stats.getNonveg()).isEqualTo(1);
        assertThat(stats.getNotSpecified()).isEqualTo(1);
        assertThat(stats.getTotal()).isEqualTo(4);
    }

    @Test
    @DisplayName("computeDietaryStatistics - Companion group without a preference counts once as not specified")
    void computeDietaryStatistics_CompanionsWithoutPreference_NotSpecified() {
        // Given
        Rsvp group = TestDataBuilder.rsvp()
                .tokenId("t-1")
                .companions(2)
                .build();

        when(eventRepository.findByEventIdAndCreatedBy("event-001", "org-1")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndStatus("event-001", RsvpStatus.GOING))
                .thenReturn(Collections.singletonList(group));

        // When
        DietaryStatistics stats = rsvpService.computeDietaryStatistics("org-1", "event-001");

        // Then
        assertThat(stats.getNotSpecified()).isEqualTo(2);
        assertThat(stats.getNonveg()).isZero();
        assertThat(stats.getVeg()).isZero();
        assertThat(stats.getVegan()).isZero();
        assertThat(stats.getTotal()).isEqualTo(2);
    }

    @Test
    @DisplayName("computeDietaryStatistics - Only going responses are read")
    void computeDietaryStatistics_ReadsGoingResponsesOnly() {
        // Given
        when(eventRepository.findByEventIdAndCreatedBy("event-001", "org-1")).thenReturn(Optional.of(event));
        when(rsvpRepository.findByEventIdAndStatus("event-001", RsvpStatus.GOING)).thenReturn(Collections.emptyList());

        // When
        DietaryStatistics stats = rsvpService.computeDietaryStatistics("org-1", "event-001");

        // Then
        assertThat(stats.getTotal()).isZero();
        verify(rsvpRepository, never()).findByEventIdAndStatus("event-001", RsvpStatus.MAYBE);
        verify(rsvpRepository, never()).findByEventIdAndStatus("event-001", RsvpStatus.NOT_GOING);
    }
}
