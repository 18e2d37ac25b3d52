package com.planorama.rsvp.repository;

import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;
import com.planorama.rsvp.testutil.TestDataBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Integration tests for RsvpRepository using Testcontainers.
 * Checks the identity constraints and attendee sums against a real PostgreSQL database.
 */
@DataJpaTest
@Testcontainers
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("RsvpRepository Integration Tests")
class RsvpRepositoryIT {

    private static final String EVENT_ID = "11111111-1111-1111-1111-111111111111";
    private static final String OTHER_EVENT_ID = "22222222-2222-2222-2222-222222222222";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("planorama_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create-drop");
    }

    @Autowired
    private RsvpRepository rsvpRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @BeforeEach
    void setUp() {
        rsvpRepository.deleteAll();
    }

    // ========================================
    // Identity constraint Tests
    // ========================================

    @Test
    @DisplayName("Second response for the same token is rejected by the database")
    void saveTokenResponse_SameTokenTwice_ViolatesUniqueConstraint() {
        // Given
        String tokenId = UUID.randomUUID().toString();
        rsvpRepository.saveAndFlush(TestDataBuilder.rsvp().eventId(EVENT_ID).tokenId(tokenId).build());

        // When / Then
        Rsvp duplicate = TestDataBuilder.rsvp().eventId(EVENT_ID).tokenId(tokenId).status(RsvpStatus.NOT_GOING).build();
        assertThatThrownBy(() -> rsvpRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Second response for the same account is rejected by the database")
    void saveUserResponse_SameUserTwice_ViolatesUniqueConstraint() {
        // Given
        rsvpRepository.saveAndFlush(TestDataBuilder.rsvp().eventId(EVENT_ID).userId("org-1").build());

        // When / Then
        Rsvp duplicate = TestDataBuilder.rsvp().eventId(EVENT_ID).userId("org-1").build();
        assertThatThrownBy(() -> rsvpRepository.saveAndFlush(duplicate))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Token responses without an account do not collide with each other")
    void saveTokenResponses_DistinctTokens_AllStored() {
        // When
        rsvpRepository.saveAndFlush(TestDataBuilder.rsvp().eventId(EVENT_ID).tokenId(UUID.randomUUID().toString()).build());
        rsvpRepository.saveAndFlush(TestDataBuilder.rsvp().eventId(EVENT_ID).tokenId(UUID.randomUUID().toString()).build());
        rsvpRepository.saveAndFlush(TestDataBuilder.rsvp().eventId(EVENT_ID).userId("org-1").build());

        // Then
        assertThat(rsvpRepository.findByEventIdOrderByCreatedAtDesc(EVENT_ID)).hasSize(3);
    }

    @Test
    @DisplayName("Row bound to both an account and a token is rejected by the check constraint")
    void insertRow_BothIdentities_ViolatesCheckConstraint() {
        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO rsvps (rsvp_id, event_id, user_id, token_id, status, companions, created_at, updated_at) "
                        + "VALUES (?, ?, ?, ?, 'GOING', 0, now(), now())",
                UUID.randomUUID().toString(), EVENT_ID, "org-1", UUID.randomUUID().toString()))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Row bound to no identity is rejected by the check constraint")
    void insertRow_NoIdentity_ViolatesCheckConstraint() {
        assertThatThrownBy(() -> jdbcTemplate.update(
                "INSERT INTO rsvps (rsvp_id, event_id, status, companions, created_at, updated_at) "
                        + "VALUES (?, ?, 'GOING', 0, now(), now())",
                UUID.randomUUID().toString(), EVENT_ID))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    // ========================================
    // Attendee sum Tests
    // ========================================

    @Test
    @DisplayName("sumGoingAttendees - Counts 1 + companions over going responses only")
    void sumGoingAttendees_CountsOnlyGoing() {
        // Given
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).status(RsvpStatus.GOING).companions(2).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .userId("org-1").status(RsvpStatus.GOING).companions(0).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .userId("org-2").status(RsvpStatus.MAYBE).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).status(RsvpStatus.NOT_GOING).companions(4).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(OTHER_EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).status(RsvpStatus.GOING).companions(5).build());
        rsvpRepository.flush();

        // When
        long attendees = rsvpRepository.sumGoingAttendees(EVENT_ID);

        // Then
        assertThat(attendees).isEqualTo(4L);
    }

    @Test
    @DisplayName("sumGoingAttendees - Event without responses counts zero")
    void sumGoingAttendees_NoResponses_ReturnsZero() {
        assertThat(rsvpRepository.sumGoingAttendees(EVENT_ID)).isZero();
    }

    @Test
    @DisplayName("sumGoingAttendeesByEvent - Groups per event and omits events nobody attends")
    void sumGoingAttendeesByEvent_GroupsPerEvent() {
        // Given
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).companions(1).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(OTHER_EVENT_ID)
                .userId("org-1").status(RsvpStatus.NOT_GOING).build());
        rsvpRepository.flush();

        // When
        List<Object[]> rows = rsvpRepository.sumGoingAttendeesByEvent(Arrays.asList(EVENT_ID, OTHER_EVENT_ID));

        // Then
        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)[0]).isEqualTo(EVENT_ID);
        assertThat(((Number) rows.get(0)[1]).longValue()).isEqualTo(2L);
    }

    @Test
    @DisplayName("findByEventIdAndStatus - Going filter skips maybe and not-going responses")
    void findByEventIdAndStatus_Going_SkipsOtherStatuses() {
        // Given
        Rsvp going = rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).status(RsvpStatus.GOING).companions(2).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .userId("org-1").status(RsvpStatus.MAYBE).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).status(RsvpStatus.NOT_GOING).companions(3).build());
        rsvpRepository.save(TestDataBuilder.rsvp().eventId(OTHER_EVENT_ID)
                .tokenId(UUID.randomUUID().toString()).status(RsvpStatus.GOING).build());
        rsvpRepository.flush();

        // When
        List<Rsvp> goingRsvps = rsvpRepository.findByEventIdAndStatus(EVENT_ID, RsvpStatus.GOING);

        // Then
        assertThat(goingRsvps).extracting(Rsvp::getRsvpId).containsExactly(going.getRsvpId());
    }
}
