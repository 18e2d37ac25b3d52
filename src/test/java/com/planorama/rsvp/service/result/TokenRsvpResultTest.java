package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.domain.model.RsvpStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("TokenRsvpResult Tests")
class TokenRsvpResultTest {

    @Test
    @DisplayName("Confirmation message reflects status and companion count")
    void confirmationMessage() {
        assertThat(TokenRsvpResult.confirmationMessage(Rsvp.builder().status(RsvpStatus.GOING).companions(1).build()))
                .isEqualTo("RSVP confirmed! You and 1 companion have been registered.");
        assertThat(TokenRsvpResult.confirmationMessage(Rsvp.builder().status(RsvpStatus.GOING).companions(0).build()))
                .isEqualTo("RSVP confirmed! You have been registered.");
        assertThat(TokenRsvpResult.confirmationMessage(Rsvp.builder().status(RsvpStatus.NOT_GOING).companions(2).build()))
                .isEqualTo("Thank you for your response.");
    }
}
