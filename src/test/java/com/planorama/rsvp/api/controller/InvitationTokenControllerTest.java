package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.exception.GlobalExceptionHandler;
import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.RsvpStatus;
import com.planorama.rsvp.exception.ResourceNotFoundException;
import com.planorama.rsvp.service.InvitationService;
import com.planorama.rsvp.service.result.InvitationDetails;
import com.planorama.rsvp.service.result.InvitationResult;
import com.planorama.rsvp.service.result.InviteePage;
import com.planorama.rsvp.service.result.InviteeView;
import com.planorama.rsvp.testutil.TestDataBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.ContextConfiguration;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Arrays;
import java.util.Collections;

import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for InvitationTokenController using MockMvc.
 */
@WebMvcTest(InvitationTokenController.class)
@ContextConfiguration(classes = {InvitationTokenController.class, GlobalExceptionHandler.class})
@AutoConfigureMockMvc(addFilters = false)
@WithMockUser(username = "org-1", roles = "ADMIN")
@DisplayName("InvitationTokenController Tests")
class InvitationTokenControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private InvitationService invitationService;

    @Test
    @DisplayName("GET /tokens/{eventId} - Returns page with resolved statuses and pagination")
    void listInvitees_ReturnsPage() throws Exception {
        // Given
        InvitationToken answered = TestDataBuilder.invitation().tokenId("t-1").email("a@example.com").build();
        InvitationToken open = TestDataBuilder.invitation().tokenId("t-2").email("b@example.com").build();
        InviteePage page = new InviteePage(
                Arrays.asList(new InviteeView(answered, RsvpStatus.GOING, 2), InviteeView.pending(open)), 2, 2, 5);
        when(invitationService.listInvitees("org-1", "event-001", 2, 2, "example", "going")).thenReturn(page);

        // When / Then
        mockMvc.perform(get("/api/v1/tokens/event-001")
                        .param("page", "2")
                        .param("limit", "2")
                        .param("search", "example")
                        .param("status", "going"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tokens[0].rsvpStatus").value("going"))
                .andExpect(jsonPath("$.tokens[0].companions").value(2))
                .andExpect(jsonPath("$.tokens[1].rsvpStatus").value(nullValue()))
                .andExpect(jsonPath("$.pagination.page").value(2))
                .andExpect(jsonPath("$.pagination.total").value(5))
                .andExpect(jsonPath("$.pagination.totalPages").value(3));
    }

    @Test
    @DisplayName("GET /tokens/{eventId} - Unparseable paging falls back to defaults")
    void listInvitees_BadPaging_UsesDefaults() throws Exception {
        // Given
        when(invitationService.listInvitees("org-1", "event-001", null, null, null, null))
                .thenReturn(new InviteePage(Collections.emptyList(), 1, 10, 0));

        // When / Then
        mockMvc.perform(get("/api/v1/tokens/event-001")
                        .param("page", "abc")
                        .param("limit", "-4"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pagination.limit").value(10));

        verify(invitationService).listInvitees("org-1", "event-001", null, null, null, null);
    }

    @Test
    @DisplayName("POST /tokens/{eventId} - Returns 201 with emailSent")
    void createInvitation_Returns201() throws Exception {
        // Given
        InvitationToken token = TestDataBuilder.invitation().tokenId("t-1").email("guest@example.com").build();
        when(invitationService.createInvitation("org-1", "event-001", "guest@example.com", "Guest"))
                .thenReturn(new InvitationResult(token, false));

        // When / Then
        mockMvc.perform(post("/api/v1/tokens/event-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"guest@example.com\",\"name\":\"Guest\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.token.email").value("guest@example.com"))
                .andExpect(jsonPath("$.emailSent").value(false));
    }

    @Test
    @DisplayName("POST /tokens/{eventId} - Invalid email returns 400 Bad Request")
    void createInvitation_InvalidEmail_Returns400() throws Exception {
        mockMvc.perform(post("/api/v1/tokens/event-001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"not-an-email\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.fieldErrors.email").exists());

        verify(invitationService, never()).createInvitation(any(), any(), any(), any());
    }

    @Test
    @DisplayName("GET /tokens/token/{token} - Returns event with host contact and invitee")
    void getInvitation_ReturnsEventAndInvitee() throws Exception {
        // Given
        Event event = TestDataBuilder.event().eventId("event-001").build();
        InvitationToken token = TestDataBuilder.invitation().email("guest@example.com").name("Guest").build();
        when(invitationService.getInvitationByToken("secret-001")).thenReturn(new InvitationDetails(token, event));

        // When / Then
        mockMvc.perform(get("/api/v1/tokens/token/secret-001"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.event.id").value("event-001"))
                .andExpect(jsonPath("$.event.hostMobile").value("+15550100"))
                .andExpect(jsonPath("$.token.email").value("guest@example.com"))
                .andExpect(jsonPath("$.token.name").value("Guest"));
    }

    @Test
    @DisplayName("GET /tokens/token/{token} - Unknown token returns 404")
    void getInvitation_Unknown_Returns404() throws Exception {
        // Given
        when(invitationService.getInvitationByToken("nope"))
                .thenThrow(new ResourceNotFoundException("Invitation", "nope"));

        // When / Then
        mockMvc.perform(get("/api/v1/tokens/token/nope"))
                .andExpect(status().isNotFound());
    }
}
