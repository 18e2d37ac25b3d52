package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.dto.InvitationDetailsResponse;
import com.planorama.rsvp.api.dto.InvitationRequest;
import com.planorama.rsvp.api.dto.InvitationResponse;
import com.planorama.rsvp.api.dto.InviteePageResponse;
import com.planorama.rsvp.security.SecurityUtils;
import com.planorama.rsvp.service.InvitationService;
import com.planorama.rsvp.service.result.InvitationResult;
import com.planorama.rsvp.service.result.InviteePage;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for invitation tokens.
 *
 * @author Planorama Team
 */
@RestController
@RequestMapping("/api/v1/tokens")
public class InvitationTokenController {

    private static final Logger logger = LoggerFactory.getLogger(InvitationTokenController.class);

    private final InvitationService invitationService;

    public InvitationTokenController(InvitationService invitationService) {
        this.invitationService = invitationService;
    }

    /**
     * Invitees of one of the caller's events with their responses.
     *
     * Paging parameters are taken leniently: anything that isn't a positive number falls back to the default.
     *
     * @param eventId Event ID
     * @param page 1-based page
     * @param limit Page size
     * @param search Substring of email or name
     * @param status going, maybe, not-going or pending
     * @return Requested page
     */
    @GetMapping("/{eventId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InviteePageResponse> listInvitees(
            @PathVariable String eventId,
            @RequestParam(required = false) String page,
            @RequestParam(required = false) String limit,
            @RequestParam(required = false) String search,
            @RequestParam(required = false) String status
    ) {
        String organizerId = SecurityUtils.requireCurrentUserId();

        InviteePage result = invitationService.listInvitees(
                organizerId, eventId, parsePositive(page), parsePositive(limit), search, status);

        return ResponseEntity.ok(InviteePageResponse.fromPage(result));
    }

    /**
     * Invite someone to one of the caller's events. The response reports whether the email went out.
     */
    @PostMapping("/{eventId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<InvitationResponse> createInvitation(
            @PathVariable String eventId,
            @Valid @RequestBody InvitationRequest request
    ) {
        String organizerId = SecurityUtils.requireCurrentUserId();

        InvitationResult result = invitationService.createInvitation(
                organizerId, eventId, request.getEmail(), request.getName());

        logger.info("Invitation issued for event: {}, emailSent: {}", eventId, result.isEmailSent());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvitationResponse.fromResult(result));
    }

    @GetMapping("/token/{token}")
    public ResponseEntity<InvitationDetailsResponse> getInvitation(@PathVariable String token) {
        return ResponseEntity.ok(InvitationDetailsResponse.fromDetails(invitationService.getInvitationByToken(token)));
    }

    private static Integer parsePositive(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed > 0 ? parsed : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
