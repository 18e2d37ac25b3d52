package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.dto.DietaryStatsResponse;
import com.planorama.rsvp.api.dto.RsvpResponse;
import com.planorama.rsvp.api.dto.RsvpStatusResponse;
import com.planorama.rsvp.api.dto.TokenRsvpRequest;
import com.planorama.rsvp.api.dto.TokenRsvpResponse;
import com.planorama.rsvp.api.dto.UserRsvpRequest;
import com.planorama.rsvp.domain.model.Rsvp;
import com.planorama.rsvp.security.SecurityUtils;
import com.planorama.rsvp.service.RsvpService;
import com.planorama.rsvp.service.result.TokenRsvpResult;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for RSVP operations.
 * Signed-in users respond to events by ID; guests respond through their invitation token.
 *
 * @author Planorama Team
 */
@RestController
@RequestMapping("/api/v1/rsvps")
public class RsvpController {

    private static final Logger logger = LoggerFactory.getLogger(RsvpController.class);

    private final RsvpService rsvpService;

    public RsvpController(RsvpService rsvpService) {
        this.rsvpService = rsvpService;
    }

    /**
     * The caller's own response to an event, wrapped as {@code {"rsvp": ...}} with null when absent.
     */
    @GetMapping("/{eventId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<Map<String, RsvpResponse>> getMyRsvp(@PathVariable String eventId) {
        String userId = SecurityUtils.requireCurrentUserId();

        RsvpResponse rsvp = rsvpService.getUserRsvp(userId, eventId)
                .map(RsvpResponse::fromEntity)
                .orElse(null);

        return ResponseEntity.ok(Collections.singletonMap("rsvp", rsvp));
    }

    /**
     * Create or replace the caller's response to one of their events.
     *
     * @param eventId Event ID
     * @param request New status
     * @return Stored response
     */
    @PostMapping("/{eventId}")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<RsvpResponse> submitRsvp(
            @PathVariable String eventId,
            @Valid @RequestBody UserRsvpRequest request
    ) {
        String userId = SecurityUtils.requireCurrentUserId();

        Rsvp rsvp = rsvpService.submitUserRsvp(userId, eventId, request.getStatus());
        return ResponseEntity.ok(RsvpResponse.fromEntity(rsvp));
    }

    @GetMapping("/event/{eventId}/all")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<List<RsvpResponse>> listEventRsvps(@PathVariable String eventId) {
        String userId = SecurityUtils.requireCurrentUserId();

        List<RsvpResponse> rsvps = rsvpService.listEventRsvps(userId, eventId).stream()
                .map(RsvpResponse::fromEntity)
                .collect(Collectors.toList());

        return ResponseEntity.ok(rsvps);
    }

    /**
     * Guest response through an invitation link. Admission is checked against the event capacity.
     *
     * @param token Invitation secret
     * @param request Status, companions, optional name and dietary preferences
     * @return Stored response with the head count it admitted
     */
    @PostMapping("/token/{token}")
    public ResponseEntity<TokenRsvpResponse> submitTokenRsvp(
            @PathVariable String token,
            @Valid @RequestBody TokenRsvpRequest request
    ) {
        logger.debug("Guest response - status: {}, companions: {}", request.getStatus(), request.getCompanions());

        TokenRsvpResult result = rsvpService.submitTokenRsvp(
                token,
                request.getStatus(),
                request.getCompanions(),
                request.getGuestName(),
                request.getDietaryPreference(),
                request.getCompanionDietaryPreference()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(TokenRsvpResponse.fromResult(result));
    }

    @GetMapping("/token/{token}/status")
    public ResponseEntity<RsvpStatusResponse> getTokenRsvpStatus(@PathVariable String token) {
        RsvpStatusResponse response = rsvpService.getTokenRsvpStatus(token)
                .map(RsvpStatusResponse::fromEntity)
                .orElseGet(RsvpStatusResponse::notResponded);

        return ResponseEntity.ok(response);
    }

    /**
     * Meal counts across going responses of one of the caller's events.
     */
    @GetMapping("/event/{eventId}/dietary-stats")
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<DietaryStatsResponse> getDietaryStats(@PathVariable String eventId) {
        String userId = SecurityUtils.requireCurrentUserId();
        return ResponseEntity.ok(DietaryStatsResponse.fromStatistics(rsvpService.computeDietaryStatistics(userId, eventId)));
    }
}
