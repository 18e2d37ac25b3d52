package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.dto.EmailTemplateRequest;
import com.planorama.rsvp.api.dto.EmailTemplateResponse;
import com.planorama.rsvp.domain.model.TemplateStyle;
import com.planorama.rsvp.security.SecurityUtils;
import com.planorama.rsvp.service.EmailTemplateService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for invitation email styling.
 *
 * @author Planorama Team
 */
@RestController
@RequestMapping("/api/v1/email-templates")
public class EmailTemplateController {

    private final EmailTemplateService templateService;

    public EmailTemplateController(EmailTemplateService templateService) {
        this.templateService = templateService;
    }

    /**
     * Styling that applies to the caller's invitations, optionally for one event.
     */
    @GetMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<EmailTemplateResponse> getTemplate(@RequestParam(required = false) String eventId) {
        String organizerId = SecurityUtils.requireCurrentUserId();

        TemplateStyle style = templateService.resolveTemplate(organizerId, eventId);
        return ResponseEntity.ok(EmailTemplateResponse.fromStyle(style));
    }

    @PostMapping
    @PreAuthorize("hasRole('ADMIN')")
    public ResponseEntity<EmailTemplateResponse> saveTemplate(@Valid @RequestBody EmailTemplateRequest request) {
        String organizerId = SecurityUtils.requireCurrentUserId();

        TemplateStyle style = templateService.saveTemplate(
                organizerId, request.toTemplate(), request.getEventId(), request.getIsDefault());
        return ResponseEntity.ok(EmailTemplateResponse.fromStyle(style));
    }
}
