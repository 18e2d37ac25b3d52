package com.planorama.rsvp.api.controller;

import com.planorama.rsvp.api.dto.EmailDispatchResponse;
import com.planorama.rsvp.api.dto.EmailStatusResponse;
import com.planorama.rsvp.api.dto.SendEmailRequest;
import com.planorama.rsvp.security.SecurityUtils;
import com.planorama.rsvp.service.EmailService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for direct messages and mail transport diagnostics.
 *
 * @author Planorama Team
 */
@RestController
@RequestMapping("/api/v1/email")
public class EmailController {

    private static final Logger logger = LoggerFactory.getLogger(EmailController.class);

    private final EmailService emailService;

    public EmailController(EmailService emailService) {
        this.emailService = emailService;
    }

    /**
     * Send a plain message on behalf of the caller.
     *
     * @param request Recipient, subject, body and optional reply-to
     * @return Message-ID assigned by the transport
     */
    @PostMapping("/send")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EmailDispatchResponse> send(@Valid @RequestBody SendEmailRequest request) {
        String userId = SecurityUtils.requireCurrentUserId();

        String messageId = emailService.sendMessage(
                userId, request.getTo(), request.getSubject(), request.getMessage(), request.getReplyTo());
        return ResponseEntity.ok(new EmailDispatchResponse(messageId));
    }

    @GetMapping("/status")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EmailStatusResponse> status() {
        boolean configured = emailService.isConfigured();
        String message = configured ? "Email service is configured" : "Email service is not configured";
        return ResponseEntity.ok(new EmailStatusResponse(true, configured, emailService.getSenderAddress(), message));
    }

    /**
     * Check that the mail server accepts a connection. Returns 500 when it doesn't or when no transport is set up.
     */
    @GetMapping("/verify")
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<EmailStatusResponse> verify() {
        if (!emailService.isConfigured()) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new EmailStatusResponse(false, false, null, "Email service is not configured"));
        }

        if (!emailService.verifyConnection()) {
            logger.warn("Mail server verification failed");
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(new EmailStatusResponse(false, true, emailService.getSenderAddress(),
                            "Email server connection failed"));
        }

        return ResponseEntity.ok(new EmailStatusResponse(true, true, emailService.getSenderAddress(),
                "Email server connection verified"));
    }
}
