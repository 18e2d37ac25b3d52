package com.planorama.rsvp.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for a direct email.
 *
 * @author Planorama Team
 */
public class SendEmailRequest {

    @NotBlank(message = "Recipient is required")
    @Email(message = "Invalid email format")
    private String to;

    @NotBlank(message = "Subject is required")
    @Size(max = 200, message = "Subject too long")
    private String subject;

    @NotBlank(message = "Message is required")
    @Size(max = 10000, message = "Message too long")
    private String message;

    @Email(message = "Invalid reply-to email format")
    private String replyTo;

    public SendEmailRequest() {
    }

    public SendEmailRequest(String to, String subject, String message) {
        this.to = to;
        this.subject = subject;
        this.message = message;
    }

    // Getters and setters
    public String getTo() {
        return to;
    }

    public void setTo(String to) {
        this.to = to;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getReplyTo() {
        return replyTo;
    }

    public void setReplyTo(String replyTo) {
        this.replyTo = replyTo;
    }
}
