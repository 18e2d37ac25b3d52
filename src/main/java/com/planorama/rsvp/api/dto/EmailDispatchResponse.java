package com.planorama.rsvp.api.dto;

/**
 * Response DTO for a sent direct email.
 *
 * @author Planorama Team
 */
public class EmailDispatchResponse {

    private boolean success;
    private String messageId;
    private String message;

    public EmailDispatchResponse() {
    }

    public EmailDispatchResponse(String messageId) {
        this.success = true;
        this.messageId = messageId;
        this.message = "Email sent successfully";
    }

    // Getters and setters
    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getMessageId() {
        return messageId;
    }

    public void setMessageId(String messageId) {
        this.messageId = messageId;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
