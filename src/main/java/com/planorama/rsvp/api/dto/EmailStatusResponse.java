package com.planorama.rsvp.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response DTO for mail transport status and verification.
 *
 * @author Planorama Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class EmailStatusResponse {

    private boolean success;
    private boolean configured;
    private String senderAddress;
    private String message;

    public EmailStatusResponse() {
    }

    public EmailStatusResponse(boolean success, boolean configured, String senderAddress, String message) {
        this.success = success;
        this.configured = configured;
        this.senderAddress = senderAddress;
        this.message = message;
    }

    // Getters and setters
    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public boolean isConfigured() {
        return configured;
    }

    public void setConfigured(boolean configured) {
        this.configured = configured;
    }

    public String getSenderAddress() {
        return senderAddress;
    }

    public void setSenderAddress(String senderAddress) {
        this.senderAddress = senderAddress;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }
}
