package com.planorama.rsvp.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request DTO for issuing an invitation.
 *
 * @author Planorama Team
 */
public class InvitationRequest {

    @NotBlank(message = "Email is required")
    @Email(message = "Invalid email address")
    @Size(max = 255, message = "Email too long")
    private String email;

    @Size(max = 200, message = "Name too long")
    private String name;

    public InvitationRequest() {
    }

    public InvitationRequest(String email, String name) {
        this.email = email;
        this.name = name;
    }

    // Getters and setters
    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }
}
