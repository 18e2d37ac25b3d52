package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.domain.model.User;

import java.util.Locale;

/**
 * Public view of an account. Never carries the password hash.
 *
 * @author Planorama Team
 */
public class UserResponse {

    private String id;
    private String email;
    private String role;

    public UserResponse() {
    }

    public static UserResponse fromEntity(User user) {
        UserResponse response = new UserResponse();
        response.setId(user.getUserId());
        response.setEmail(user.getEmail());
        response.setRole(user.getRole().name().toLowerCase(Locale.ROOT));
        return response;
    }

    // Getters and setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getRole() {
        return role;
    }

    public void setRole(String role) {
        this.role = role;
    }
}
