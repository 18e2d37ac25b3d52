package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.service.result.AuthResult;

/**
 * Response DTO for signup and login.
 *
 * @author Planorama Team
 */
public class AuthResponse {

    private String token;
    private UserResponse user;

    public AuthResponse() {
    }

    public static AuthResponse fromResult(AuthResult result) {
        AuthResponse response = new AuthResponse();
        response.setToken(result.getToken());
        response.setUser(UserResponse.fromEntity(result.getUser()));
        return response;
    }

    // Getters and setters
    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public UserResponse getUser() {
        return user;
    }

    public void setUser(UserResponse user) {
        this.user = user;
    }
}
