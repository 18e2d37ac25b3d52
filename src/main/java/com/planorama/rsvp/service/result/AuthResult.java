package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.User;

/**
 * Bearer token issued for an account.
 *
 * @author Planorama Team
 */
public class AuthResult {

    private final String token;
    private final User user;

    public AuthResult(String token, User user) {
        this.token = token;
        this.user = user;
    }

    public String getToken() {
        return token;
    }

    public User getUser() {
        return user;
    }
}
