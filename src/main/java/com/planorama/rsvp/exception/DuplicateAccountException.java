package com.planorama.rsvp.exception;

/**
 * Exception thrown when signing up with an email that already has an account.
 *
 * @author Planorama Team
 */
public class DuplicateAccountException extends RuntimeException {

    private final String email;

    public DuplicateAccountException(String email) {
        super("User already exists");
        this.email = email;
    }

    public String getEmail() {
        return email;
    }
}
