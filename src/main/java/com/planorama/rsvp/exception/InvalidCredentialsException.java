package com.planorama.rsvp.exception;

/**
 * Exception thrown on a failed login. The message never reveals which part was wrong.
 *
 * @author Planorama Team
 */
public class InvalidCredentialsException extends RuntimeException {

    public InvalidCredentialsException() {
        super("Invalid email or password");
    }
}
