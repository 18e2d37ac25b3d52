package com.planorama.rsvp.exception;

/**
 * Exception thrown when an email cannot be handed to the mail transport.
 *
 * @author Planorama Team
 */
public class NotificationDeliveryException extends RuntimeException {

    private final String recipient;

    public NotificationDeliveryException(String recipient, String message) {
        super(message);
        this.recipient = recipient;
    }

    public NotificationDeliveryException(String recipient, String message, Throwable cause) {
        super(message, cause);
        this.recipient = recipient;
    }

    public String getRecipient() {
        return recipient;
    }
}
