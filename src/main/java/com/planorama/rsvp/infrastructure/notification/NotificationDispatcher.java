package com.planorama.rsvp.infrastructure.notification;

import com.planorama.rsvp.exception.NotificationDeliveryException;

/**
 * Outbound email transport.
 *
 * @author Planorama Team
 */
public interface NotificationDispatcher {

    /**
     * Whether a transport is configured at all. When false, {@link #send(OutboundEmail)} always fails.
     */
    boolean isConfigured();

    /**
     * Sender address used in the From header, or null when not configured.
     */
    String getSenderAddress();

    /**
     * Hand a message to the transport.
     *
     * @param email Rendered message
     * @return Message-ID assigned to the sent message
     * @throws NotificationDeliveryException if the transport is not configured or rejects the message
     */
    String send(OutboundEmail email);

    /**
     * Probe the transport connection.
     *
     * @return true if the transport is configured and reachable
     */
    boolean verifyConnection();
}
