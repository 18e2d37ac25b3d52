package com.planorama.rsvp.service;

import com.planorama.rsvp.domain.model.User;
import com.planorama.rsvp.exception.NotificationDeliveryException;
import com.planorama.rsvp.infrastructure.metrics.CloudWatchMetricsService;
import com.planorama.rsvp.infrastructure.notification.InvitationEmailRenderer;
import com.planorama.rsvp.infrastructure.notification.NotificationDispatcher;
import com.planorama.rsvp.infrastructure.notification.OutboundEmail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Direct messages from signed-in users and mail transport diagnostics.
 *
 * @author Planorama Team
 */
@Service
public class EmailService {

    private static final Logger logger = LoggerFactory.getLogger(EmailService.class);

    private final AuthService authService;
    private final InvitationEmailRenderer emailRenderer;
    private final NotificationDispatcher notificationDispatcher;
    private final CloudWatchMetricsService metricsService;

    public EmailService(
            AuthService authService,
            InvitationEmailRenderer emailRenderer,
            NotificationDispatcher notificationDispatcher,
            CloudWatchMetricsService metricsService
    ) {
        this.authService = authService;
        this.emailRenderer = emailRenderer;
        this.notificationDispatcher = notificationDispatcher;
        this.metricsService = metricsService;
    }

    /**
     * Send a plain message on behalf of a user. Replies go to {@code replyTo}, or to the sender.
     *
     * @return Message-ID of the sent message
     * @throws NotificationDeliveryException if the transport is missing or rejects the message
     */
    public String sendMessage(String senderUserId, String to, String subject, String message, String replyTo) {
        User sender = authService.getCurrentUser(senderUserId);

        OutboundEmail email = emailRenderer.renderDirectMessage(sender.getEmail(), to, subject, message, replyTo);
        try {
            String messageId = notificationDispatcher.send(email);
            metricsService.recordEmailDispatch("direct", true);
            logger.info("Direct email sent by user: {}, messageId: {}", senderUserId, messageId);
            return messageId;
        } catch (NotificationDeliveryException e) {
            metricsService.recordEmailDispatch("direct", false);
            logger.error("Direct email from user: {} failed", senderUserId, e);
            throw e;
        }
    }

    public boolean isConfigured() {
        return notificationDispatcher.isConfigured();
    }

    public String getSenderAddress() {
        return notificationDispatcher.getSenderAddress();
    }

    public boolean verifyConnection() {
        return notificationDispatcher.verifyConnection();
    }
}
