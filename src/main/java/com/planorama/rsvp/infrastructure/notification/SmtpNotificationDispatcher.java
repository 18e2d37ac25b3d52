package com.planorama.rsvp.infrastructure.notification;

import com.planorama.rsvp.exception.NotificationDeliveryException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.JavaMailSenderImpl;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;

/**
 * SMTP dispatcher backed by Spring's {@link JavaMailSender}.
 *
 * The sender bean only exists when {@code spring.mail.host} is set, and sending is additionally
 * gated by {@code rsvp.mail.enabled}; without both the dispatcher reports itself unconfigured.
 *
 * @author Planorama Team
 */
@Service
public class SmtpNotificationDispatcher implements NotificationDispatcher {

    private static final Logger logger = LoggerFactory.getLogger(SmtpNotificationDispatcher.class);

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final boolean enabled;
    private final String fromAddress;

    public SmtpNotificationDispatcher(
            ObjectProvider<JavaMailSender> mailSenderProvider,
            @Value("${rsvp.mail.enabled:false}") boolean enabled,
            @Value("${rsvp.mail.from:}") String fromAddress
    ) {
        this.mailSenderProvider = mailSenderProvider;
        this.enabled = enabled;
        this.fromAddress = fromAddress;
    }

    @Override
    public boolean isConfigured() {
        return enabled && !fromAddress.isBlank() && mailSenderProvider.getIfAvailable() != null;
    }

    @Override
    public String getSenderAddress() {
        return isConfigured() ? fromAddress : null;
    }

    @Override
    public String send(OutboundEmail email) {
        JavaMailSender mailSender = isConfigured() ? mailSenderProvider.getIfAvailable() : null;
        if (mailSender == null) {
            throw new NotificationDeliveryException(email.getTo(), "Email service not configured");
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, true, StandardCharsets.UTF_8.name());
            helper.setFrom(fromAddress);
            helper.setTo(email.getTo());
            helper.setSubject(email.getSubject());
            helper.setText(email.getText(), email.getHtml());
            if (email.getReplyTo() != null && !email.getReplyTo().isBlank()) {
                helper.setReplyTo(email.getReplyTo());
            }

            mailSender.send(message);

            String messageId = message.getMessageID();
            logger.info("Email sent to {}, messageId: {}", email.getTo(), messageId);
            return messageId;

        } catch (MessagingException | MailException e) {
            throw new NotificationDeliveryException(email.getTo(), "Failed to send email", e);
        }
    }

    @Override
    public boolean verifyConnection() {
        if (!isConfigured()) {
            return false;
        }
        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (!(mailSender instanceof JavaMailSenderImpl)) {
            // Non-SMTP senders have no connection to test
            return mailSender != null;
        }
        try {
            ((JavaMailSenderImpl) mailSender).testConnection();
            return true;
        } catch (MessagingException e) {
            logger.warn("Email connection verification failed: {}", e.getMessage());
            return false;
        }
    }
}
