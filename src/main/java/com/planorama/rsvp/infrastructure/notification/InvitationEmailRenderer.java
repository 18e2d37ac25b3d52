package com.planorama.rsvp.infrastructure.notification;

import com.planorama.rsvp.domain.model.Event;
import com.planorama.rsvp.domain.model.TemplateStyle;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Renders invitation and direct-message emails as HTML plus a plain-text alternative.
 * All user-supplied values are HTML-escaped.
 *
 * @author Planorama Team
 */
@Component
public class InvitationEmailRenderer {

    private static final String SHARE_WARNING =
            "This invitation link is unique to you. Please do not share it with others.";

    private final DateTimeFormatter dateFormatter;
    private final String frontendUrl;

    public InvitationEmailRenderer(
            @Value("${rsvp.mail.time-zone:UTC}") String timeZone,
            @Value("${rsvp.frontend-url:http://localhost:3000}") String frontendUrl
    ) {
        this.dateFormatter = DateTimeFormatter
                .ofPattern("EEEE, MMMM d, yyyy 'at' hh:mm a z", Locale.US)
                .withZone(ZoneId.of(timeZone));
        this.frontendUrl = frontendUrl.endsWith("/")
                ? frontendUrl.substring(0, frontendUrl.length() - 1)
                : frontendUrl;
    }

    /**
     * Link a guest follows to respond: {@code {frontend}/event/{eventId}/{token}}.
     */
    public String buildInviteLink(String eventId, String token) {
        return frontendUrl + "/event/" + eventId + "/" + token;
    }

    public OutboundEmail renderInvitation(String recipient, Event event, TemplateStyle style, String inviteLink) {
        String subject = "You're invited to " + event.getTitle();
        return new OutboundEmail(recipient, subject,
                renderInvitationHtml(event, style, inviteLink),
                renderInvitationText(event, inviteLink));
    }

    /**
     * Plain message sent by a signed-in organizer through the email endpoint.
     */
    public OutboundEmail renderDirectMessage(String senderEmail, String to, String subject,
                                             String message, String replyTo) {
        String senderName = senderEmail.contains("@") ? senderEmail.substring(0, senderEmail.indexOf('@')) : "User";
        String sentAt = dateFormatter.format(Instant.now());

        StringBuilder html = new StringBuilder();
        html.append("<div style=\"font-family: Arial, sans-serif; max-width: 600px; margin: 0 auto; padding: 20px;\">")
            .append("<h2 style=\"color: #333; border-bottom: 2px solid #4F46E5; padding-bottom: 10px;\">")
            .append(esc(subject)).append("</h2>")
            .append("<div style=\"background-color: #f9fafb; padding: 20px; border-radius: 8px; margin-top: 20px;\">")
            .append("<p style=\"margin: 10px 0;\"><strong>From:</strong> ")
            .append(esc(senderName)).append(" (").append(esc(senderEmail)).append(")</p>");
        if (replyTo != null && !replyTo.isBlank()) {
            html.append("<p style=\"margin: 10px 0;\"><strong>Reply To:</strong> ").append(esc(replyTo)).append("</p>");
        }
        html.append("<p style=\"margin: 10px 0;\"><strong>Message:</strong></p>")
            .append("<p style=\"margin: 10px 0; padding: 10px; background-color: white; border-left: 3px solid #4F46E5;\">")
            .append(esc(message).replace("\n", "<br>")).append("</p>")
            .append("</div>")
            .append("<div style=\"margin-top: 20px; padding-top: 20px; border-top: 1px solid #e5e7eb; color: #6b7280; font-size: 12px;\">")
            .append("<p>This email was sent from the Planorama RSVP application.</p>")
            .append("<p>Sent at: ").append(esc(sentAt)).append("</p>")
            .append("</div></div>");

        StringBuilder text = new StringBuilder();
        text.append(subject).append("\n\n")
            .append("From: ").append(senderName).append(" (").append(senderEmail).append(")\n");
        if (replyTo != null && !replyTo.isBlank()) {
            text.append("Reply To: ").append(replyTo).append("\n");
        }
        text.append("\nMessage:\n").append(message).append("\n\n---\n")
            .append("This email was sent from the Planorama RSVP application.\n")
            .append("Sent at: ").append(sentAt).append("\n");

        String effectiveReplyTo = replyTo != null && !replyTo.isBlank() ? replyTo : senderEmail;
        return new OutboundEmail(to, subject, html.toString(), text.toString(), effectiveReplyTo);
    }

    private String renderInvitationHtml(Event event, TemplateStyle style, String inviteLink) {
        boolean emojis = style.isShowEmojis();
        String textColor = esc(style.getTextColor());
        String primaryColor = esc(style.getPrimaryColor());
        // Stored templates carry their own description; built-in defaults add none to real invitations
        String descriptionText = style.isStored() ? style.getDescriptionText() : "";

        StringBuilder html = new StringBuilder();
        html.append("<div style=\"font-family: ").append(esc(style.getFontFamily()))
            .append("; max-width: 600px; margin: 0 auto; padding: 20px; background-color: ")
            .append(esc(style.getSecondaryColor())).append(";\">")
            .append("<div style=\"background-color: white; padding: 30px; border-radius: 8px; box-shadow: 0 2px 4px rgba(0,0,0,0.1);\">");

        if (!style.getLogoUrl().isEmpty()) {
            html.append("<div style=\"text-align: center; margin-bottom: 20px;\"><img src=\"")
                .append(esc(style.getLogoUrl())).append("\" alt=\"Logo\" style=\"max-height: 80px;\"></div>");
        }

        html.append("<h1 style=\"color: ").append(primaryColor).append("; margin-bottom: 20px; text-align: center;\">")
            .append(esc(style.getHeaderText())).append("</h1>")
            .append("<div style=\"background-color: ").append(esc(style.getEventDetailsBackgroundColor()))
            .append("; padding: 20px; border-radius: 6px; margin-bottom: 20px;\">")
            .append("<h2 style=\"color: ").append(primaryColor).append("; margin-bottom: 15px; text-align: center;\">")
            .append(esc(event.getTitle())).append("</h2>")
            .append("<div style=\"color: ").append(textColor).append(";\">")
            .append(detailLine(emojis ? "📅 " : "", "Date", dateFormatter.format(event.getScheduledAt())))
            .append(detailLine(emojis ? "📍 " : "", "Location", event.getLocation()))
            .append(detailLine(emojis ? "📊 " : "", "Capacity", event.getCapacity() + " people"));
        if (event.getCategory() != null && !event.getCategory().isEmpty()) {
            html.append(detailLine(emojis ? "🏷️ " : "", "Category", event.getCategory()));
        }
        html.append("</div>");

        if (!descriptionText.isEmpty()) {
            html.append(paragraph(textColor, descriptionText));
        }
        if (event.getDescription() != null && !event.getDescription().isEmpty()) {
            html.append(paragraph(textColor, event.getDescription()));
        }

        html.append("<div style=\"text-align: center; margin-top: 20px;\">")
            .append("<a href=\"").append(esc(inviteLink)).append("\" style=\"display: inline-block; background-color: ")
            .append(primaryColor).append("; color: white; padding: 12px 30px; text-decoration: none; border-radius: ")
            .append(esc(style.getButtonRadius())).append("px; font-weight: bold;\">")
            .append(esc(style.getButtonText())).append("</a></div>")
            .append("</div>");

        html.append("<div style=\"text-align: center; margin-top: 30px;\">")
            .append("<p style=\"color: ").append(textColor).append("; font-size: 14px; margin-bottom: 8px;\">")
            .append(esc(style.getFooterText())).append("</p>");
        if (!style.getHostName().isEmpty()) {
            html.append("<p style=\"color: ").append(textColor).append("; font-weight: 600; font-size: 14px;\">- ")
                .append(esc(style.getHostName())).append("</p>");
        }
        html.append("</div>")
            .append("<p style=\"color: #999; font-size: 12px; margin-top: 30px; text-align: center;\">")
            .append(SHARE_WARNING).append("</p>")
            .append("</div></div>");
        return html.toString();
    }

    private String renderInvitationText(Event event, String inviteLink) {
        StringBuilder text = new StringBuilder();
        text.append("You're Invited to ").append(event.getTitle()).append("!\n\n")
            .append("Date: ").append(dateFormatter.format(event.getScheduledAt())).append("\n")
            .append("Location: ").append(event.getLocation()).append("\n")
            .append("Capacity: ").append(event.getCapacity()).append(" people\n");
        if (event.getCategory() != null && !event.getCategory().isEmpty()) {
            text.append("Category: ").append(event.getCategory()).append("\n");
        }
        if (event.getDescription() != null && !event.getDescription().isEmpty()) {
            text.append("\n").append(event.getDescription()).append("\n");
        }
        text.append("\nClick here to RSVP: ").append(inviteLink).append("\n\n")
            .append(SHARE_WARNING).append("\n");
        return text.toString();
    }

    private static String detailLine(String icon, String label, String value) {
        return "<p style=\"margin: 8px 0;\"><strong>" + icon + label + ":</strong> " + esc(value) + "</p>";
    }

    private static String paragraph(String color, String content) {
        return "<p style=\"color: " + color + "; margin-top: 15px; margin-bottom: 0;\">" + esc(content) + "</p>";
    }

    private static String esc(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
