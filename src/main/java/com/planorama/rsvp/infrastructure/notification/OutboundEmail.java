package com.planorama.rsvp.infrastructure.notification;

/**
 * A rendered email ready for dispatch.
 *
 * @author Planorama Team
 */
public class OutboundEmail {

    private final String to;
    private final String subject;
    private final String html;
    private final String text;
    private final String replyTo;

    public OutboundEmail(String to, String subject, String html, String text, String replyTo) {
        this.to = to;
        this.subject = subject;
        this.html = html;
        this.text = text;
        this.replyTo = replyTo;
    }

    public OutboundEmail(String to, String subject, String html, String text) {
        this(to, subject, html, text, null);
    }

    public String getTo() {
        return to;
    }

    public String getSubject() {
        return subject;
    }

    public String getHtml() {
        return html;
    }

    public String getText() {
        return text;
    }

    public String getReplyTo() {
        return replyTo;
    }
}
