package com.planorama.rsvp.infrastructure.messaging.events;

import com.planorama.rsvp.domain.model.InvitationToken;
import com.planorama.rsvp.domain.model.Rsvp;

import java.time.Instant;

/**
 * Domain event published whenever an invitation is issued or a response is recorded.
 * Keyed by event ID so all changes to one event stay ordered on one partition.
 *
 * @author Planorama Team
 */
public class RsvpDomainEvent {

    private EventType eventType;
    private String eventId;
    private String rsvpId;
    private String tokenId;
    private String userId;
    private String status;
    private Integer companions;
    private String inviteeEmail;
    private Instant timestamp;

    /**
     * Default constructor for deserialization.
     */
    public RsvpDomainEvent() {
    }

    private RsvpDomainEvent(EventType eventType, String eventId) {
        this.eventType = eventType;
        this.eventId = eventId;
        this.timestamp = Instant.now();
    }

    public static RsvpDomainEvent tokenRsvpCreated(Rsvp rsvp) {
        RsvpDomainEvent event = fromRsvp(EventType.TOKEN_RSVP_CREATED, rsvp);
        event.inviteeEmail = rsvp.getGuestEmail();
        return event;
    }

    public static RsvpDomainEvent userRsvpUpserted(Rsvp rsvp) {
        return fromRsvp(EventType.USER_RSVP_UPSERTED, rsvp);
    }

    public static RsvpDomainEvent invitationCreated(InvitationToken token) {
        RsvpDomainEvent event = new RsvpDomainEvent(EventType.INVITATION_CREATED, token.getEventId());
        event.tokenId = token.getTokenId();
        event.userId = token.getInviteeUserId();
        event.inviteeEmail = token.getEmail();
        return event;
    }

    private static RsvpDomainEvent fromRsvp(EventType type, Rsvp rsvp) {
        RsvpDomainEvent event = new RsvpDomainEvent(type, rsvp.getEventId());
        event.rsvpId = rsvp.getRsvpId();
        event.tokenId = rsvp.getTokenId();
        event.userId = rsvp.getUserId();
        event.status = rsvp.getStatus().getValue();
        event.companions = rsvp.getCompanions();
        return event;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getEventId() {
        return eventId;
    }

    public void setEventId(String eventId) {
        this.eventId = eventId;
    }

    public String getRsvpId() {
        return rsvpId;
    }

    public void setRsvpId(String rsvpId) {
        this.rsvpId = rsvpId;
    }

    public String getTokenId() {
        return tokenId;
    }

    public void setTokenId(String tokenId) {
        this.tokenId = tokenId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Integer getCompanions() {
        return companions;
    }

    public void setCompanions(Integer companions) {
        this.companions = companions;
    }

    public String getInviteeEmail() {
        return inviteeEmail;
    }

    public void setInviteeEmail(String inviteeEmail) {
        this.inviteeEmail = inviteeEmail;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public enum EventType {
        INVITATION_CREATED,
        TOKEN_RSVP_CREATED,
        USER_RSVP_UPSERTED
    }
}
