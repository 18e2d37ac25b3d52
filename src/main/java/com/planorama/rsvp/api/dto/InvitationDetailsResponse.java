package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.service.result.InvitationDetails;

/**
 * Response DTO for the page behind an invitation link: the event with host contact details
 * and who the invitation was sent to.
 *
 * @author Planorama Team
 */
public class InvitationDetailsResponse {

    private EventResponse event;
    private Invitee token;

    public InvitationDetailsResponse() {
    }

    public static InvitationDetailsResponse fromDetails(InvitationDetails details) {
        InvitationDetailsResponse response = new InvitationDetailsResponse();
        EventResponse event = EventResponse.publicView(details.getEvent());
        // Invited guests may call the host
        event.setHostMobile(details.getEvent().getHostMobile());
        response.setEvent(event);
        response.setToken(new Invitee(details.getToken().getEmail(), details.getToken().getName()));
        return response;
    }

    // Getters and setters
    public EventResponse getEvent() {
        return event;
    }

    public void setEvent(EventResponse event) {
        this.event = event;
    }

    public Invitee getToken() {
        return token;
    }

    public void setToken(Invitee token) {
        this.token = token;
    }

    public static class Invitee {

        private String email;
        private String name;

        public Invitee() {
        }

        public Invitee(String email, String name) {
            this.email = email;
            this.name = name;
        }

        public String getEmail() {
            return email;
        }

        public String getName() {
            return name;
        }
    }
}
