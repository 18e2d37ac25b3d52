package com.planorama.rsvp.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Attendance response. Serialized as the lowercase wire value ("going", "maybe", "not-going").
 *
 * Only GOING contributes to capacity accounting and dietary statistics.
 *
 * @author Planorama Team
 */
public enum RsvpStatus {

    GOING("going"),

    /**
     * Only available on the account path; guests responding through a token must commit.
     */
    MAYBE("maybe"),

    NOT_GOING("not-going");

    private final String value;

    RsvpStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RsvpStatus fromValue(String value) {
        for (RsvpStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown RSVP status: " + value);
    }
}
