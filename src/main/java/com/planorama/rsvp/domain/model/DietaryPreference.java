package com.planorama.rsvp.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Meal preference of an attendee or their companions. Absent means "not specified".
 *
 * @author Planorama Team
 */
public enum DietaryPreference {

    NONVEG("nonveg"),
    VEG("veg"),
    VEGAN("vegan");

    private final String value;

    DietaryPreference(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DietaryPreference fromValue(String value) {
        for (DietaryPreference preference : values()) {
            if (preference.value.equalsIgnoreCase(value)) {
                return preference;
            }
        }
        throw new IllegalArgumentException("Unknown dietary preference: " + value);
    }
}
