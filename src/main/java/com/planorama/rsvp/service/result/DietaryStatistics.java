package com.planorama.rsvp.service.result;

import com.planorama.rsvp.domain.model.DietaryPreference;

/**
 * Head counts per dietary bucket for the attendees of one event.
 *
 * @author Planorama Team
 */
public class DietaryStatistics {

    private int nonveg;
    private int veg;
    private int vegan;
    private int notSpecified;

    /**
     * Count one person in the bucket of their preference; null counts as not specified.
     */
    public void count(DietaryPreference preference) {
        if (preference == null) {
            notSpecified++;
            return;
        }
        switch (preference) {
            case NONVEG:
                nonveg++;
                break;
            case VEG:
                veg++;
                break;
            case VEGAN:
                vegan++;
                break;
            default:
                notSpecified++;
        }
    }

    public int getNonveg() {
        return nonveg;
    }

    public int getVeg() {
        return veg;
    }

    public int getVegan() {
        return vegan;
    }

    public int getNotSpecified() {
        return notSpecified;
    }

    public int getTotal() {
        return nonveg + veg + vegan + notSpecified;
    }
}
