package com.planorama.rsvp.api.dto;

import com.planorama.rsvp.service.result.DietaryStatistics;

/**
 * Response DTO for dietary head counts of an event.
 *
 * @author Planorama Team
 */
public class DietaryStatsResponse {

    private int nonveg;
    private int veg;
    private int vegan;
    private int notSpecified;

    public DietaryStatsResponse() {
    }

    public static DietaryStatsResponse fromStatistics(DietaryStatistics statistics) {
        DietaryStatsResponse response = new DietaryStatsResponse();
        response.setNonveg(statistics.getNonveg());
        response.setVeg(statistics.getVeg());
        response.setVegan(statistics.getVegan());
        response.setNotSpecified(statistics.getNotSpecified());
        return response;
    }

    // Getters and setters
    public int getNonveg() {
        return nonveg;
    }

    public void setNonveg(int nonveg) {
        this.nonveg = nonveg;
    }

    public int getVeg() {
        return veg;
    }

    public void setVeg(int veg) {
        this.veg = veg;
    }

    public int getVegan() {
        return vegan;
    }

    public void setVegan(int vegan) {
        this.vegan = vegan;
    }

    public int getNotSpecified() {
        return notSpecified;
    }

    public void setNotSpecified(int notSpecified) {
        this.notSpecified = notSpecified;
    }
}
