package com.planorama.rsvp.exception;

/**
 * Exception thrown when a requested resource (event, invitation, user) is not found.
 * Events owned by another organizer are reported through this exception as well.
 *
 * @author Planorama Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s not found", resourceType));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
