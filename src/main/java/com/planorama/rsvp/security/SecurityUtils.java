package com.planorama.rsvp.security;

import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Utility class for extracting the caller's identity.
 *
 * @author Planorama Team
 */
public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Get the currently authenticated user ID.
     *
     * @return User ID from authentication context, or null if not authenticated
     */
    public static String getCurrentUserId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication != null && authentication.isAuthenticated()) {
            return authentication.getName();
        }

        return null;
    }

    /**
     * Get the currently authenticated user ID, failing if there is none.
     *
     * @return User ID
     * @throws AccessDeniedException if the request is unauthenticated
     */
    public static String requireCurrentUserId() {
        String userId = getCurrentUserId();
        if (userId == null) {
            throw new AccessDeniedException("User not authenticated");
        }
        return userId;
    }
}
