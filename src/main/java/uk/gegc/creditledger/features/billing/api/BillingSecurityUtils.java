package uk.gegc.creditledger.features.billing.api;

import org.springframework.security.core.Authentication;

import java.util.UUID;

/**
 * Resolves the calling user from the authenticated principal. Bearer tokens carry the user id as subject.
 */
public final class BillingSecurityUtils {

    private BillingSecurityUtils() {
    }

    /**
     * @throws IllegalStateException if no user is authenticated or the principal is not a user id
     */
    public static UUID requireUserId(Authentication authentication) {
        if (authentication == null || !authentication.isAuthenticated()) {
            throw new IllegalStateException("No authenticated user found");
        }
        String userIdStr = authentication.getName();
        if (userIdStr == null || userIdStr.isEmpty()) {
            throw new IllegalStateException("User ID not found in authentication");
        }
        try {
            return UUID.fromString(userIdStr);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid user ID format in authentication: " + userIdStr, e);
        }
    }
}
