package com.questrail.matchsync.cloud;

import java.util.Optional;

/**
 * The signed-in backend account, if any. Authentication itself happens
 * elsewhere; the sync core only reads the result.
 */
public interface AccountSession
{
    Optional<String> currentUserId();

    /**
     * Bearer token for backend calls made on behalf of the user.
     */
    Optional<String> accessToken();

    default boolean isAuthenticated() {
        return currentUserId().isPresent();
    }
}
