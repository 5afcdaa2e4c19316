package com.questrail.matchsync.cloud;

import java.util.Optional;

/**
 * An {@link AccountSession} whose values never change.
 *
 * @param userId signed-in user, or {@code null} when signed out
 * @param token  bearer token, or {@code null}
 */
public record FixedAccountSession(String userId, String token) implements AccountSession
{
    public static FixedAccountSession signedIn(String userId, String accessToken) {
        return new FixedAccountSession(userId, accessToken);
    }

    public static FixedAccountSession signedOut() {
        return new FixedAccountSession(null, null);
    }

    @Override
    public Optional<String> currentUserId() {
        return Optional.ofNullable(userId);
    }

    @Override
    public Optional<String> accessToken() {
        return Optional.ofNullable(token);
    }
}
