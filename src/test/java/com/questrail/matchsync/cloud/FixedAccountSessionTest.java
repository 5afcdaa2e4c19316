package com.questrail.matchsync.cloud;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FixedAccountSessionTest {

    @Test
    void signedInSessionExposesUserAndToken() {
        AccountSession session = FixedAccountSession.signedIn("user-1", "token-1");

        assertTrue(session.isAuthenticated());
        assertEquals(Optional.of("user-1"), session.currentUserId());
        assertEquals(Optional.of("token-1"), session.accessToken());
    }

    @Test
    void signedOutSessionHasNeitherUserNorToken() {
        AccountSession session = FixedAccountSession.signedOut();

        assertFalse(session.isAuthenticated());
        assertTrue(session.currentUserId().isEmpty());
        assertTrue(session.accessToken().isEmpty());
    }

    @Test
    void tokenIsOptionalForASignedInUser() {
        FixedAccountSession session = new FixedAccountSession("user-1", null);

        assertTrue(session.isAuthenticated());
        assertTrue(session.accessToken().isEmpty());
        assertNull(session.token());
    }
}
