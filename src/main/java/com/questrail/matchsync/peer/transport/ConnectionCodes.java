package com.questrail.matchsync.peer.transport;

import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * Human-typeable connection codes.
 *
 * <p>The alphabet leaves out characters that are easy to confuse when read
 * aloud or copied by hand ({@code 0/O}, {@code 1/I}).</p>
 */
public final class ConnectionCodes
{
    public static final String ALPHABET = "ABCDEFGHJKLMNPQRSTUVWXYZ23456789";
    public static final int LENGTH = 6;

    private ConnectionCodes() {}

    public static String generate(Random random) {
        Objects.requireNonNull(random, "random");
        StringBuilder sb = new StringBuilder(LENGTH);
        for (int i = 0; i < LENGTH; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }

    /**
     * Trim and upper-case a code typed by the user.
     *
     * @throws IllegalArgumentException if the code is blank
     */
    public static String normalize(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Connection code is required");
        }
        return code.trim().toUpperCase(Locale.ROOT);
    }
}
