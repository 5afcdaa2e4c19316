package com.questrail.matchsync.prefs;

/**
 * The preference file could not be read or written.
 */
public final class PreferenceStoreException extends RuntimeException
{
    public PreferenceStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
