package com.questrail.matchsync.config;

/**
 * Configuration could not be read or is invalid.
 */
public class MatchSyncConfigException extends RuntimeException
{
    public MatchSyncConfigException(String message) {
        super(message);
    }

    public MatchSyncConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
