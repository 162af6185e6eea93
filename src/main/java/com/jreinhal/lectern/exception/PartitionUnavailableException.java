package com.jreinhal.lectern.exception;

/**
 * The session partition could not be created or resolved. Fatal for the request:
 * without a partition there is no isolation guarantee.
 */
public class PartitionUnavailableException extends RuntimeException {
    private final String userId;
    private final String sessionId;

    public PartitionUnavailableException(String userId, String sessionId, Throwable cause) {
        super("Retrieval partition unavailable for session", cause);
        this.userId = userId;
        this.sessionId = sessionId;
    }

    public String getUserId() {
        return this.userId;
    }

    public String getSessionId() {
        return this.sessionId;
    }
}
