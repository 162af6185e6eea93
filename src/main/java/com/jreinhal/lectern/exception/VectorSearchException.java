package com.jreinhal.lectern.exception;

public class VectorSearchException extends RuntimeException {
    private final String partitionId;

    public VectorSearchException(String partitionId, String message, Throwable cause) {
        super(message, cause);
        this.partitionId = partitionId;
    }

    public String getPartitionId() {
        return this.partitionId;
    }
}
