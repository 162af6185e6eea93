package com.jreinhal.lectern.exception;

public class EmbeddingFailureException extends RuntimeException {
    public EmbeddingFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
