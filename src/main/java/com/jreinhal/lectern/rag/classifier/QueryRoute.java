package com.jreinhal.lectern.rag.classifier;

import java.util.Locale;
import java.util.Optional;

/**
 * How a query leaves the classifier.
 */
public enum QueryRoute {
    /**
     * Greeting, thanks or farewell. Answered with a canned reply, no external call.
     */
    GREETING,

    /**
     * Needs no document context: questions about the assistant itself, or any
     * question in a session without documents.
     */
    SIMPLE,

    /**
     * Answered from the session's documents.
     */
    RAG;

    /**
     * Strict parse of an externally produced label; anything outside the three values is empty.
     */
    public static Optional<QueryRoute> parse(String label) {
        if (label == null) {
            return Optional.empty();
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT);
        for (QueryRoute route : values()) {
            if (route.name().equals(normalized)) {
                return Optional.of(route);
            }
        }
        return Optional.empty();
    }
}
