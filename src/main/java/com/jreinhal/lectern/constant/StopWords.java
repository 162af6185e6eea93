package com.jreinhal.lectern.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> RERANKER = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "what", "where",
            "when", "who", "how", "why", "which", "and", "or", "but", "in",
            "on", "at", "to", "for", "of", "with", "this", "that", "does",
            "do", "did", "me", "about", "tell", "explain", "describe");

    private StopWords() {
    }
}
