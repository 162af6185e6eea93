package com.jreinhal.lectern.rag.classifier;

/**
 * @param route   where the query goes next
 * @param reason  short human-readable explanation, surfaced in the answer's reasoning
 * @param source  which tier decided: {@code lexical}, {@code rule} or {@code llm}
 */
public record QueryClassification(QueryRoute route, String reason, String source) {
    public static final String SOURCE_LEXICAL = "lexical";
    public static final String SOURCE_RULE = "rule";
    public static final String SOURCE_LLM = "llm";

    public boolean needsRetrieval() {
        return this.route == QueryRoute.RAG;
    }
}
