package com.jreinhal.lectern.service;

import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed requests before they reach the pipeline and normalizes the query
 * text: tags stripped, whitespace collapsed.
 */
@Component
public class QueryValidator {
    private static final Pattern HTML_TAG = Pattern.compile("<[^>]*>");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int MIN_QUERY_LENGTH = 2;
    private static final int MAX_ID_LENGTH = 128;
    @Value("${lectern.query.max-length:2000}")
    private int maxQueryLength = 2000;

    public Validation validate(String query, String userId, String sessionId) {
        if (userId == null || userId.isBlank()) {
            return Validation.rejected("userId is required");
        }
        if (sessionId == null || sessionId.isBlank()) {
            return Validation.rejected("sessionId is required");
        }
        if (userId.length() > MAX_ID_LENGTH || sessionId.length() > MAX_ID_LENGTH) {
            return Validation.rejected("userId and sessionId must be at most " + MAX_ID_LENGTH + " characters");
        }
        if (query == null || query.isBlank()) {
            return Validation.rejected("query is required");
        }
        String sanitized = sanitize(query);
        if (sanitized.length() < MIN_QUERY_LENGTH) {
            return Validation.rejected("query must be at least " + MIN_QUERY_LENGTH + " characters");
        }
        if (sanitized.length() > this.maxQueryLength) {
            return Validation.rejected("query must be at most " + this.maxQueryLength + " characters");
        }
        return Validation.accepted(sanitized);
    }

    static String sanitize(String query) {
        String withoutTags = HTML_TAG.matcher(query).replaceAll(" ");
        return WHITESPACE.matcher(withoutTags).replaceAll(" ").trim();
    }

    public record Validation(boolean valid, String query, String error) {
        static Validation accepted(String query) {
            return new Validation(true, query, null);
        }

        static Validation rejected(String error) {
            return new Validation(false, null, error);
        }
    }
}
