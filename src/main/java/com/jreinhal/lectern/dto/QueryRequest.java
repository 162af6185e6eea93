package com.jreinhal.lectern.dto;

import java.util.List;

/**
 * @param mentionedFileIds optional; restricts retrieval to these files of the session
 */
public record QueryRequest(String query, String userId, String sessionId, List<String> mentionedFileIds) {

    public QueryRequest {
        mentionedFileIds = mentionedFileIds != null ? List.copyOf(mentionedFileIds) : List.of();
    }

    public QueryRequest(String query, String userId, String sessionId) {
        this(query, userId, sessionId, List.of());
    }
}
