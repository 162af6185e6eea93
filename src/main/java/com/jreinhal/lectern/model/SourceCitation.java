package com.jreinhal.lectern.model;

/**
 * A (file, page, snippet) tuple justifying part of an answer. Only ever stored
 * inside the assistant message it belongs to.
 */
public record SourceCitation(String fileName, int pageNo, String snippet) {
}
