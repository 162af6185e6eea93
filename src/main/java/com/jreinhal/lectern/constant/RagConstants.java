package com.jreinhal.lectern.constant;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Fixed texts, patterns and defaults shared across the answer pipeline.
 *
 * <p>Retrieval defaults: {@link #DEFAULT_TOP_K} nearest neighbours, filtered at
 * {@link #DEFAULT_SIMILARITY_THRESHOLD}; both are overridable through
 * {@code lectern.retrieval.*}.</p>
 */
public final class RagConstants {
    public static final int DEFAULT_TOP_K = 8;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.4;
    public static final int DEFAULT_SUB_QUERY_TOP_K = 5;
    public static final int DEFAULT_RERANK_LIMIT = 3;
    public static final int DEFAULT_CONTEXT_CHUNKS = 5;
    public static final int DEFAULT_CONTEXT_CHARS = 12000;
    public static final int DEFAULT_MAX_CITATIONS = 3;
    public static final int DEFAULT_SNIPPET_LENGTH = 100;
    public static final int FULL_DOCUMENT_PAGE_CEILING = 50;
    public static final int MAX_SUB_QUERIES = 5;
    public static final int SUB_QUERY_BATCH_SIZE = 2;
    public static final double DOMINANT_FILE_RATIO = 0.6;

    public static final String CONTEXT_SEPARATOR = "\n\n---\n\n";
    public static final String DOCUMENT_BREAK = "\n\n=== DOCUMENT BREAK ===\n\n";

    public static final String UPLOAD_PROMPT_MESSAGE =
            "Please upload some documents first, then ask me questions about them.";
    public static final String NO_RELEVANT_INFO_MESSAGE =
            "I couldn't find relevant information in your documents. Try rephrasing your question.";
    public static final String APOLOGY_MESSAGE =
            "I'm sorry, I ran into a problem while answering your question. Please try again in a moment.";
    public static final String SERVICE_UNAVAILABLE_MESSAGE =
            "The document service is temporarily unavailable. Please try again shortly.";
    public static final String SUB_QUERY_FAILED_PLACEHOLDER =
            "Unable to retrieve this part of the answer.";
    public static final String SUB_QUERY_EMPTY_PLACEHOLDER =
            "No relevant information was found in the documents for this part.";
    public static final String SIMPLE_FALLBACK_MESSAGE =
            "I answer questions about the documents you upload to this conversation. "
            + "Upload a PDF or image and ask me anything about it.";

    public static final String GREETING_REPLY =
            "Hello! Upload a document or ask me a question about the ones you've shared.";
    public static final String THANKS_REPLY =
            "You're welcome! Let me know if you have more questions about your documents.";
    public static final String FAREWELL_REPLY =
            "Goodbye! Your documents will be here when you come back.";

    public static final List<String> GREETING_PREFIXES = List.of(
            "hi", "hello", "hey", "namaste", "good morning", "good afternoon", "good evening");
    public static final List<String> THANKS_PREFIXES = List.of("thanks", "thank you");
    public static final List<String> FAREWELL_PREFIXES = List.of("bye", "goodbye", "see you");

    public static final List<Pattern> META_PATTERNS = List.of(
            Pattern.compile("^who are you", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^what can you do", Pattern.CASE_INSENSITIVE),
            Pattern.compile("^help$", Pattern.CASE_INSENSITIVE));

    public static final List<Pattern> COMPLEX_PATTERNS = List.of(
            Pattern.compile("\\bcompare\\b.*\\band\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bdifference\\s+between\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bsummari[sz]e\\b.*\\band\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\brelate\\b.*\\bto\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bfirst\\b.*\\bthen\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bexplain\\b.*\\bconsidering\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bcontrast\\b", Pattern.CASE_INSENSITIVE));

    public static final List<Pattern> NOT_FOUND_PATTERNS = List.of(
            Pattern.compile("(?i)\\b(not|isn't|is not)\\s+(found|mentioned|covered|present|available)\\s+in\\s+(the|your|this)\\s+(document|documents|pdf|text)"),
            Pattern.compile("(?i)\\b(document|documents|pdf|text)\\s+(does not|doesn't|do not|don't)\\s+(contain|mention|cover|include|discuss)"),
            Pattern.compile("(?i)\\bno (relevant )?information (about|on|regarding) .{0,80}\\b(in|within) (the|your) (document|documents|pdf)"),
            Pattern.compile("(?i)\\bi couldn't find relevant information"));

    private RagConstants() {
    }
}
