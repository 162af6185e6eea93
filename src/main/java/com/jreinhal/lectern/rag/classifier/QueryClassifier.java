package com.jreinhal.lectern.rag.classifier;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.llm.GenerationClient;
import com.jreinhal.lectern.llm.ResponseFormat;
import com.jreinhal.lectern.model.ChatMessage;
import com.jreinhal.lectern.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Decides whether a query needs retrieval at all.
 *
 * <p>Tier one is a lexical check against the greeting, thanks and farewell lexicon
 * plus a handful of questions about the assistant itself; it never calls out. Tier two
 * is the document rule: RAG when the session has documents, SIMPLE otherwise. When
 * {@code lectern.classifier.llm-enabled} is set, an LLM may refine the tier-two
 * decision; its JSON answer is validated against {@link QueryRoute} and any failure
 * keeps the rule result. {@link #classify} never throws.</p>
 */
@Service
public class QueryClassifier {
    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);
    private static final Pattern LEADING_NOISE = Pattern.compile("^[\\s\\p{Punct}]+");
    private static final Pattern TRAILING_NOISE = Pattern.compile("[\\s\\p{Punct}]+$");
    private static final int HISTORY_FOR_LLM = 4;
    private static final String CLASSIFIER_PROMPT = """
            You route messages for an assistant that answers questions about documents the user uploaded.
            Classify the latest user message as exactly one of:
            GREETING - a greeting, thanks or goodbye with no question
            SIMPLE - small talk or a question about the assistant itself, answerable without the documents
            RAG - anything that should be answered from the uploaded documents
            Reply with JSON only: {"type": "GREETING|SIMPLE|RAG", "reason": "<one short sentence>"}
            """;

    private final GenerationClient generationClient;
    private final ObjectMapper objectMapper;
    @Value("${lectern.classifier.llm-enabled:false}")
    private boolean llmEnabled;

    public QueryClassifier(GenerationClient generationClient, ObjectMapper objectMapper) {
        this.generationClient = generationClient;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        log.info("Query classifier initialized (llmEnabled={})", this.llmEnabled);
    }

    public QueryClassification classify(String query, boolean hasDocuments, List<ChatMessage> recentHistory) {
        String normalized = normalize(query);
        if (matchesLexicon(normalized)) {
            return new QueryClassification(QueryRoute.GREETING, "Greeting or courtesy phrase", QueryClassification.SOURCE_LEXICAL);
        }
        if (this.isMetaQuestion(normalized)) {
            return new QueryClassification(QueryRoute.SIMPLE, "Question about the assistant", QueryClassification.SOURCE_LEXICAL);
        }
        QueryClassification rule = hasDocuments
                ? new QueryClassification(QueryRoute.RAG, "Session has documents", QueryClassification.SOURCE_RULE)
                : new QueryClassification(QueryRoute.SIMPLE, "Session has no documents", QueryClassification.SOURCE_RULE);
        if (!this.llmEnabled || !hasDocuments) {
            return rule;
        }
        try {
            return this.classifyWithLlm(query, recentHistory).orElse(rule);
        }
        catch (RuntimeException e) {
            log.warn("LLM classification failed for {}, keeping rule route {}: {}", LogSanitizer.querySummary(query), rule.route(), e.getMessage());
            return rule;
        }
    }

    public boolean isMetaQuestion(String query) {
        String normalized = normalize(query);
        for (Pattern pattern : RagConstants.META_PATTERNS) {
            if (pattern.matcher(normalized).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Canned reply for a GREETING route.
     */
    public String greetingReply(String query) {
        String normalized = normalize(query);
        if (startsWithAny(normalized, RagConstants.THANKS_PREFIXES)) {
            return RagConstants.THANKS_REPLY;
        }
        if (startsWithAny(normalized, RagConstants.FAREWELL_PREFIXES)) {
            return RagConstants.FAREWELL_REPLY;
        }
        return RagConstants.GREETING_REPLY;
    }

    Optional<QueryClassification> classifyWithLlm(String query, List<ChatMessage> recentHistory) {
        List<Message> messages = new ArrayList<>();
        messages.add(new SystemMessage(CLASSIFIER_PROMPT));
        StringBuilder user = new StringBuilder();
        List<ChatMessage> history = recentHistory != null ? recentHistory : List.of();
        if (!history.isEmpty()) {
            user.append("Recent conversation:\n");
            for (ChatMessage message : history.subList(Math.max(0, history.size() - HISTORY_FOR_LLM), history.size())) {
                user.append(message.role()).append(": ").append(abbreviate(message.content(), 200)).append('\n');
            }
            user.append('\n');
        }
        user.append("Latest message: ").append(query);
        messages.add(new UserMessage(user.toString()));
        String raw = this.generationClient.complete(messages, ResponseFormat.JSON);
        return this.parse(raw);
    }

    Optional<QueryClassification> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        JsonNode node;
        try {
            node = this.objectMapper.readTree(extractJsonObject(raw));
        }
        catch (Exception e) {
            log.debug("Classifier output is not JSON: {}", e.getMessage());
            return Optional.empty();
        }
        if (node == null || !node.isObject()) {
            return Optional.empty();
        }
        Optional<QueryRoute> route = QueryRoute.parse(node.path("type").asText(null));
        if (route.isEmpty()) {
            log.debug("Classifier returned an unknown route");
            return Optional.empty();
        }
        String reason = node.path("reason").asText("");
        return Optional.of(new QueryClassification(route.get(), reason.isBlank() ? "LLM classification" : abbreviate(reason, 200), QueryClassification.SOURCE_LLM));
    }

    private static boolean matchesLexicon(String normalized) {
        return startsWithAny(normalized, RagConstants.GREETING_PREFIXES)
                || startsWithAny(normalized, RagConstants.THANKS_PREFIXES)
                || startsWithAny(normalized, RagConstants.FAREWELL_PREFIXES);
    }

    /**
     * Prefix match on a word boundary, so "hi there" matches "hi" but "history" does not.
     */
    static boolean startsWithAny(String normalized, List<String> prefixes) {
        for (String prefix : prefixes) {
            if (normalized.startsWith(prefix)
                    && (normalized.length() == prefix.length() || !Character.isLetterOrDigit(normalized.charAt(prefix.length())))) {
                return true;
            }
        }
        return false;
    }

    static String normalize(String query) {
        if (query == null) {
            return "";
        }
        String lower = LEADING_NOISE.matcher(query.trim().toLowerCase(Locale.ROOT)).replaceFirst("");
        return TRAILING_NOISE.matcher(lower).replaceFirst("");
    }

    private static String extractJsonObject(String raw) {
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        return start >= 0 && end > start ? raw.substring(start, end + 1) : raw;
    }

    private static String abbreviate(String text, int max) {
        if (text == null) {
            return "";
        }
        return text.length() <= max ? text : text.substring(0, max) + "...";
    }
}
