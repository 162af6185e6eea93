package com.jreinhal.lectern.rag.decomposition;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.lectern.constant.RagConstants;
import com.jreinhal.lectern.llm.GenerationClient;
import com.jreinhal.lectern.llm.ResponseFormat;
import com.jreinhal.lectern.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Splits a compound question into at most {@code maxSubQueries} sub-queries.
 *
 * <p>The LLM is asked first (JSON mode); when it is disabled, fails, or returns fewer
 * than two usable parts, template rules take over: comparative shapes ("compare A and
 * B", "difference between A and B", "relate A to B", "first A then B", "explain A
 * considering B", "summarize A and B") and then conjunction splits ("... and what ...").
 * The result always holds at least the original question.</p>
 */
@Component
public class QueryDecomposer {
    private static final Logger log = LoggerFactory.getLogger(QueryDecomposer.class);
    private static final String TRAILING = "\\s*[?.!]*\\s*$";

    private static final List<Template> TEMPLATES = List.of(
            new Template(Pattern.compile("(?i)^\\s*(?:please\\s+)?(?:compare|contrast)\\s+(.+?)\\s+(?:and|with|to|versus|vs\\.?)\\s+(.+?)" + TRAILING), "Explain %s"),
            new Template(Pattern.compile("(?i)\\bdifferences?\\s+between\\s+(.+?)\\s+and\\s+(.+?)" + TRAILING), "Explain %s"),
            new Template(Pattern.compile("(?i)^\\s*(?:please\\s+)?summari[sz]e\\s+(.+?)\\s+and\\s+(.+?)" + TRAILING), "Summarize %s"),
            new Template(Pattern.compile("(?i)\\brelate\\s+(.+?)\\s+to\\s+(.+?)" + TRAILING), "Explain %s"),
            new Template(Pattern.compile("(?i)^\\s*(?:how\\s+(?:does|do|did)\\s+)?(.+?)\\s+relates?\\s+to\\s+(.+?)" + TRAILING), "Explain %s"),
            new Template(Pattern.compile("(?i)\\bfirst\\s*,?\\s+(.+?)\\s*,?\\s+(?:and\\s+)?then\\s*,?\\s+(.+?)" + TRAILING), "%s"),
            new Template(Pattern.compile("(?i)^\\s*(?:please\\s+)?explain\\s+(.+?)\\s*,?\\s+considering\\s+(.+?)" + TRAILING), "Explain %s"));

    private static final List<String> COMPOUND_INDICATORS = Arrays.asList(
            " and what ", " and who ", " and where ", " and when ", " and how ", " and why ",
            " as well as ", " along with ", " in addition to ", " also tell me ", " and also ");

    private static final Pattern QUESTION_SPLIT_PATTERN = Pattern.compile(
            "(?i)\\s+and\\s+(?=what|who|where|when|how|why|tell|show|explain|describe|list)|\\?\\s+(?=\\S)|;\\s+");

    private static final Pattern LIST_SPLIT = Pattern.compile("\\s*,\\s*(?:and\\s+)?|\\s+and\\s+");
    private static final Pattern PAGE_RANGE = Pattern.compile("(?i)\\bpages?\\s+(\\d{1,4})(?:\\s*(?:-|to|\\u2013)\\s*(\\d{1,4}))?");
    private static final int MAX_PAGE_SPAN = 20;

    private static final String DECOMPOSE_PROMPT = """
            Split the user's question into independent sub-questions that can each be answered by searching their documents.
            Each sub-question must be self-contained. Use between 2 and %d sub-questions.
            Reply with JSON only: {"subQueries": ["...", "..."]}
            """;

    private final GenerationClient generationClient;
    private final ObjectMapper objectMapper;
    @Value("${lectern.decomposition.max-sub-queries:" + RagConstants.MAX_SUB_QUERIES + "}")
    private int maxSubQueries = RagConstants.MAX_SUB_QUERIES;
    @Value("${lectern.decomposition.llm-enabled:true}")
    private boolean llmEnabled = true;

    public QueryDecomposer(GenerationClient generationClient, ObjectMapper objectMapper) {
        this.generationClient = generationClient;
        this.objectMapper = objectMapper;
    }

    public List<SubQuery> decompose(String query) {
        List<String> parts = List.of();
        if (this.llmEnabled) {
            try {
                parts = this.decomposeWithLlm(query);
            }
            catch (RuntimeException e) {
                log.warn("LLM decomposition failed for {}, using templates: {}", LogSanitizer.querySummary(query), e.getMessage());
            }
        }
        if (parts.size() < 2) {
            parts = templateDecompose(query);
        }
        List<SubQuery> subQueries = new ArrayList<>();
        for (String part : bounded(parts, this.maxSubQueries)) {
            subQueries.add(SubQuery.pending(part, targetPages(part)));
        }
        if (subQueries.isEmpty()) {
            subQueries.add(SubQuery.pending(query, targetPages(query)));
        }
        log.info("Decomposed {} into {} sub-queries", LogSanitizer.querySummary(query), subQueries.size());
        return subQueries;
    }

    List<String> decomposeWithLlm(String query) {
        String raw = this.generationClient.complete(List.of(
                new SystemMessage(DECOMPOSE_PROMPT.formatted(this.maxSubQueries)),
                new UserMessage(query)), ResponseFormat.JSON);
        JsonNode node;
        try {
            int start = raw.indexOf('{');
            int end = raw.lastIndexOf('}');
            node = this.objectMapper.readTree(start >= 0 && end > start ? raw.substring(start, end + 1) : raw);
        }
        catch (Exception e) {
            log.debug("Decomposer output is not JSON: {}", e.getMessage());
            return List.of();
        }
        JsonNode array = node.path("subQueries");
        if (!array.isArray()) {
            return List.of();
        }
        List<String> parts = new ArrayList<>();
        for (JsonNode item : array) {
            if (item.isTextual() && item.asText().trim().length() > 3) {
                parts.add(cleanSubQuery(item.asText()));
            }
        }
        return parts;
    }

    static List<String> templateDecompose(String query) {
        for (Template template : TEMPLATES) {
            Matcher matcher = template.pattern().matcher(query);
            if (!matcher.find()) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (int group = 1; group <= matcher.groupCount(); ++group) {
                for (String item : LIST_SPLIT.split(matcher.group(group).trim())) {
                    if (item.length() > 1) {
                        parts.add(cleanSubQuery(template.format().formatted(item.trim())));
                    }
                }
            }
            if (parts.size() >= 2) {
                return parts;
            }
        }
        return splitCompound(query);
    }

    static List<String> splitCompound(String query) {
        List<String> parts = new ArrayList<>();
        String[] split = QUESTION_SPLIT_PATTERN.split(query);
        if (split.length > 1) {
            for (int i = 0; i < split.length; ++i) {
                String part = split[i].trim();
                if (i > 0 && !startsWithQuestionWord(part)) {
                    part = inferQuestionPrefix(part, query);
                }
                if (part.length() > 5) {
                    parts.add(cleanSubQuery(part));
                }
            }
        }
        if (parts.size() <= 1) {
            parts.clear();
            String lowerQuery = query.toLowerCase(Locale.ROOT);
            for (String indicator : COMPOUND_INDICATORS) {
                int idx = lowerQuery.indexOf(indicator);
                if (idx > 0) {
                    String first = query.substring(0, idx).trim();
                    String second = query.substring(idx + indicator.length()).trim();
                    if (first.length() > 5) {
                        parts.add(cleanSubQuery(first));
                    }
                    if (second.length() > 5) {
                        parts.add(cleanSubQuery(inferQuestionPrefix(second, query)));
                    }
                    break;
                }
            }
        }
        return parts.isEmpty() ? List.of(cleanSubQuery(query)) : parts;
    }

    /**
     * Pages named in the text: {@code page 4} or {@code pages 3-7}. Spans are capped.
     */
    static List<Integer> targetPages(String text) {
        Set<Integer> pages = new TreeSet<>();
        Matcher matcher = PAGE_RANGE.matcher(text);
        while (matcher.find()) {
            int from = Integer.parseInt(matcher.group(1));
            int to = matcher.group(2) != null ? Integer.parseInt(matcher.group(2)) : from;
            if (to < from) {
                int swap = from;
                from = to;
                to = swap;
            }
            for (int page = from; page <= Math.min(to, from + MAX_PAGE_SPAN - 1); ++page) {
                pages.add(page);
            }
        }
        return new ArrayList<>(pages);
    }

    private static List<String> bounded(List<String> parts, int max) {
        Set<String> unique = new LinkedHashSet<>();
        for (String part : parts) {
            if (unique.size() >= max) {
                break;
            }
            if (part != null && !part.isBlank()) {
                unique.add(part);
            }
        }
        return new ArrayList<>(unique);
    }

    private static String cleanSubQuery(String query) {
        String cleaned = query.replaceAll("[?.,;:!]+$", "").trim();
        if (!cleaned.isEmpty()) {
            cleaned = Character.toUpperCase(cleaned.charAt(0)) + cleaned.substring(1);
        }
        return cleaned;
    }

    private static boolean startsWithQuestionWord(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String word : List.of("what", "who", "where", "when", "how", "why", "tell", "show", "explain", "describe", "list")) {
            if (lower.startsWith(word)) {
                return true;
            }
        }
        return false;
    }

    private static String inferQuestionPrefix(String fragment, String originalQuery) {
        if (startsWithQuestionWord(fragment)) {
            return fragment;
        }
        String lower = originalQuery.toLowerCase(Locale.ROOT);
        if (lower.startsWith("what")) {
            return "What is " + fragment;
        }
        if (lower.startsWith("who")) {
            return "Who is " + fragment;
        }
        if (lower.startsWith("tell me about")) {
            return "Tell me about " + fragment;
        }
        return fragment;
    }

    private record Template(Pattern pattern, String format) {
    }
}
