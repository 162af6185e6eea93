package com.jreinhal.lectern.util;

import com.jreinhal.lectern.constant.RagConstants;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Post-processing for generated answers.
 */
public final class AnswerText {
    private static final Pattern THINK_BLOCK = Pattern.compile("(?is)<think>.*?</think>");
    private static final Pattern UNCLOSED_THINK = Pattern.compile("(?is)^\\s*<think>.*");
    private static final List<Pattern> INTERMEDIATE_PREFIXES = List.of(
            Pattern.compile("(?i)^\\s*(let me|i'll|i will|allow me to)\\s+(search|look|check|find|analy[sz]e|review)[^.\\n]*[.:!]?\\s*"),
            Pattern.compile("(?i)^\\s*(searching|looking|checking)\\s+(the|your|through)[^.\\n]*(\\.\\.\\.|[.:!])\\s*"),
            Pattern.compile("(?i)^\\s*based on my search[,:]?\\s*"));
    private static final Pattern WORD_WITH_TRAILING_SPACE = Pattern.compile("\\S+\\s*");

    private AnswerText() {
    }

    public static String clean(String raw) {
        if (raw == null) {
            return "";
        }
        String text = THINK_BLOCK.matcher(raw).replaceAll("");
        if (UNCLOSED_THINK.matcher(text).matches()) {
            text = "";
        }
        boolean changed = true;
        while (changed) {
            changed = false;
            for (Pattern prefix : INTERMEDIATE_PREFIXES) {
                String stripped = prefix.matcher(text).replaceFirst("");
                if (!stripped.equals(text)) {
                    text = stripped;
                    changed = true;
                }
            }
        }
        return text.trim();
    }

    public static boolean isNotFoundInDocument(String answer) {
        if (answer == null || answer.isBlank()) {
            return false;
        }
        for (Pattern pattern : RagConstants.NOT_FOUND_PATTERNS) {
            if (pattern.matcher(answer).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Splits text into runs of {@code wordsPerChunk} words, keeping the whitespace that
     * follows each word, so that concatenating the chunks restores the text.
     */
    public static List<String> wordChunks(String text, int wordsPerChunk) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        int size = Math.max(1, wordsPerChunk);
        List<String> chunks = new ArrayList<>();
        Matcher matcher = WORD_WITH_TRAILING_SPACE.matcher(text.strip());
        StringBuilder current = new StringBuilder();
        int words = 0;
        while (matcher.find()) {
            current.append(matcher.group());
            if (++words == size) {
                chunks.add(current.toString());
                current.setLength(0);
                words = 0;
            }
        }
        if (current.length() > 0) {
            chunks.add(current.toString());
        }
        return chunks;
    }
}
