package com.jreinhal.lectern.rag.rerank;

import com.jreinhal.lectern.constant.StopWords;
import com.jreinhal.lectern.rag.retrieval.RetrievalCandidate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Blends the vector score with the share of query terms that occur in the chunk:
 * {@code combined = (1 - w) * score + w * overlap}. Ties keep the vector order.
 */
public class LexicalOverlapReranker implements Reranker {
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{Nd}]+");
    private final double lexicalWeight;

    public LexicalOverlapReranker(double lexicalWeight) {
        if (lexicalWeight < 0.0 || lexicalWeight > 1.0) {
            throw new IllegalArgumentException("lexicalWeight must be within [0, 1]");
        }
        this.lexicalWeight = lexicalWeight;
    }

    @Override
    public List<RetrievalCandidate> rerank(String query, List<RetrievalCandidate> candidates, int limit) {
        if (candidates == null || candidates.isEmpty() || limit <= 0) {
            return List.of();
        }
        Set<String> queryTerms = terms(query);
        List<Ranked> ranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); ++i) {
            RetrievalCandidate candidate = candidates.get(i);
            double overlap = overlap(queryTerms, candidate.chunk().content());
            double combined = (1.0 - this.lexicalWeight) * candidate.score() + this.lexicalWeight * overlap;
            ranked.add(new Ranked(candidate, combined, i));
        }
        ranked.sort(Comparator.comparingDouble(Ranked::combined).reversed().thenComparingInt(Ranked::position));
        List<RetrievalCandidate> result = new ArrayList<>(Math.min(limit, ranked.size()));
        for (Ranked r : ranked) {
            if (result.size() >= limit) {
                break;
            }
            result.add(r.candidate());
        }
        return result;
    }

    public static double overlap(Set<String> queryTerms, String content) {
        if (queryTerms.isEmpty() || content == null || content.isEmpty()) {
            return 0.0;
        }
        Set<String> contentTerms = terms(content);
        long hits = queryTerms.stream().filter(contentTerms::contains).count();
        return (double) hits / queryTerms.size();
    }

    public static Set<String> terms(String text) {
        Set<String> terms = new HashSet<>();
        if (text == null) {
            return terms;
        }
        for (String token : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() > 2 && !StopWords.RERANKER.contains(token)) {
                terms.add(token);
            }
        }
        return terms;
    }

    private record Ranked(RetrievalCandidate candidate, double combined, int position) {
    }
}
