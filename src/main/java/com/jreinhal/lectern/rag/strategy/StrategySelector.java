package com.jreinhal.lectern.rag.strategy;

import com.jreinhal.lectern.constant.RagConstants;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Picks the answer strategy from corpus size and query shape:
 * <ol>
 * <li>small corpus and a plain question: {@link Strategy#FULL_DOCUMENT}</li>
 * <li>a compound question (compare, difference between, relate, first/then...): {@link Strategy#AGENTIC_DECOMPOSITION}</li>
 * <li>otherwise {@link Strategy#SMART_CHUNKING}</li>
 * </ol>
 */
@Service
public class StrategySelector {
    @Value("${lectern.strategy.full-document-page-ceiling:" + RagConstants.FULL_DOCUMENT_PAGE_CEILING + "}")
    private int fullDocumentPageCeiling = RagConstants.FULL_DOCUMENT_PAGE_CEILING;

    public Strategy selectStrategy(int totalPagesInScope, String queryText) {
        boolean complex = this.isComplex(queryText);
        if (this.fullDocumentAllowed(totalPagesInScope) && !complex) {
            return Strategy.FULL_DOCUMENT;
        }
        if (complex) {
            return Strategy.AGENTIC_DECOMPOSITION;
        }
        return Strategy.SMART_CHUNKING;
    }

    public boolean isComplex(String queryText) {
        if (queryText == null || queryText.isBlank()) {
            return false;
        }
        for (Pattern pattern : RagConstants.COMPLEX_PATTERNS) {
            if (pattern.matcher(queryText).find()) {
                return true;
            }
        }
        return false;
    }

    public boolean fullDocumentAllowed(int totalPagesInScope) {
        return totalPagesInScope > 0 && totalPagesInScope <= this.fullDocumentPageCeiling;
    }
}
