package com.jreinhal.lectern.config;

import com.jreinhal.lectern.rag.rerank.LexicalOverlapReranker;
import com.jreinhal.lectern.rag.rerank.Reranker;
import com.jreinhal.lectern.rag.rerank.ScoreOrderReranker;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RerankerConfig {
    private static final Logger log = LoggerFactory.getLogger(RerankerConfig.class);

    @Bean
    public Reranker reranker(
            @Value("${lectern.rerank.mode:score}") String mode,
            @Value("${lectern.rerank.lexical-weight:0.3}") double lexicalWeight) {
        if ("lexical".equals(mode.trim().toLowerCase(Locale.ROOT))) {
            log.info("Reranker: lexical overlap (weight={})", lexicalWeight);
            return new LexicalOverlapReranker(lexicalWeight);
        }
        log.info("Reranker: score order");
        return new ScoreOrderReranker();
    }
}
