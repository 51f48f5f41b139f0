package com.jreinhal.veritas.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.veritas.llm.LlmRateLimiter;
import com.jreinhal.veritas.rag.fusion.EmbeddingSimilarityScorer;
import com.jreinhal.veritas.rag.fusion.LexicalSimilarityScorer;
import com.jreinhal.veritas.rag.fusion.SimilarityScorer;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FusionConfig {
    private static final Logger log = LoggerFactory.getLogger(FusionConfig.class);

    @Bean
    public Cache<String, float[]> embeddingCache(@Value("${veritas.fusion.embedding-cache-size:10000}") long maximumSize) {
        return Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .expireAfterAccess(Duration.ofHours(1L))
            .build();
    }

    @Bean
    public SimilarityScorer similarityScorer(@Value("${veritas.fusion.similarity:embedding}") String mode,
                                             ObjectProvider<EmbeddingModel> embeddingModel,
                                             Cache<String, float[]> embeddingCache,
                                             LlmRateLimiter rateLimiter) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if ("lexical".equalsIgnoreCase(mode.trim()) || model == null) {
            log.info("Diversity reranking uses lexical similarity");
            return new LexicalSimilarityScorer();
        }
        log.info("Diversity reranking uses embedding similarity");
        return new EmbeddingSimilarityScorer(model, embeddingCache, rateLimiter);
    }
}
