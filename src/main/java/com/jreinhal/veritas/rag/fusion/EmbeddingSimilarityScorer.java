package com.jreinhal.veritas.rag.fusion;

import com.github.benmanes.caffeine.cache.Cache;
import com.jreinhal.veritas.llm.LlmRateLimiter;
import com.jreinhal.veritas.util.LogSanitizer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.EmbeddingModel;

/**
 * Cosine similarity of model embeddings, cached per text.
 *
 * <p>When the embedding service fails, the pair is scored lexically instead so that reranking still
 * completes.</p>
 */
public class EmbeddingSimilarityScorer implements SimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingSimilarityScorer.class);

    private final EmbeddingModel embeddingModel;
    private final Cache<String, float[]> embeddingCache;
    private final LlmRateLimiter rateLimiter;
    private final LexicalSimilarityScorer fallback = new LexicalSimilarityScorer();

    public EmbeddingSimilarityScorer(EmbeddingModel embeddingModel, Cache<String, float[]> embeddingCache, LlmRateLimiter rateLimiter) {
        this.embeddingModel = embeddingModel;
        this.embeddingCache = embeddingCache;
        this.rateLimiter = rateLimiter;
    }

    @Override
    public void prepare(Collection<String> texts) {
        List<String> missing = new ArrayList<>();
        for (String text : new LinkedHashSet<>(texts)) {
            if (text != null && !text.isBlank() && this.embeddingCache.getIfPresent(text) == null) {
                missing.add(text);
            }
        }
        if (missing.isEmpty()) {
            return;
        }
        int tokens = missing.stream().mapToInt(LlmRateLimiter::estimateTokens).sum();
        try {
            List<float[]> vectors = this.rateLimiter.execute("embed", tokens, () -> this.embeddingModel.embed(missing));
            for (int i = 0; i < missing.size() && i < vectors.size(); i++) {
                this.embeddingCache.put(missing.get(i), vectors.get(i));
            }
        }
        catch (RuntimeException e) {
            log.warn("Batch embedding failed, similarity falls back to lexical overlap: {}", LogSanitizer.sanitize(e.getMessage()));
        }
    }

    @Override
    public double similarity(String left, String right) {
        float[] a = this.embeddingCache.getIfPresent(left == null ? "" : left);
        float[] b = this.embeddingCache.getIfPresent(right == null ? "" : right);
        if (a == null || b == null || a.length != b.length) {
            return this.fallback.similarity(left, right);
        }
        return Math.max(0.0, cosine(a, b));
    }

    static double cosine(float[] a, float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
