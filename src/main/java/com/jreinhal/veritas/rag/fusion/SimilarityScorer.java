package com.jreinhal.veritas.rag.fusion;

import java.util.Collection;

/**
 * Symmetric text similarity in [0, 1] used by diversity reranking.
 */
public interface SimilarityScorer {

    double similarity(String left, String right);

    /**
     * Hint that the given texts are about to be compared pairwise.
     */
    default void prepare(Collection<String> texts) {
    }
}
