package com.jreinhal.veritas.rag.fusion;

import java.util.Locale;

public enum FusionStrategy {
    /** Reciprocal rank fusion only. */
    RRF,
    /** Diversity reranking over the whole fused list. */
    MMR,
    /** Reciprocal rank fusion, then diversity reranking over the top window. */
    HYBRID;

    public static FusionStrategy fromConfig(String value) {
        if (value == null || value.isBlank()) {
            return HYBRID;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if ("RRF_MMR".equals(normalized)) {
            return HYBRID;
        }
        try {
            return FusionStrategy.valueOf(normalized);
        }
        catch (IllegalArgumentException e) {
            return HYBRID;
        }
    }
}
