package com.jreinhal.veritas.model;

public enum Complexity {
    /** Single entity or fact. */
    SIMPLE,
    /** Comparison or relationship between two entities. */
    MODERATE,
    /** Multi-entity, multi-hop or cross-document aggregation. */
    COMPLEX;

    public static Complexity fromLabel(String label, Complexity fallback) {
        if (label == null || label.isBlank()) {
            return fallback;
        }
        try {
            return Complexity.valueOf(label.trim().toUpperCase());
        }
        catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
