package com.jreinhal.veritas.constant;

import java.util.Set;

public final class StopWords {
    public static final Set<String> GRAPH_TERMS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to",
            "for", "of", "with", "by", "from", "as", "is", "was", "are",
            "were", "been", "be", "have", "has", "had", "what", "where",
            "when", "who", "how", "why", "tell", "me", "about", "describe",
            "find", "show", "give", "also", "does", "do", "did", "which",
            "there", "their", "they", "this", "that", "these", "those"
    );

    public static final Set<String> SIMILARITY = Set.of(
            "the", "a", "an", "is", "are", "was", "were", "what", "where",
            "when", "who", "how", "why", "which", "and", "or", "but", "in",
            "on", "at", "to", "for", "of", "with", "it", "that", "this"
    );

    public static final Set<String> ENTITY_NOISE = Set.of(
            "what", "who", "how", "why", "when", "where", "which", "is", "are",
            "the", "a", "an", "i", "tell", "explain", "describe", "compare",
            "can", "does", "do", "did", "and", "or", "vs", "versus", "between",
            "he", "she", "it", "they", "we", "you", "his", "her", "its", "their",
            "this", "that", "yes", "no", "sure", "so", "also"
    );

    private StopWords() {
    }
}
