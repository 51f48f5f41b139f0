package com.jreinhal.veritas.rag.fusion;

import com.jreinhal.veritas.constant.StopWords;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Jaccard overlap of content words. Deterministic and free of external calls.
 */
public class LexicalSimilarityScorer implements SimilarityScorer {

    @Override
    public double similarity(String left, String right) {
        Set<String> a = tokens(left);
        Set<String> b = tokens(right);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        int union = a.size() + b.size() - intersection.size();
        return union == 0 ? 0.0 : (double) intersection.size() / union;
    }

    static Set<String> tokens(String text) {
        Set<String> tokens = new HashSet<>();
        if (text == null) {
            return tokens;
        }
        for (String token : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (token.length() > 1 && !StopWords.SIMILARITY.contains(token)) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
