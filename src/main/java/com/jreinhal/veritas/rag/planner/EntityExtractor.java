package com.jreinhal.veritas.rag.planner;

import com.jreinhal.veritas.constant.StopWords;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Surface-form entity candidates: quoted terms and runs of capitalized words.
 */
final class EntityExtractor {
    private static final Pattern QUOTED = Pattern.compile("[\"“]([^\"”]{2,60})[\"”]");
    private static final Pattern CITATION_MARKER = Pattern.compile("^S\\d+$");
    private static final Pattern CAPITALIZED_RUN = Pattern.compile("\\b([A-Z][\\w'-]*(?:\\s+(?:of\\s+|the\\s+)?[A-Z][\\w'-]*)*)");

    private EntityExtractor() {
    }

    static Set<String> extract(String text) {
        Set<String> entities = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return entities;
        }
        Matcher quoted = QUOTED.matcher(text);
        while (quoted.find()) {
            entities.add(quoted.group(1).trim());
        }
        Matcher capitalized = CAPITALIZED_RUN.matcher(text);
        while (capitalized.find()) {
            String candidate = stripLeadingNoise(capitalized.group(1).trim());
            if (!candidate.isEmpty() && !CITATION_MARKER.matcher(candidate).matches()) {
                entities.add(candidate);
            }
        }
        return entities;
    }

    /**
     * Sentence-initial question words are capitalized too; drop them from the front of a run.
     */
    private static String stripLeadingNoise(String run) {
        String[] words = run.split("\\s+");
        int start = 0;
        while (start < words.length && StopWords.ENTITY_NOISE.contains(words[start].toLowerCase(Locale.ROOT))) {
            start++;
        }
        if (start >= words.length) {
            return "";
        }
        String candidate = String.join(" ", Arrays.copyOfRange(words, start, words.length));
        return candidate.length() < 2 ? "" : candidate;
    }
}
