package com.jreinhal.veritas.rag.synthesis;

import com.jreinhal.veritas.model.Citation;
import com.jreinhal.veritas.model.Provenance;
import com.jreinhal.veritas.model.SourceType;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw provenance into labels a reader can follow back to the source.
 */
final class CitationFormatter {
    private static final Pattern SECONDS = Pattern.compile("^\\d+(\\.\\d+)?$");
    private static final Pattern RAW_SPEAKER = Pattern.compile("^SPEAKER[_ ]?(\\d+)$", Pattern.CASE_INSENSITIVE);
    private static final String OFFSET_PREFIX = "offset:";
    static final String GRAPH_LABEL = "Knowledge graph";
    static final String UNKNOWN_LABEL = "Unknown source";

    private CitationFormatter() {
    }

    static Citation toCitation(SourceType sourceType, Provenance provenance, double confidence) {
        return new Citation(sourceType, documentLabel(sourceType, provenance), locator(provenance),
                speakerLabel(provenance == null ? null : provenance.speaker()), confidence);
    }

    static String documentLabel(SourceType sourceType, Provenance provenance) {
        if (provenance != null && provenance.documentLabel() != null && !provenance.documentLabel().isBlank()) {
            return provenance.documentLabel().trim();
        }
        if (provenance != null && provenance.documentId() != null && !provenance.documentId().isBlank()) {
            return humanize(provenance.documentId());
        }
        return sourceType == SourceType.GRAPH ? GRAPH_LABEL : UNKNOWN_LABEL;
    }

    /**
     * {@code hh:mm:ss} for second offsets, {@code offset N} for character offsets and
     * {@code A -> REL -> B} for graph paths. Null when the provenance has no position.
     */
    static String locator(Provenance provenance) {
        if (provenance == null) {
            return null;
        }
        if (provenance.relationPath().size() > 1) {
            return String.join(" -> ", provenance.relationPath());
        }
        String raw = provenance.locator();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith(OFFSET_PREFIX)) {
            return "offset " + trimmed.substring(OFFSET_PREFIX.length()).trim();
        }
        if (SECONDS.matcher(trimmed).matches()) {
            return formatSeconds((long) Double.parseDouble(trimmed));
        }
        return trimmed;
    }

    static String formatSeconds(long totalSeconds) {
        long seconds = Math.max(0L, totalSeconds);
        return String.format(Locale.ROOT, "%02d:%02d:%02d", seconds / 3600L, seconds % 3600L / 60L, seconds % 60L);
    }

    static String speakerLabel(String speaker) {
        if (speaker == null || speaker.isBlank()) {
            return null;
        }
        Matcher matcher = RAW_SPEAKER.matcher(speaker.trim());
        if (matcher.matches()) {
            return "Speaker " + (Integer.parseInt(matcher.group(1)) + 1);
        }
        return speaker.trim();
    }

    static String humanize(String id) {
        String spaced = id.trim().replaceAll("\\.[A-Za-z0-9]{2,4}$", "").replaceAll("[_\\-]+", " ").replaceAll("\\s+", " ").trim();
        if (spaced.isEmpty()) {
            return id;
        }
        StringBuilder label = new StringBuilder(spaced.length());
        for (String word : spaced.split(" ")) {
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }
}
