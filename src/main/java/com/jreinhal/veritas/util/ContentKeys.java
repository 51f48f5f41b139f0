package com.jreinhal.veritas.util;

import java.util.Locale;

/**
 * Keys used to recognize near-identical evidence.
 */
public final class ContentKeys {
    public static final int PREFIX_LENGTH = 200;

    private ContentKeys() {
    }

    /**
     * Lowercased, whitespace-collapsed first 200 characters of {@code content}.
     */
    public static String prefixKey(String content) {
        if (content == null) {
            return "";
        }
        String normalized = content.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ").trim();
        return normalized.length() <= PREFIX_LENGTH ? normalized : normalized.substring(0, PREFIX_LENGTH);
    }
}
