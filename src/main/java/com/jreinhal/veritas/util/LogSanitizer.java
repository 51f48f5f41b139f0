package com.jreinhal.veritas.util;

import java.util.regex.Pattern;

/**
 * Keeps user text out of log output. Queries are logged as length plus hash only.
 */
public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int PREVIEW_LENGTH = 80;

    private LogSanitizer() {
    }

    public static String querySummary(String query) {
        if (query == null) {
            return "[len=0,id=none]";
        }
        return "[len=" + query.length() + ",id=" + Integer.toHexString(query.hashCode()) + "]";
    }

    /**
     * Strip control characters so model output or store errors cannot forge log lines.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    public static String preview(String value) {
        String clean = sanitize(value);
        if (clean.length() <= PREVIEW_LENGTH) {
            return clean;
        }
        return clean.substring(0, PREVIEW_LENGTH) + "...";
    }
}
