package com.jreinhal.veritas.util;

import com.jreinhal.veritas.constant.MetadataKeys;

/**
 * Portable Spring AI filter expressions.
 */
public final class VectorFilters {
    private static final String WORKSPACE_TEMPLATE = MetadataKeys.WORKSPACE_ID + " == '%s'";

    private VectorFilters() {
    }

    public static String forWorkspace(String workspaceId) {
        return String.format(WORKSPACE_TEMPLATE, escapeValue(workspaceId));
    }

    static String escapeValue(String value) {
        if (value == null) {
            return "";
        }
        // backslashes first so an escaped quote cannot be re-opened
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }
}
