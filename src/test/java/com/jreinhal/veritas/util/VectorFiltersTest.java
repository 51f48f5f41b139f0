package com.jreinhal.veritas.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VectorFiltersTest {

    @Test
    void shouldBuildWorkspaceFilter() {
        assertEquals("workspace_id == 'ws_alpha'", VectorFilters.forWorkspace("ws_alpha"));
    }

    @Test
    void shouldEscapeQuotesAndBackslashes() {
        assertEquals("workspace_id == 'ws\\' || true || \\'x'", VectorFilters.forWorkspace("ws' || true || 'x"));
        assertEquals("a\\\\\\'b", VectorFilters.escapeValue("a\\'b"));
    }
}
