package com.jreinhal.veritas.model;

import java.util.List;

/**
 * Where a piece of evidence came from.
 *
 * @param documentId    identifier of the source document
 * @param documentLabel human readable document name, may be null
 * @param locator       position inside the document (timestamp, offset) or null
 * @param speaker       speaker or author label, may be null
 * @param relationPath  node and relationship names along a graph path, empty for passages
 */
public record Provenance(String documentId, String documentLabel, String locator, String speaker, List<String> relationPath) {
    public Provenance {
        relationPath = relationPath == null ? List.of() : List.copyOf(relationPath);
    }

    public static Provenance of(String documentId, String documentLabel, String locator, String speaker) {
        return new Provenance(documentId, documentLabel, locator, speaker, List.of());
    }

    /**
     * Number of relationships traversed, derived from the alternating node/relationship path.
     */
    public int hopCount() {
        return this.relationPath.isEmpty() ? 0 : this.relationPath.size() / 2;
    }

    public boolean hasLocator() {
        return this.documentId != null && !this.documentId.isBlank() && this.locator != null && !this.locator.isBlank();
    }
}
