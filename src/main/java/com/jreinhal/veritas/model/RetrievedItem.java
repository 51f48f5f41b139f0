package com.jreinhal.veritas.model;

public record RetrievedItem(SourceType sourceType, String content, Provenance provenance, double relevanceScore) {
    public RetrievedItem {
        content = content == null ? "" : content;
    }
}
