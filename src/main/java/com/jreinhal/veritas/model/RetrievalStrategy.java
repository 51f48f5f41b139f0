package com.jreinhal.veritas.model;

public record RetrievalStrategy(boolean useVector, boolean useGraph, boolean expandQuery, GraphTraversalMode graphTraversalMode) {
    public static RetrievalStrategy none() {
        return new RetrievalStrategy(false, false, false, GraphTraversalMode.ENTITY_CENTRIC);
    }

    public static RetrievalStrategy both(boolean expandQuery, GraphTraversalMode mode) {
        return new RetrievalStrategy(true, true, expandQuery, mode);
    }

    public boolean retrievesAnything() {
        return this.useVector || this.useGraph;
    }
}
