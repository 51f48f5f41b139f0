package com.jreinhal.veritas.rag.retrieval;

public record LinkedEntity(String surfaceForm, String canonicalName, String nodeId, Method method) {
    public enum Method {
        EXACT,
        ALIAS,
        SUBSTRING,
        MODEL
    }
}
