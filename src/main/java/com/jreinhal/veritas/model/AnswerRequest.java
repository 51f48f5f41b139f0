package com.jreinhal.veritas.model;

/**
 * Caller input. {@code workspaceId} is optional and falls back to the current workspace context.
 */
public record AnswerRequest(String query, String conversationId, String workspaceId) {
    public AnswerRequest(String query, String conversationId) {
        this(query, conversationId, null);
    }
}
