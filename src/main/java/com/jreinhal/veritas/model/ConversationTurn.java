package com.jreinhal.veritas.model;

import java.time.Instant;

public record ConversationTurn(Role role, String content, Instant timestamp) {
    public enum Role {
        USER,
        ASSISTANT
    }
}
