package com.jreinhal.veritas.constant;

public final class AnswerMessages {
    public static final String DEFAULT_REJECTION = "I couldn't find information about that in the knowledge base. "
            + "Could you rephrase your question or ask about a specific topic it covers?";
    public static final String REJECTION_PROPERTY = "${veritas.validation.rejection-message:" + DEFAULT_REJECTION + "}";

    private AnswerMessages() {
    }
}
