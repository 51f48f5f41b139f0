package com.jreinhal.veritas.llm;

public class LlmUnavailableException extends RuntimeException {
    private final boolean timeout;

    public LlmUnavailableException(String message) {
        this(message, null, false);
    }

    public LlmUnavailableException(String message, Throwable cause) {
        this(message, cause, false);
    }

    public LlmUnavailableException(String message, Throwable cause, boolean timeout) {
        super(message, cause);
        this.timeout = timeout;
    }

    public boolean isTimeout() {
        return this.timeout;
    }
}
