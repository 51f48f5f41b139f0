package com.jreinhal.veritas.llm;

public class RateLimitExhaustedException extends LlmUnavailableException {
    private final int attempts;

    public RateLimitExhaustedException(String operation, int attempts, Throwable cause) {
        super("Rate limit still exceeded for '" + operation + "' after " + attempts + " attempts", cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return this.attempts;
    }
}
