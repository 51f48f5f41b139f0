package com.jreinhal.veritas.exception;

/**
 * An answer could not be produced because a required model call failed or timed out. Callers may
 * retry the request when {@link #isRetryable()} holds.
 */
public class AnswerUnavailableException extends RuntimeException {
    public enum Stage {
        SYNTHESIS,
        VALIDATION
    }

    private final Stage stage;
    private final boolean retryable;

    public AnswerUnavailableException(Stage stage, String message, Throwable cause) {
        this(stage, message, cause, true);
    }

    public AnswerUnavailableException(Stage stage, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.stage = stage;
        this.retryable = retryable;
    }

    public Stage getStage() {
        return this.stage;
    }

    public boolean isRetryable() {
        return this.retryable;
    }
}
