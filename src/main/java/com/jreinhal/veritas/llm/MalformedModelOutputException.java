package com.jreinhal.veritas.llm;

public class MalformedModelOutputException extends RuntimeException {
    public MalformedModelOutputException(String message) {
        super(message);
    }

    public MalformedModelOutputException(String message, Throwable cause) {
        super(message, cause);
    }
}
