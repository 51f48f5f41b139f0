package com.jreinhal.veritas.model;

/**
 * Streaming payload: any number of {@link Delta} events followed by exactly one {@link Completed}.
 */
public interface AnswerEvent {

    record Delta(String text) implements AnswerEvent {
    }

    record Completed(AnswerResponse response) implements AnswerEvent {
    }
}
