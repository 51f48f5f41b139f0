package com.jreinhal.veritas.model;

import java.util.List;

public record SynthesisResult(String answerText, List<Citation> citations, boolean grounded) {
    public SynthesisResult {
        answerText = answerText == null ? "" : answerText;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static SynthesisResult rejected(String rejectionMessage) {
        return new SynthesisResult(rejectionMessage, List.of(), false);
    }

    public static SynthesisResult grounded(String answerText, List<Citation> citations) {
        return new SynthesisResult(answerText, citations, true);
    }
}
