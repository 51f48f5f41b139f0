package com.jreinhal.veritas.rag.validation;

import com.jreinhal.veritas.model.SynthesisResult;
import com.jreinhal.veritas.model.Verdict;

/**
 * Gate decision. {@code reason} is null for accepted answers.
 */
public record ValidationOutcome(SynthesisResult result, Verdict verdict, String reason) {
    public static ValidationOutcome accepted(SynthesisResult result) {
        return new ValidationOutcome(result, Verdict.ACCEPTED, null);
    }

    public static ValidationOutcome rejected(SynthesisResult result, String reason) {
        return new ValidationOutcome(result, Verdict.REJECTED, reason);
    }

    public boolean isAccepted() {
        return this.verdict == Verdict.ACCEPTED;
    }
}
