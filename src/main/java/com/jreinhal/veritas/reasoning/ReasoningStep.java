package com.jreinhal.veritas.reasoning;

import java.util.Map;

/**
 * One timed stage of a request trace.
 */
public record ReasoningStep(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {

    public ReasoningStep {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs) {
        return new ReasoningStep(type, label, detail, durationMs, Map.of());
    }

    public static ReasoningStep of(StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        return new ReasoningStep(type, label, detail, durationMs, data);
    }

    public enum StepType {
        PLANNING,
        FAST_PATH,
        RETRIEVAL,
        FUSION,
        SYNTHESIS,
        VALIDATION,
        ERROR
    }
}
