package com.jreinhal.veritas.model;

import java.util.List;

public record Diagnostics(
        Intent intent,
        Complexity complexity,
        EvidenceCounts evidenceCounts,
        Verdict verdict,
        String rejectionReason,
        List<String> retrievalFailures,
        String traceId) {

    public Diagnostics {
        retrievalFailures = retrievalFailures == null ? List.of() : List.copyOf(retrievalFailures);
    }
}
