package com.jreinhal.veritas.model;

public record Citation(SourceType sourceType, String documentLabel, String locator, String speakerLabel, double confidence) {
    public Citation {
        confidence = Math.max(0.0, Math.min(1.0, confidence));
    }
}
