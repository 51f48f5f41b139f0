package com.jreinhal.veritas.model;

/**
 * Closed set of question intents recognized by the planner.
 */
public enum Intent {
    /** Salutation, thanks or farewell. Answered without retrieval. */
    GREETING,
    /** Short acknowledgement such as "ok" or "hmm". Answered without retrieval. */
    CONVERSATIONAL,
    /** General question about something the corpus may discuss. */
    KNOWLEDGE_QUERY,
    /** "What is X?" style lookup of a single concept or person. */
    DEFINITION,
    /** Contrast between two or more entities. */
    COMPARISON,
    /** Question about causes, effects or influences. */
    CAUSAL,
    /** Question spanning several named entities. */
    MULTI_ENTITY,
    /** Question about what recurs across several source documents. */
    CROSS_EPISODE,
    /** Outside the corpus domain. No retrieval may run. */
    OUT_OF_SCOPE;

    public boolean skipsRetrieval() {
        return this == GREETING || this == CONVERSATIONAL || this == OUT_OF_SCOPE;
    }

    public boolean isSmallTalk() {
        return this == GREETING || this == CONVERSATIONAL;
    }

    public static Intent fromLabel(String label, Intent fallback) {
        if (label == null || label.isBlank()) {
            return fallback;
        }
        String normalized = label.trim().toUpperCase().replace('-', '_').replace(' ', '_');
        for (Intent intent : values()) {
            if (intent.name().equals(normalized)) {
                return intent;
            }
        }
        return fallback;
    }
}
