package com.jreinhal.veritas.rag.retrieval;

import com.jreinhal.veritas.model.EvidenceCounts;
import com.jreinhal.veritas.model.RetrievedItem;
import java.util.List;

/**
 * Evidence from both stores. {@code failures} names each side that failed or timed out; that side's
 * list is empty.
 */
public record RetrievalResult(List<RetrievedItem> vectorItems, List<RetrievedItem> graphItems, List<String> failures) {
    public static final RetrievalResult EMPTY = new RetrievalResult(List.of(), List.of(), List.of());

    public RetrievalResult {
        vectorItems = vectorItems == null ? List.of() : List.copyOf(vectorItems);
        graphItems = graphItems == null ? List.of() : List.copyOf(graphItems);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public EvidenceCounts evidenceCounts() {
        return new EvidenceCounts(this.vectorItems.size(), this.graphItems.size());
    }
}
