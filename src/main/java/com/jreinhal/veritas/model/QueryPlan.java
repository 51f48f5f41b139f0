package com.jreinhal.veritas.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable routing decision for one request.
 *
 * <p>{@code rejectionReason} is present exactly when the intent is {@link Intent#OUT_OF_SCOPE},
 * and an out-of-scope plan never enables retrieval.</p>
 */
public record QueryPlan(
        String rawQuery,
        String resolvedQuery,
        boolean followUp,
        Intent intent,
        Complexity complexity,
        Set<String> entities,
        List<String> subQueries,
        RetrievalStrategy retrievalStrategy,
        String rejectionReason) {

    public QueryPlan {
        rawQuery = rawQuery == null ? "" : rawQuery;
        resolvedQuery = resolvedQuery == null || resolvedQuery.isBlank() ? rawQuery : resolvedQuery;
        entities = entities == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(entities));
        subQueries = subQueries == null ? List.of() : List.copyOf(subQueries);
        if (intent == Intent.OUT_OF_SCOPE) {
            retrievalStrategy = RetrievalStrategy.none();
            if (rejectionReason == null || rejectionReason.isBlank()) {
                rejectionReason = "out of scope";
            }
        }
        else {
            rejectionReason = null;
        }
        if (complexity == Complexity.SIMPLE) {
            subQueries = List.of();
        }
    }

    public static QueryPlan outOfScope(String query, String reason) {
        return new QueryPlan(query, query, false, Intent.OUT_OF_SCOPE, Complexity.SIMPLE, Set.of(), List.of(), RetrievalStrategy.none(), reason);
    }

    public static QueryPlan smallTalk(String query, Intent intent) {
        return new QueryPlan(query, query, false, intent, Complexity.SIMPLE, Set.of(), List.of(), RetrievalStrategy.none(), null);
    }

    /**
     * Queries the retrieval stage should issue: the sub-queries when decomposed, otherwise the resolved query.
     */
    public List<String> retrievalQueries() {
        if (!this.subQueries.isEmpty()) {
            return this.subQueries;
        }
        return List.of(this.resolvedQuery);
    }
}
