package com.jreinhal.veritas.model;

import java.util.List;

/**
 * A retrieved item annotated by fusion. {@code provenances} holds the union of every merged duplicate,
 * the surviving item's own provenance first.
 */
public record RankedItem(RetrievedItem item, List<Provenance> provenances, double fusionScore, Double diversityScore, int rank) {
    public RankedItem {
        if (provenances == null || provenances.isEmpty()) {
            provenances = item.provenance() == null ? List.of() : List.of(item.provenance());
        }
        else {
            provenances = List.copyOf(provenances);
        }
    }

    public RankedItem withRank(int newRank) {
        return new RankedItem(this.item, this.provenances, this.fusionScore, this.diversityScore, newRank);
    }

    public RankedItem withDiversityScore(double score) {
        return new RankedItem(this.item, this.provenances, this.fusionScore, score, this.rank);
    }

    public SourceType sourceType() {
        return this.item.sourceType();
    }

    public String content() {
        return this.item.content();
    }
}
