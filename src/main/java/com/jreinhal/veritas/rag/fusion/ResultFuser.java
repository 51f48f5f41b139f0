package com.jreinhal.veritas.rag.fusion;

import com.jreinhal.veritas.model.Provenance;
import com.jreinhal.veritas.model.RankedItem;
import com.jreinhal.veritas.model.RetrievedItem;
import com.jreinhal.veritas.util.ContentKeys;
import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Merges vector and graph evidence into one ranked list.
 *
 * <p>Duplicates are collapsed before scoring: two items are the same evidence when their normalized
 * content prefixes match or when they point at the same document and locator. A repeat inside one
 * list neither consumes a rank nor adds score, so feeding a list twice ranks exactly like feeding it
 * once. Ties fall back to first appearance with the vector list read first.</p>
 */
@Service
public class ResultFuser {
    private static final Logger log = LoggerFactory.getLogger(ResultFuser.class);

    private final SimilarityScorer similarityScorer;

    @Value("${veritas.fusion.strategy:hybrid}")
    private String strategyName;
    @Value("${veritas.fusion.rrf-k:60}")
    private int rrfK;
    @Value("${veritas.fusion.mmr-lambda:0.5}")
    private double mmrLambda;
    @Value("${veritas.fusion.mmr-window:20}")
    private int mmrWindow;

    public ResultFuser(SimilarityScorer similarityScorer) {
        this.similarityScorer = similarityScorer;
    }

    @PostConstruct
    public void init() {
        log.info("Result fuser initialized (strategy={}, k={}, lambda={}, window={})",
                this.strategy(), this.rrfK, this.mmrLambda, this.mmrWindow);
    }

    public FusionStrategy strategy() {
        return FusionStrategy.fromConfig(this.strategyName);
    }

    public List<RankedItem> fuse(List<RetrievedItem> vectorItems, List<RetrievedItem> graphItems, String query) {
        List<Candidate> candidates = new ArrayList<>();
        Map<String, Candidate> byPrefix = new HashMap<>();
        Map<String, Candidate> byLocator = new HashMap<>();
        for (List<RetrievedItem> list : List.of(nullToEmpty(vectorItems), nullToEmpty(graphItems))) {
            Set<Candidate> seenInList = new HashSet<>();
            int rank = 0;
            for (RetrievedItem item : list) {
                Candidate candidate = lookup(item, byPrefix, byLocator);
                if (candidate == null) {
                    candidate = new Candidate(item, candidates.size());
                    candidates.add(candidate);
                }
                else {
                    candidate.absorb(item);
                }
                index(candidate, item, byPrefix, byLocator);
                if (seenInList.add(candidate)) {
                    rank++;
                    candidate.score += 1.0 / (this.rrfK + rank);
                }
            }
        }
        if (candidates.isEmpty()) {
            return List.of();
        }

        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.score).reversed()
                .thenComparingInt(c -> c.firstSeen));
        List<RankedItem> fused = new ArrayList<>(candidates.size());
        for (Candidate candidate : candidates) {
            fused.add(new RankedItem(candidate.item, new ArrayList<>(candidate.provenances), candidate.score, null, 0));
        }

        List<RankedItem> ordered = switch (this.strategy()) {
            case RRF -> fused;
            case MMR -> this.diversify(fused, fused.size(), query);
            case HYBRID -> this.diversify(fused, this.mmrWindow, query);
        };
        List<RankedItem> ranked = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            ranked.add(ordered.get(i).withRank(i + 1));
        }
        log.debug("Fused {} vector and {} graph items into {} ranked items",
                nullToEmpty(vectorItems).size(), nullToEmpty(graphItems).size(), ranked.size());
        return List.copyOf(ranked);
    }

    /**
     * Greedy maximal marginal relevance over the first {@code window} items; the rest keep their
     * fused order after the window.
     */
    List<RankedItem> diversify(List<RankedItem> fused, int window, String query) {
        int size = Math.min(Math.max(window, 0), fused.size());
        if (size <= 1) {
            return fused;
        }
        List<RankedItem> pool = new ArrayList<>(fused.subList(0, size));
        List<String> texts = new ArrayList<>();
        texts.add(query == null ? "" : query);
        pool.forEach(item -> texts.add(item.content()));
        this.similarityScorer.prepare(texts);

        double[] relevance = new double[pool.size()];
        for (int i = 0; i < pool.size(); i++) {
            relevance[i] = this.similarityScorer.similarity(query, pool.get(i).content());
        }
        boolean[] taken = new boolean[pool.size()];
        List<RankedItem> selected = new ArrayList<>(fused.size());
        for (int round = 0; round < pool.size(); round++) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < pool.size(); i++) {
                if (taken[i]) {
                    continue;
                }
                double maxSimilarity = 0.0;
                for (RankedItem chosen : selected) {
                    maxSimilarity = Math.max(maxSimilarity, this.similarityScorer.similarity(pool.get(i).content(), chosen.content()));
                }
                double score = this.mmrLambda * relevance[i] - (1.0 - this.mmrLambda) * maxSimilarity;
                if (score > bestScore) {
                    bestScore = score;
                    best = i;
                }
            }
            taken[best] = true;
            selected.add(pool.get(best).withDiversityScore(bestScore));
        }
        selected.addAll(fused.subList(size, fused.size()));
        return selected;
    }

    private static Candidate lookup(RetrievedItem item, Map<String, Candidate> byPrefix, Map<String, Candidate> byLocator) {
        String prefix = ContentKeys.prefixKey(item.content());
        Candidate match = prefix.isEmpty() ? null : byPrefix.get(prefix);
        if (match == null && item.provenance() != null && item.provenance().hasLocator()) {
            match = byLocator.get(locatorKey(item.provenance()));
        }
        return match;
    }

    private static void index(Candidate candidate, RetrievedItem item, Map<String, Candidate> byPrefix, Map<String, Candidate> byLocator) {
        String prefix = ContentKeys.prefixKey(item.content());
        if (!prefix.isEmpty()) {
            byPrefix.putIfAbsent(prefix, candidate);
        }
        if (item.provenance() != null && item.provenance().hasLocator()) {
            byLocator.putIfAbsent(locatorKey(item.provenance()), candidate);
        }
    }

    private static String locatorKey(Provenance provenance) {
        return provenance.documentId() + "|" + provenance.locator();
    }

    private static List<RetrievedItem> nullToEmpty(List<RetrievedItem> items) {
        return items == null ? List.of() : items;
    }

    private static final class Candidate {
        private RetrievedItem item;
        private final Set<Provenance> provenances = new LinkedHashSet<>();
        private final int firstSeen;
        private double score;

        private Candidate(RetrievedItem item, int firstSeen) {
            this.item = item;
            this.firstSeen = firstSeen;
            if (item.provenance() != null) {
                this.provenances.add(item.provenance());
            }
        }

        private void absorb(RetrievedItem other) {
            if (other.relevanceScore() > this.item.relevanceScore()) {
                this.item = other;
                Set<Provenance> merged = new LinkedHashSet<>();
                if (other.provenance() != null) {
                    merged.add(other.provenance());
                }
                merged.addAll(this.provenances);
                this.provenances.clear();
                this.provenances.addAll(merged);
            }
            else if (other.provenance() != null) {
                this.provenances.add(other.provenance());
            }
        }
    }
}
