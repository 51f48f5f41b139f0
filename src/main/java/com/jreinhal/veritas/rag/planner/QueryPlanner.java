package com.jreinhal.veritas.rag.planner;

import com.jreinhal.veritas.model.Complexity;
import com.jreinhal.veritas.model.ConversationTurn;
import com.jreinhal.veritas.model.GraphTraversalMode;
import com.jreinhal.veritas.model.Intent;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.RetrievalStrategy;
import com.jreinhal.veritas.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Turns a raw question into a {@link QueryPlan}.
 *
 * <p>Stages, cheapest first:</p>
 * <ol>
 *   <li>Fast path: fixed greeting and out-of-scope patterns, no model call.</li>
 *   <li>Context: follow-up detection and entity carry-over from recent turns.</li>
 *   <li>Relevance: model judgment; only a confident "no" rejects.</li>
 *   <li>Classification: intent, complexity and sub-queries.</li>
 *   <li>Strategy: traversal mode by intent.</li>
 * </ol>
 *
 * <p>Never throws. Any internal failure yields an out-of-scope plan with no retrieval.</p>
 */
@Service
public class QueryPlanner {
    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private final ContextAnalyzer contextAnalyzer;
    private final RelevanceClassifier relevanceClassifier;
    private final QueryClassifier queryClassifier;

    @Value("${veritas.planner.relevance-reject-confidence:0.8}")
    private double relevanceRejectConfidence;

    public QueryPlanner(ContextAnalyzer contextAnalyzer, RelevanceClassifier relevanceClassifier, QueryClassifier queryClassifier) {
        this.contextAnalyzer = contextAnalyzer;
        this.relevanceClassifier = relevanceClassifier;
        this.queryClassifier = queryClassifier;
    }

    @PostConstruct
    public void init() {
        log.info("Query planner initialized (relevanceRejectConfidence={})", this.relevanceRejectConfidence);
    }

    public QueryPlan plan(String query, List<ConversationTurn> conversationContext) {
        try {
            return this.doPlan(query == null ? "" : query, conversationContext == null ? List.of() : conversationContext);
        }
        catch (RuntimeException e) {
            log.warn("Planning failed for query {}, defaulting to out-of-scope: {}",
                    LogSanitizer.querySummary(query), LogSanitizer.sanitize(e.getMessage()));
            return QueryPlan.outOfScope(query, "planner unavailable");
        }
    }

    private QueryPlan doPlan(String query, List<ConversationTurn> conversationContext) {
        Optional<FastPathMatcher.FastPath> fastPath = FastPathMatcher.match(query);
        if (fastPath.isPresent()) {
            FastPathMatcher.FastPath match = fastPath.get();
            log.debug("Fast path {} for query {}", match.intent(), LogSanitizer.querySummary(query));
            return match.intent() == Intent.OUT_OF_SCOPE
                    ? QueryPlan.outOfScope(query, match.reason())
                    : QueryPlan.smallTalk(query, match.intent());
        }

        ContextAnalyzer.ContextAnalysis context = this.contextAnalyzer.analyze(query, conversationContext);
        String effectiveQuery = context.resolvedQuery();
        Set<String> entities = new LinkedHashSet<>(EntityExtractor.extract(effectiveQuery));
        entities.addAll(context.contextEntities());

        RelevanceClassifier.RelevanceJudgment relevance = this.relevanceClassifier.judge(effectiveQuery);
        if (!relevance.relevant() && relevance.confidence() >= this.relevanceRejectConfidence) {
            log.info("Query {} judged outside the knowledge base (confidence {})",
                    LogSanitizer.querySummary(query), relevance.confidence());
            String reason = relevance.reason().isBlank() ? "not covered by the knowledge base" : LogSanitizer.sanitize(relevance.reason());
            return QueryPlan.outOfScope(query, reason);
        }

        QueryClassifier.Classification classification = this.queryClassifier.classify(effectiveQuery, entities);
        GraphTraversalMode mode = selectTraversalMode(classification.intent(), classification.entities());
        boolean expand = classification.complexity() != Complexity.SIMPLE;
        QueryPlan plan = new QueryPlan(query, effectiveQuery, context.followUp(), classification.intent(),
                classification.complexity(), classification.entities(), classification.subQueries(),
                RetrievalStrategy.both(expand, mode), null);
        log.info("Planned query {}: intent={}, complexity={}, entities={}, subQueries={}, mode={}, followUp={}",
                LogSanitizer.querySummary(query), plan.intent(), plan.complexity(), plan.entities().size(),
                plan.subQueries().size(), mode, plan.followUp());
        return plan;
    }

    static GraphTraversalMode selectTraversalMode(Intent intent, Set<String> entities) {
        return switch (intent) {
            case CROSS_EPISODE -> GraphTraversalMode.CROSS_SOURCE;
            case CAUSAL, COMPARISON, MULTI_ENTITY -> GraphTraversalMode.MULTI_HOP;
            default -> entities.size() > 1 ? GraphTraversalMode.MULTI_HOP : GraphTraversalMode.ENTITY_CENTRIC;
        };
    }
}
