package com.jreinhal.veritas.service;

import com.jreinhal.veritas.model.ConversationTurn;
import com.jreinhal.veritas.model.EvidenceCounts;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.RankedItem;
import com.jreinhal.veritas.model.SynthesisResult;
import com.jreinhal.veritas.rag.retrieval.RetrievalResult;
import com.jreinhal.veritas.rag.validation.ValidationOutcome;
import com.jreinhal.veritas.reasoning.ReasoningTrace;
import java.util.List;

/**
 * State of one request as it moves through the stages. Owned by a single worker and never shared.
 */
class RequestContext {
    enum PipelineStage {
        PLAN,
        RETRIEVE,
        FUSE,
        SYNTHESIZE,
        VALIDATE,
        DONE
    }

    private final String query;
    private final String conversationId;
    private final String workspaceId;
    private final ReasoningTrace trace;
    private final long startTime = System.currentTimeMillis();
    private PipelineStage stage = PipelineStage.PLAN;
    private List<ConversationTurn> conversation = List.of();
    private QueryPlan plan;
    private RetrievalResult retrieval = RetrievalResult.EMPTY;
    private List<RankedItem> rankedItems = List.of();
    private SynthesisResult synthesis;
    private ValidationOutcome outcome;

    RequestContext(String query, String conversationId, String workspaceId, ReasoningTrace trace) {
        this.query = query == null ? "" : query;
        this.conversationId = conversationId;
        this.workspaceId = workspaceId;
        this.trace = trace;
    }

    void advance(PipelineStage next) {
        if (next.ordinal() < this.stage.ordinal()) {
            throw new IllegalStateException("Cannot move from " + this.stage + " back to " + next);
        }
        this.stage = next;
    }

    String query() {
        return this.query;
    }

    String conversationId() {
        return this.conversationId;
    }

    String workspaceId() {
        return this.workspaceId;
    }

    ReasoningTrace trace() {
        return this.trace;
    }

    long elapsedMs() {
        return System.currentTimeMillis() - this.startTime;
    }

    PipelineStage stage() {
        return this.stage;
    }

    List<ConversationTurn> conversation() {
        return this.conversation;
    }

    void conversation(List<ConversationTurn> turns) {
        this.conversation = turns == null ? List.of() : turns;
    }

    QueryPlan plan() {
        return this.plan;
    }

    void plan(QueryPlan queryPlan) {
        this.plan = queryPlan;
    }

    RetrievalResult retrieval() {
        return this.retrieval;
    }

    void retrieval(RetrievalResult result) {
        this.retrieval = result == null ? RetrievalResult.EMPTY : result;
    }

    EvidenceCounts evidenceCounts() {
        return this.retrieval.evidenceCounts();
    }

    List<RankedItem> rankedItems() {
        return this.rankedItems;
    }

    void rankedItems(List<RankedItem> items) {
        this.rankedItems = items == null ? List.of() : items;
    }

    SynthesisResult synthesis() {
        return this.synthesis;
    }

    void synthesis(SynthesisResult result) {
        this.synthesis = result;
    }

    ValidationOutcome outcome() {
        return this.outcome;
    }

    void outcome(ValidationOutcome validationOutcome) {
        if (this.outcome != null) {
            throw new IllegalStateException("Validation already ran for this request");
        }
        this.outcome = validationOutcome;
    }
}
