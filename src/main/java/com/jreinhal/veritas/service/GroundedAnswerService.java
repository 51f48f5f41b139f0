package com.jreinhal.veritas.service;

import com.jreinhal.veritas.conversation.ConversationStore;
import com.jreinhal.veritas.model.AnswerEvent;
import com.jreinhal.veritas.model.AnswerRequest;
import com.jreinhal.veritas.model.AnswerResponse;
import com.jreinhal.veritas.model.ConversationTurn;
import com.jreinhal.veritas.model.Diagnostics;
import com.jreinhal.veritas.model.Intent;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.RankedItem;
import com.jreinhal.veritas.model.SynthesisResult;
import com.jreinhal.veritas.rag.fusion.ResultFuser;
import com.jreinhal.veritas.rag.planner.FastPathMatcher;
import com.jreinhal.veritas.rag.planner.QueryPlanner;
import com.jreinhal.veritas.rag.retrieval.RetrievalCoordinator;
import com.jreinhal.veritas.rag.synthesis.AnswerSynthesizer;
import com.jreinhal.veritas.rag.synthesis.GreetingResponder;
import com.jreinhal.veritas.rag.validation.ValidationGate;
import com.jreinhal.veritas.rag.validation.ValidationOutcome;
import com.jreinhal.veritas.reasoning.ReasoningStep;
import com.jreinhal.veritas.reasoning.ReasoningTrace;
import com.jreinhal.veritas.reasoning.ReasoningTracer;
import com.jreinhal.veritas.util.LogSanitizer;
import com.jreinhal.veritas.workspace.WorkspaceContext;
import jakarta.annotation.PostConstruct;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Entry point of the question answering pipeline: plan, retrieve, fuse, synthesize, validate.
 *
 * <p>Stages run strictly in that order. Greetings and out-of-scope questions skip retrieval and
 * synthesis, but every request that completes has passed through {@link ValidationGate} exactly
 * once. Model failures during synthesis or validation propagate as
 * {@link com.jreinhal.veritas.exception.AnswerUnavailableException}.</p>
 */
@Service
public class GroundedAnswerService {
    private static final Logger log = LoggerFactory.getLogger(GroundedAnswerService.class);

    private final QueryPlanner queryPlanner;
    private final RetrievalCoordinator retrievalCoordinator;
    private final ResultFuser resultFuser;
    private final AnswerSynthesizer answerSynthesizer;
    private final GreetingResponder greetingResponder;
    private final ValidationGate validationGate;
    private final ConversationStore conversationStore;
    private final ReasoningTracer reasoningTracer;
    private final AtomicInteger queryCount = new AtomicInteger(0);
    private final AtomicLong totalLatencyMs = new AtomicLong(0L);

    @Value("${veritas.planner.context-turns:3}")
    private int contextTurns;

    public GroundedAnswerService(QueryPlanner queryPlanner, RetrievalCoordinator retrievalCoordinator, ResultFuser resultFuser,
                                 AnswerSynthesizer answerSynthesizer, GreetingResponder greetingResponder, ValidationGate validationGate,
                                 ConversationStore conversationStore, ReasoningTracer reasoningTracer) {
        this.queryPlanner = queryPlanner;
        this.retrievalCoordinator = retrievalCoordinator;
        this.resultFuser = resultFuser;
        this.answerSynthesizer = answerSynthesizer;
        this.greetingResponder = greetingResponder;
        this.validationGate = validationGate;
        this.conversationStore = conversationStore;
        this.reasoningTracer = reasoningTracer;
    }

    @PostConstruct
    public void init() {
        log.info("Grounded answer service initialized (contextTurns={})", this.contextTurns);
    }

    public int getQueryCount() {
        return this.queryCount.get();
    }

    public long getAverageLatencyMs() {
        int count = this.queryCount.get();
        if (count == 0) {
            return 0L;
        }
        return this.totalLatencyMs.get() / (long) count;
    }

    public AnswerResponse answer(AnswerRequest request) {
        RequestContext context = this.begin(request);
        try {
            this.gatherEvidence(context);
            context.advance(RequestContext.PipelineStage.SYNTHESIZE);
            context.synthesis(this.reasoningTracer.timed(context.trace(), ReasoningStep.StepType.SYNTHESIS, "Answer Synthesis",
                    () -> this.synthesize(context)));
            return this.finish(context);
        }
        finally {
            this.reasoningTracer.endTrace(context.trace());
        }
    }

    /**
     * Streaming variant of {@link #answer}. Answer text is streamed only when grounding evidence was
     * found and the text has started citing it; otherwise the stream carries the terminal event alone. The terminal event always holds
     * the validated answer, which may differ from the streamed text when the gate rejects it.
     */
    public Flux<AnswerEvent> answerStream(AnswerRequest request) {
        return Flux.defer(() -> {
            RequestContext context = this.begin(request);
            Flux<AnswerEvent> events;
            try {
                this.gatherEvidence(context);
                context.advance(RequestContext.PipelineStage.SYNTHESIZE);
            }
            catch (RuntimeException e) {
                this.reasoningTracer.endTrace(context.trace());
                return Flux.error(e);
            }
            if (!this.needsGeneration(context)) {
                events = Mono.fromCallable(() -> {
                    context.synthesis(this.synthesize(context));
                    return (AnswerEvent) new AnswerEvent.Completed(this.finish(context));
                }).flux();
            }
            else {
                AnswerSynthesizer.SynthesisContext synthesisContext = this.answerSynthesizer.prepare(
                        context.plan().resolvedQuery(), context.rankedItems(), context.conversation());
                StringBuilder streamed = new StringBuilder();
                long synthesisStart = System.currentTimeMillis();
                Flux<AnswerEvent> deltas = this.answerSynthesizer.stream(synthesisContext)
                        .doOnNext(streamed::append)
                        .transform(AnswerSynthesizer::holdUntilCited)
                        .map(text -> (AnswerEvent) new AnswerEvent.Delta(text));
                Mono<AnswerEvent> completed = Mono.fromCallable(() -> {
                    context.synthesis(this.answerSynthesizer.interpret(streamed.toString(), synthesisContext));
                    this.reasoningTracer.addStep(context.trace(), ReasoningStep.StepType.SYNTHESIS, "Answer Synthesis (streamed)", "",
                            System.currentTimeMillis() - synthesisStart);
                    return new AnswerEvent.Completed(this.finish(context));
                });
                events = deltas.concatWith(completed);
            }
            return events.doFinally(signal -> this.reasoningTracer.endTrace(context.trace()));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private RequestContext begin(AnswerRequest request) {
        String workspaceId = WorkspaceContext.resolve(request.workspaceId());
        ReasoningTrace trace = this.reasoningTracer.startTrace(request.query(), workspaceId);
        RequestContext context = new RequestContext(request.query(), request.conversationId(), workspaceId, trace);
        context.conversation(this.loadConversation(context));
        log.info("Answering query {} in workspace {} (trace {})", LogSanitizer.querySummary(context.query()), workspaceId, trace.getTraceId());
        return context;
    }

    /**
     * Plan, retrieve and fuse. Retrieval is skipped when the plan rules it out.
     */
    private void gatherEvidence(RequestContext context) {
        long stepStart = System.currentTimeMillis();
        context.advance(RequestContext.PipelineStage.PLAN);
        QueryPlan plan = this.queryPlanner.plan(context.query(), context.conversation());
        context.plan(plan);
        Map<String, Object> planData = new LinkedHashMap<>();
        planData.put("intent", plan.intent().name());
        planData.put("complexity", plan.complexity().name());
        planData.put("followUp", plan.followUp());
        planData.put("subQueries", plan.subQueries().size());
        this.reasoningTracer.addStep(context.trace(),
                plan.intent().skipsRetrieval() ? ReasoningStep.StepType.FAST_PATH : ReasoningStep.StepType.PLANNING,
                "Query Planning", plan.intent() + " / " + plan.complexity(), System.currentTimeMillis() - stepStart, planData);
        if (plan.intent().skipsRetrieval()) {
            return;
        }

        context.advance(RequestContext.PipelineStage.RETRIEVE);
        stepStart = System.currentTimeMillis();
        context.retrieval(this.retrievalCoordinator.retrieve(plan, context.workspaceId()));
        this.reasoningTracer.addStep(context.trace(), ReasoningStep.StepType.RETRIEVAL, "Retrieval",
                "vector=" + context.evidenceCounts().vector() + ", graph=" + context.evidenceCounts().graph(),
                System.currentTimeMillis() - stepStart,
                Map.of("vector", context.evidenceCounts().vector(), "graph", context.evidenceCounts().graph(),
                        "failures", context.retrieval().failures()));

        context.advance(RequestContext.PipelineStage.FUSE);
        stepStart = System.currentTimeMillis();
        context.rankedItems(this.resultFuser.fuse(context.retrieval().vectorItems(), context.retrieval().graphItems(), plan.resolvedQuery()));
        this.reasoningTracer.addStep(context.trace(), ReasoningStep.StepType.FUSION, "Result Fusion",
                context.rankedItems().size() + " ranked items (" + this.resultFuser.strategy() + ")", System.currentTimeMillis() - stepStart);
    }

    private boolean needsGeneration(RequestContext context) {
        return !context.plan().intent().skipsRetrieval() && !context.evidenceCounts().isEmpty();
    }

    private SynthesisResult synthesize(RequestContext context) {
        QueryPlan plan = context.plan();
        if (plan.intent().isSmallTalk()) {
            FastPathMatcher.GreetingKind kind = FastPathMatcher.greetingKind(context.query())
                    .orElse(plan.intent() == Intent.CONVERSATIONAL ? FastPathMatcher.GreetingKind.ACKNOWLEDGEMENT : FastPathMatcher.GreetingKind.HELLO);
            return SynthesisResult.grounded(this.greetingResponder.respond(kind), List.of());
        }
        if (plan.intent() == Intent.OUT_OF_SCOPE || context.evidenceCounts().isEmpty()) {
            return SynthesisResult.rejected(this.answerSynthesizer.rejectionMessage());
        }
        return this.answerSynthesizer.synthesize(plan.resolvedQuery(), context.rankedItems(), context.conversation());
    }

    /**
     * Runs the gate and builds the caller-facing response.
     */
    private AnswerResponse finish(RequestContext context) {
        context.advance(RequestContext.PipelineStage.VALIDATE);
        long stepStart = System.currentTimeMillis();
        List<String> evidence = context.rankedItems().stream().map(RankedItem::content).limit(15L).toList();
        ValidationOutcome outcome = this.validationGate.validate(context.query(), context.plan(), context.synthesis(),
                context.evidenceCounts(), evidence);
        context.outcome(outcome);
        this.reasoningTracer.addStep(context.trace(), ReasoningStep.StepType.VALIDATION, "Validation Gate",
                outcome.verdict() + (outcome.reason() == null ? "" : ": " + outcome.reason()), System.currentTimeMillis() - stepStart);
        context.advance(RequestContext.PipelineStage.DONE);

        QueryPlan plan = context.plan();
        Diagnostics diagnostics = new Diagnostics(plan.intent(), plan.complexity(), context.evidenceCounts(), outcome.verdict(),
                outcome.reason(), context.retrieval().failures(), context.trace().getTraceId());
        long elapsed = context.elapsedMs();
        this.totalLatencyMs.addAndGet(elapsed);
        this.queryCount.incrementAndGet();
        log.info("Query {} finished in {}ms: intent={}, evidence={}, verdict={}", LogSanitizer.querySummary(context.query()), elapsed,
                plan.intent(), context.evidenceCounts().total(), outcome.verdict());
        SynthesisResult result = outcome.result();
        return new AnswerResponse(result.answerText(), result.citations(), result.grounded(), diagnostics);
    }

    private List<ConversationTurn> loadConversation(RequestContext context) {
        if (context.conversationId() == null || context.conversationId().isBlank() || this.contextTurns <= 0) {
            return List.of();
        }
        try {
            return this.conversationStore.recentTurns(context.workspaceId(), context.conversationId(), this.contextTurns);
        }
        catch (RuntimeException e) {
            log.warn("Conversation history unavailable, continuing without it: {}", LogSanitizer.sanitize(e.getMessage()));
            return List.of();
        }
    }
}
