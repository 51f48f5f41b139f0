package com.jreinhal.veritas.reasoning;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.jreinhal.veritas.util.LogSanitizer;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Starts, records and retains request traces. Traces are passed explicitly because a streaming
 * request crosses threads.
 */
@Component
public class ReasoningTracer {
    private static final Logger log = LoggerFactory.getLogger(ReasoningTracer.class);

    @Value("${veritas.reasoning.detailed-traces:false}")
    private boolean detailedTraces;
    private final Cache<String, ReasoningTrace> traceCache = Caffeine.newBuilder()
            .maximumSize(1000L)
            .expireAfterWrite(Duration.ofHours(1L))
            .build();

    public ReasoningTrace startTrace(String query, String workspaceId) {
        ReasoningTrace trace = new ReasoningTrace(LogSanitizer.querySummary(query), workspaceId);
        log.debug("Started trace {} for workspace {}", trace.getTraceId(), workspaceId);
        return trace;
    }

    public void addStep(ReasoningTrace trace, ReasoningStep.StepType type, String label, String detail, long durationMs) {
        this.addStep(trace, type, label, detail, durationMs, Map.of());
    }

    public void addStep(ReasoningTrace trace, ReasoningStep.StepType type, String label, String detail, long durationMs, Map<String, Object> data) {
        if (trace == null) {
            return;
        }
        trace.addStep(ReasoningStep.of(type, label, detail, durationMs, data));
        if (this.detailedTraces) {
            log.debug("Trace[{}] Step: {} - {} ({}ms)", trace.getTraceId(), type, label, durationMs);
        }
    }

    /**
     * Run {@code operation}, recording its duration as a step, or an ERROR step when it throws.
     */
    public <T> T timed(ReasoningTrace trace, ReasoningStep.StepType type, String label, Supplier<T> operation) {
        long startTime = System.currentTimeMillis();
        T result;
        try {
            result = operation.get();
        }
        catch (RuntimeException e) {
            this.addStep(trace, ReasoningStep.StepType.ERROR, label + " (Failed)", LogSanitizer.sanitize(e.getMessage()),
                    System.currentTimeMillis() - startTime);
            throw e;
        }
        this.addStep(trace, type, label, "", System.currentTimeMillis() - startTime);
        return result;
    }

    public void endTrace(ReasoningTrace trace) {
        if (trace == null) {
            return;
        }
        trace.complete();
        this.traceCache.put(trace.getTraceId(), trace);
        log.debug("Completed {}", trace.getSummary());
    }

    public Optional<ReasoningTrace> getTrace(String traceId) {
        return Optional.ofNullable(this.traceCache.getIfPresent(traceId));
    }
}
