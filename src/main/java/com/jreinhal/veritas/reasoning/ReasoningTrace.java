package com.jreinhal.veritas.reasoning;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Record of the stages one request went through, with timings and metrics.
 *
 * <p>Stages of a streaming request may finish on different threads, so mutators are synchronized.</p>
 */
public class ReasoningTrace {

    private final String traceId;
    private final Instant timestamp;
    private final String querySummary;
    private final String workspaceId;
    private final List<ReasoningStep> steps;
    private final Map<String, Object> metrics;
    private long totalDurationMs;
    private boolean completed;

    public ReasoningTrace(String querySummary, String workspaceId) {
        this.traceId = UUID.randomUUID().toString().substring(0, 8);
        this.timestamp = Instant.now();
        this.querySummary = querySummary;
        this.workspaceId = workspaceId;
        this.steps = new ArrayList<>();
        this.metrics = new LinkedHashMap<>();
    }

    public synchronized void addStep(ReasoningStep step) {
        this.steps.add(step);
        this.totalDurationMs += step.durationMs();
    }

    public synchronized void addMetric(String key, Object value) {
        this.metrics.put(key, value);
    }

    public synchronized void complete() {
        this.completed = true;
    }

    public String getTraceId() {
        return this.traceId;
    }

    public Instant getTimestamp() {
        return this.timestamp;
    }

    /**
     * Length and hash of the query; the raw text is never stored in a trace.
     */
    public String getQuerySummary() {
        return this.querySummary;
    }

    public String getWorkspaceId() {
        return this.workspaceId;
    }

    public synchronized List<ReasoningStep> getSteps() {
        return Collections.unmodifiableList(new ArrayList<>(this.steps));
    }

    public synchronized Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(this.metrics));
    }

    public synchronized long getTotalDurationMs() {
        return this.totalDurationMs;
    }

    public synchronized boolean isCompleted() {
        return this.completed;
    }

    public synchronized String getSummary() {
        return String.format("Trace[%s]: %d steps, %dms total, %s",
                this.traceId, this.steps.size(), this.totalDurationMs, this.completed ? "COMPLETED" : "IN_PROGRESS");
    }

    public synchronized List<Map<String, Object>> getStepsAsMaps() {
        List<Map<String, Object>> stepMaps = new ArrayList<>();
        for (ReasoningStep step : this.steps) {
            Map<String, Object> stepMap = new LinkedHashMap<>();
            stepMap.put("type", step.type().name().toLowerCase());
            stepMap.put("label", step.label());
            stepMap.put("detail", step.detail());
            stepMap.put("durationMs", step.durationMs());
            if (!step.data().isEmpty()) {
                stepMap.put("data", step.data());
            }
            stepMaps.add(stepMap);
        }
        return stepMaps;
    }
}
