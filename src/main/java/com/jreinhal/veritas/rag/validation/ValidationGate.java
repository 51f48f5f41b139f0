package com.jreinhal.veritas.rag.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.veritas.constant.AnswerMessages;
import com.jreinhal.veritas.exception.AnswerUnavailableException;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.LlmUnavailableException;
import com.jreinhal.veritas.llm.MalformedModelOutputException;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.model.Citation;
import com.jreinhal.veritas.model.EvidenceCounts;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.SynthesisResult;
import com.jreinhal.veritas.rag.planner.FastPathMatcher;
import com.jreinhal.veritas.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Last check before an answer leaves the pipeline. Called exactly once per request, on every path.
 *
 * <p>An answer without grounding evidence is replaced by the rejection message unless the query
 * itself is a greeting. Only a verified greeting may pass without citations. Greeting status is recomputed from the raw query; the planner's intent is
 * not trusted here. The model self-check is advisory: unreadable output is ignored, but a model
 * that cannot be reached fails the request.</p>
 */
@Service
public class ValidationGate {
    private static final Logger log = LoggerFactory.getLogger(ValidationGate.class);
    static final String REASON_NO_EVIDENCE = "no grounding evidence";
    static final String REASON_NO_CITATIONS = "answer has no citations";
    static final String REASON_DECLINED = "synthesis declined";
    static final String REASON_UNSUPPORTED = "answer not supported by cited evidence";
    private static final String SELF_CHECK_PROMPT = """
            You verify answers. Decide whether every claim in the answer is supported by the cited sources.
            Respond with JSON only: {"supported": true|false, "confidence": 0.0-1.0, "reason": "short reason"}
            """;

    private final TextGenerationService textGenerationService;
    private final JsonResponseParser jsonResponseParser;

    @Value(AnswerMessages.REJECTION_PROPERTY)
    private String rejectionMessage;
    @Value("${veritas.validation.self-check-enabled:true}")
    private boolean selfCheckEnabled;
    @Value("${veritas.validation.self-check-threshold:0.7}")
    private double selfCheckThreshold;
    @Value("${veritas.validation.timeout-seconds:30}")
    private long timeoutSeconds;

    public ValidationGate(TextGenerationService textGenerationService, JsonResponseParser jsonResponseParser) {
        this.textGenerationService = textGenerationService;
        this.jsonResponseParser = jsonResponseParser;
    }

    @PostConstruct
    public void init() {
        log.info("Validation gate initialized (selfCheck={}, threshold={})", this.selfCheckEnabled, this.selfCheckThreshold);
    }

    public ValidationOutcome validate(String query, QueryPlan plan, SynthesisResult result, EvidenceCounts counts) {
        return this.validate(query, plan, result, counts, List.of());
    }

    /**
     * @param evidence texts the answer was written from, shown to the self-check when present
     */
    public ValidationOutcome validate(String query, QueryPlan plan, SynthesisResult result, EvidenceCounts counts, List<String> evidence) {
        EvidenceCounts evidenceCounts = counts == null ? EvidenceCounts.NONE : counts;
        SynthesisResult candidate = result == null ? SynthesisResult.rejected(this.rejectionMessage) : result;
        boolean verifiedGreeting = FastPathMatcher.isVerifiedGreeting(query);

        if (evidenceCounts.isEmpty() && !verifiedGreeting) {
            String reason = plan != null && plan.rejectionReason() != null ? plan.rejectionReason() : REASON_NO_EVIDENCE;
            log.info("Rejecting query {} without grounding evidence ({})", LogSanitizer.querySummary(query), reason);
            return ValidationOutcome.rejected(SynthesisResult.rejected(this.rejectionMessage), reason);
        }
        if (verifiedGreeting && candidate.grounded() && candidate.citations().isEmpty()
                && !this.rejectionMessage.equals(candidate.answerText())) {
            return ValidationOutcome.accepted(candidate);
        }
        if (!candidate.grounded() || this.rejectionMessage.equals(candidate.answerText())) {
            return ValidationOutcome.rejected(SynthesisResult.rejected(this.rejectionMessage), REASON_DECLINED);
        }
        if (candidate.citations().isEmpty()) {
            log.info("Rejecting uncited answer for query {}", LogSanitizer.querySummary(query));
            return ValidationOutcome.rejected(SynthesisResult.rejected(this.rejectionMessage), REASON_NO_CITATIONS);
        }
        if (this.selfCheckEnabled && !verifiedGreeting && this.isUnsupported(query, candidate, evidence)) {
            return ValidationOutcome.rejected(SynthesisResult.rejected(this.rejectionMessage), REASON_UNSUPPORTED);
        }
        return ValidationOutcome.accepted(candidate);
    }

    private boolean isUnsupported(String query, SynthesisResult candidate, List<String> evidence) {
        String raw;
        try {
            raw = this.textGenerationService.complete(List.of(
                    PromptMessage.system(SELF_CHECK_PROMPT),
                    PromptMessage.user("Question: " + query + "\n\nAnswer:\n" + candidate.answerText()
                            + "\n\nCited sources:\n" + describe(candidate.citations())
                            + (evidence == null || evidence.isEmpty() ? "" : "\n\nEvidence:\n" + String.join("\n---\n", evidence)))),
                    0.0, Duration.ofSeconds(this.timeoutSeconds));
        }
        catch (LlmUnavailableException e) {
            log.error("Answer self-check failed for query {}: {}", LogSanitizer.querySummary(query), LogSanitizer.sanitize(e.getMessage()));
            throw new AnswerUnavailableException(AnswerUnavailableException.Stage.VALIDATION, "Answer validation unavailable", e);
        }
        try {
            JsonNode node = this.jsonResponseParser.parseObject(raw);
            boolean supported = node.path("supported").asBoolean(true);
            double confidence = node.path("confidence").asDouble(0.0);
            if (!supported && confidence > this.selfCheckThreshold) {
                log.info("Self-check rejected answer for query {} (confidence={}, reason={})",
                        LogSanitizer.querySummary(query), confidence, LogSanitizer.sanitize(node.path("reason").asText("")));
                return true;
            }
            return false;
        }
        catch (MalformedModelOutputException e) {
            log.warn("Ignoring unreadable self-check output: {}", e.getMessage());
            return false;
        }
    }

    private static String describe(List<Citation> citations) {
        return citations.stream()
                .map(citation -> "- " + citation.documentLabel() + (citation.locator() == null ? "" : " (" + citation.locator() + ")"))
                .collect(Collectors.joining("\n"));
    }
}
