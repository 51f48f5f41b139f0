package com.jreinhal.veritas.rag.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import java.time.Duration;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Asks the model whether the knowledge base could plausibly discuss a question.
 *
 * <p>The judgment only needs to be good enough to skip hopeless retrievals. Anything short of a
 * confident "not relevant" proceeds, and empty retrieval results reject downstream.</p>
 */
@Component
public class RelevanceClassifier {
    private static final String SYSTEM_PROMPT = """
            You decide whether a question could be answered from %s.
            A question is relevant only if that corpus plausibly discusses its topic. Generic advice or
            trivia that merely sounds related is relevant only if the corpus would actually cover it.
            When unsure, answer relevant with low confidence; empty search results are handled later.
            Respond with JSON only: {"relevant": true|false, "confidence": 0.0-1.0, "reason": "short reason"}
            """;

    private final TextGenerationService textGenerationService;
    private final JsonResponseParser jsonResponseParser;

    @Value("${veritas.planner.corpus-description:a knowledge base of transcribed conversations and documents}")
    private String corpusDescription;
    @Value("${veritas.planner.llm-timeout-seconds:20}")
    private long timeoutSeconds;

    public record RelevanceJudgment(boolean relevant, double confidence, String reason) {
    }

    public RelevanceClassifier(TextGenerationService textGenerationService, JsonResponseParser jsonResponseParser) {
        this.textGenerationService = textGenerationService;
        this.jsonResponseParser = jsonResponseParser;
    }

    public RelevanceJudgment judge(String query) {
        String raw = this.textGenerationService.complete(List.of(
                PromptMessage.system(String.format(SYSTEM_PROMPT, this.corpusDescription)),
                PromptMessage.user("Question: " + query)), 0.0, Duration.ofSeconds(this.timeoutSeconds));
        JsonNode node = this.jsonResponseParser.parseObject(raw);
        boolean relevant = node.path("relevant").asBoolean(true);
        double confidence = node.path("confidence").asDouble(0.0);
        return new RelevanceJudgment(relevant, confidence, node.path("reason").asText(""));
    }
}
