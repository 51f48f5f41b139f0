package com.jreinhal.veritas.rag.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.veritas.constant.StopWords;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.util.LogSanitizer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates paraphrases of a query for multi-query vector retrieval.
 *
 * <p>Model paraphrases come first; rule-based reformulations and synonym swaps fill the remainder
 * and act as the fallback when the model is unavailable.</p>
 */
@Component
public class QueryExpander {
    private static final Logger log = LoggerFactory.getLogger(QueryExpander.class);
    static final int MIN_VARIANTS = 3;
    static final int MAX_VARIANTS = 5;

    private static final String EXPANSION_PROMPT = """
            Generate %d alternative phrasings of the question below for a search engine. Each variation must
            keep the original intent, use different words or question forms, and stand on its own.
            Respond with JSON only: {"variations": ["...", "..."]}

            Question: %s
            """;

    private static final List<Map.Entry<String, String>> SYNONYMS = List.of(
            Map.entry("improve", "enhance"),
            Map.entry("practice", "method"),
            Map.entry("relate", "connect"),
            Map.entry("explain", "describe"),
            Map.entry("cause", "lead to"),
            Map.entry("important", "significant"),
            Map.entry("idea", "concept"),
            Map.entry("help", "support"),
            Map.entry("believe", "think")
    );

    private final TextGenerationService textGenerationService;
    private final JsonResponseParser jsonResponseParser;

    @Value("${veritas.retrieval.llm-expansion:true}")
    private boolean llmExpansionEnabled;
    @Value("${veritas.retrieval.expansion-timeout-seconds:3}")
    private long timeoutSeconds;

    public QueryExpander(TextGenerationService textGenerationService, JsonResponseParser jsonResponseParser) {
        this.textGenerationService = textGenerationService;
        this.jsonResponseParser = jsonResponseParser;
    }

    /**
     * @param count requested variants, clamped to 3..5; the original query is never included
     */
    public List<String> expand(String query, int count) {
        if (query == null || query.isBlank()) {
            return List.of();
        }
        int target = Math.max(MIN_VARIANTS, Math.min(MAX_VARIANTS, count));
        List<String> candidates = new ArrayList<>();
        if (this.llmExpansionEnabled) {
            candidates.addAll(this.generateLlmVariants(query, target));
        }
        candidates.addAll(generateReformulations(query));
        candidates.addAll(generateSynonymVariants(query));
        String keywords = keywordVariant(query);
        if (keywords != null) {
            candidates.add(keywords);
        }

        Set<String> seen = new LinkedHashSet<>();
        seen.add(normalize(query));
        List<String> result = new ArrayList<>();
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank() && seen.add(normalize(candidate))) {
                result.add(candidate.trim());
                if (result.size() >= target) {
                    break;
                }
            }
        }
        log.debug("Expanded query {} into {} variants", LogSanitizer.querySummary(query), result.size());
        return result;
    }

    private List<String> generateLlmVariants(String query, int count) {
        try {
            String raw = this.textGenerationService.complete(
                    List.of(PromptMessage.user(EXPANSION_PROMPT.formatted(count, query))),
                    0.3, Duration.ofSeconds(this.timeoutSeconds));
            JsonNode node = this.jsonResponseParser.parseObject(raw);
            return JsonResponseParser.textList(node, "variations");
        }
        catch (RuntimeException e) {
            log.warn("LLM query expansion failed, using rule-based variants: {}", LogSanitizer.sanitize(e.getMessage()));
            return List.of();
        }
    }

    static List<String> generateReformulations(String query) {
        List<String> variants = new ArrayList<>();
        String trimmed = query.trim();
        String statement = trimmed.replaceAll("[?.!]+$", "");
        String lower = statement.toLowerCase(Locale.ROOT);
        if (lower.startsWith("what is ") || lower.startsWith("who is ")) {
            String subject = statement.substring(lower.indexOf(" is ") + 4);
            variants.add("How is " + subject + " defined?");
            variants.add("Tell me about " + subject);
            variants.add("What does " + subject + " involve?");
        }
        else if (lower.startsWith("what are ")) {
            String subject = statement.substring(9);
            variants.add("Tell me about " + subject);
            variants.add("Describe " + subject);
        }
        else if (lower.startsWith("how does ")) {
            String rest = statement.substring(9);
            variants.add("What is the relationship between " + rest + "?");
            variants.add("Tell me about " + rest);
        }
        else if (lower.startsWith("why ")) {
            String subject = statement.substring(4);
            variants.add("Reasons for " + subject);
            variants.add("Explanation of why " + subject);
        }
        else {
            variants.add("Tell me about " + statement);
            variants.add("What is known about " + statement + "?");
        }
        return variants;
    }

    static List<String> generateSynonymVariants(String query) {
        List<String> variants = new ArrayList<>();
        String lower = query.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : SYNONYMS) {
            if (lower.contains(entry.getKey())) {
                String variant = query.replaceAll("(?i)\\b" + entry.getKey() + "\\b", entry.getValue());
                if (!variant.equalsIgnoreCase(query)) {
                    variants.add(variant);
                }
            }
        }
        return variants;
    }

    static String keywordVariant(String query) {
        List<String> keywords = new ArrayList<>();
        for (String token : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}'-]+")) {
            if (token.length() > 2 && !StopWords.GRAPH_TERMS.contains(token)) {
                keywords.add(token);
            }
        }
        return keywords.size() >= 2 ? String.join(" ", keywords) : null;
    }

    private static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[?.!]+$", "").trim();
    }
}
