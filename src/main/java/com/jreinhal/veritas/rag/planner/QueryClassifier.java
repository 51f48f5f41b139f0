package com.jreinhal.veritas.rag.planner;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.model.Complexity;
import com.jreinhal.veritas.model.Intent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Assigns intent and complexity and decomposes non-simple questions into sub-queries.
 *
 * <p>Simple definitions are recognized without a model call. Keyword patterns for comparison,
 * causal and cross-document questions take precedence over the model's intent label.</p>
 */
@Component
public class QueryClassifier {
    private static final Logger log = LoggerFactory.getLogger(QueryClassifier.class);
    static final int MAX_SUB_QUERIES = 4;

    private static final Pattern SIMPLE_DEFINITION = Pattern.compile(
            "^(?:what|who)\\s+(?:is|are|was|were)\\s+(?:an?\\s+|the\\s+)?([^,?]{1,60}?)\\s*\\?*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINE = Pattern.compile("^define\\s+([^,?]{1,60}?)\\s*\\?*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern COMPARISON = Pattern.compile(
            "\\b(compare|comparison|versus|vs\\.?|difference between|differences between|differ)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAUSAL = Pattern.compile(
            "\\b(why|cause|causes|caused|lead to|leads to|result in|results in|effect of|effects of|influence|influences|impact of)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CROSS_SOURCE = Pattern.compile(
            "\\b(across|recurring|recur|recurs|common themes?|in multiple|every episode|all episodes|throughout|repeatedly|most often|frequently)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CONJUNCTION = Pattern.compile("\\b(and|vs|versus|or)\\b|,", Pattern.CASE_INSENSITIVE);
    private static final Pattern CAUSAL_TARGET = Pattern.compile(
            "\\b(?:cause|causes|caused|lead to|leads to|result in|results in|effect of|effects of|influence|influences|impact of)\\s+(.+?)\\s*\\?*$",
            Pattern.CASE_INSENSITIVE);

    private static final String SYSTEM_PROMPT = """
            Classify the user's question for a retrieval system.
            intent: one of knowledge_query, definition, comparison, causal, multi_entity, cross_episode
            complexity: simple (one entity or fact), moderate (comparison or relationship between two entities),
            complex (several entities, multi-step reasoning, or aggregation across documents)
            entities: named people, concepts or topics mentioned
            sub_queries: for moderate or complex questions, 2 to 4 standalone questions that together answer it
            Respond with JSON only:
            {"intent": "...", "complexity": "...", "entities": ["..."], "sub_queries": ["..."]}
            """;

    private final TextGenerationService textGenerationService;
    private final JsonResponseParser jsonResponseParser;

    @Value("${veritas.planner.llm-timeout-seconds:20}")
    private long timeoutSeconds;

    public record Classification(Intent intent, Complexity complexity, Set<String> entities, List<String> subQueries) {
    }

    public QueryClassifier(TextGenerationService textGenerationService, JsonResponseParser jsonResponseParser) {
        this.textGenerationService = textGenerationService;
        this.jsonResponseParser = jsonResponseParser;
    }

    public Classification classify(String query, Set<String> knownEntities) {
        Classification definition = this.matchSimpleDefinition(query, knownEntities);
        if (definition != null) {
            log.debug("Simple definition fast path matched");
            return definition;
        }
        String raw = this.textGenerationService.complete(List.of(
                PromptMessage.system(SYSTEM_PROMPT),
                PromptMessage.user("Question: " + query)), 0.0, Duration.ofSeconds(this.timeoutSeconds));
        JsonNode node = this.jsonResponseParser.parseObject(raw);

        Set<String> entities = new LinkedHashSet<>(knownEntities);
        entities.addAll(JsonResponseParser.textList(node, "entities"));
        Intent intent = this.patternIntent(query);
        if (intent == null) {
            intent = Intent.fromLabel(node.path("intent").asText(), Intent.KNOWLEDGE_QUERY);
            if (intent.skipsRetrieval()) {
                intent = Intent.KNOWLEDGE_QUERY;
            }
        }
        if (intent == Intent.KNOWLEDGE_QUERY && entities.size() > 2) {
            intent = Intent.MULTI_ENTITY;
        }
        Complexity complexity = reconcile(Complexity.fromLabel(node.path("complexity").asText(), Complexity.MODERATE), intent, entities);
        List<String> subQueries = complexity == Complexity.SIMPLE
                ? List.of()
                : decompose(query, intent, entities, JsonResponseParser.textList(node, "sub_queries"));
        return new Classification(intent, complexity, entities, subQueries);
    }

    Classification matchSimpleDefinition(String query, Set<String> knownEntities) {
        String trimmed = query.trim();
        Matcher matcher = SIMPLE_DEFINITION.matcher(trimmed);
        if (!matcher.matches()) {
            matcher = DEFINE.matcher(trimmed);
            if (!matcher.matches()) {
                return null;
            }
        }
        String subject = matcher.group(1).trim();
        if (subject.isEmpty() || subject.split("\\s+").length > 4 || CONJUNCTION.matcher(subject).find()
                || COMPARISON.matcher(trimmed).find() || CAUSAL.matcher(trimmed).find() || CROSS_SOURCE.matcher(trimmed).find()) {
            return null;
        }
        Set<String> entities = new LinkedHashSet<>(knownEntities);
        entities.add(subject);
        return new Classification(Intent.DEFINITION, Complexity.SIMPLE, entities, List.of());
    }

    Intent patternIntent(String query) {
        if (CROSS_SOURCE.matcher(query).find()) {
            return Intent.CROSS_EPISODE;
        }
        if (COMPARISON.matcher(query).find()) {
            return Intent.COMPARISON;
        }
        if (CAUSAL.matcher(query).find()) {
            return Intent.CAUSAL;
        }
        return null;
    }

    static Complexity reconcile(Complexity reported, Intent intent, Set<String> entities) {
        Complexity floor = switch (intent) {
            case COMPARISON, CAUSAL -> Complexity.MODERATE;
            case MULTI_ENTITY, CROSS_EPISODE -> Complexity.COMPLEX;
            default -> Complexity.SIMPLE;
        };
        if (entities.size() > 2) {
            floor = Complexity.COMPLEX;
        }
        return reported.ordinal() >= floor.ordinal() ? reported : floor;
    }

    /**
     * Deterministic decomposition for comparison, multi-entity and causal questions; the model's
     * sub-queries otherwise. Always returns 2 to 4 entries.
     */
    static List<String> decompose(String query, Intent intent, Set<String> entities, List<String> modelSubQueries) {
        Set<String> subQueries = new LinkedHashSet<>();
        switch (intent) {
            case COMPARISON -> {
                for (String entity : entities) {
                    subQueries.add("What is " + entity + "?");
                }
            }
            case MULTI_ENTITY -> {
                for (String entity : entities) {
                    subQueries.add("Tell me about " + entity);
                }
            }
            case CAUSAL -> {
                subQueries.add(query.trim());
                Matcher target = CAUSAL_TARGET.matcher(query.trim());
                String topic = target.find() ? target.group(1) : (entities.isEmpty() ? null : entities.iterator().next());
                if (topic != null && !topic.isBlank()) {
                    subQueries.add("What causes " + topic.replaceAll("[?.!]+$", "") + "?");
                }
            }
            default -> subQueries.addAll(modelSubQueries);
        }
        List<String> ordered = new ArrayList<>(subQueries);
        if (ordered.size() > MAX_SUB_QUERIES - 1) {
            ordered = new ArrayList<>(ordered.subList(0, MAX_SUB_QUERIES - 1));
        }
        if (!containsIgnoreCase(ordered, query.trim())) {
            ordered.add(query.trim());
        }
        if (ordered.size() < 2 && !entities.isEmpty()) {
            String extra = "Tell me about " + entities.iterator().next();
            if (!containsIgnoreCase(ordered, extra)) {
                ordered.add(extra);
            }
        }
        if (ordered.size() < 2) {
            ordered.add("Tell me about " + query.trim().replaceAll("[?.!]+$", ""));
        }
        return List.copyOf(ordered);
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        String lower = candidate.toLowerCase(Locale.ROOT);
        for (String value : values) {
            if (value.toLowerCase(Locale.ROOT).equals(lower)) {
                return true;
            }
        }
        return false;
    }
}
