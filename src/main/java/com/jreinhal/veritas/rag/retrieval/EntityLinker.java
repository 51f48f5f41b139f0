package com.jreinhal.veritas.rag.retrieval;

import com.fasterxml.jackson.databind.JsonNode;
import com.jreinhal.veritas.graph.GraphStore;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps surface-form entities to graph node names.
 *
 * <p>A deterministic pass (exact name, alias table, substring) runs first. The model is consulted
 * only when that pass links nothing, and may only choose among node names read from the graph.</p>
 */
@Component
public class EntityLinker {
    private static final Logger log = LoggerFactory.getLogger(EntityLinker.class);
    private static final int CANDIDATE_LIMIT = 50;
    private static final int MODEL_CANDIDATE_LIMIT = 200;

    private static final String LINKING_PROMPT = """
            Match each surface form to the knowledge graph node name that refers to the same thing.
            Only use names from the candidate list. Use null when nothing matches.
            Respond with JSON only: {"links": {"<surface form>": "<candidate name or null>"}}

            Surface forms: %s
            Candidates: %s
            """;

    private final TextGenerationService textGenerationService;
    private final JsonResponseParser jsonResponseParser;
    private final Map<String, String> aliases = new HashMap<>();

    @Value("${veritas.entity-linking.aliases:}")
    private String aliasConfig;
    @Value("${veritas.entity-linking.model-fallback:true}")
    private boolean modelFallbackEnabled;
    @Value("${veritas.entity-linking.timeout-seconds:10}")
    private long timeoutSeconds;

    public EntityLinker(TextGenerationService textGenerationService, JsonResponseParser jsonResponseParser) {
        this.textGenerationService = textGenerationService;
        this.jsonResponseParser = jsonResponseParser;
    }

    @PostConstruct
    public void init() {
        this.aliases.clear();
        this.aliases.putAll(parseAliases(this.aliasConfig));
        log.info("Entity linker initialized with {} aliases (modelFallback={})", this.aliases.size(), this.modelFallbackEnabled);
    }

    public List<LinkedEntity> link(Collection<String> entities, GraphStore graphStore) {
        Map<String, String> surfaces = new LinkedHashMap<>();
        for (String entity : entities) {
            String normalized = normalize(entity);
            if (normalized.length() >= 2) {
                surfaces.put(normalized, entity);
            }
        }
        if (surfaces.isEmpty()) {
            return List.of();
        }
        List<LinkedEntity> linked = this.linkDeterministic(surfaces, graphStore);
        if (!linked.isEmpty() || !this.modelFallbackEnabled) {
            return linked;
        }
        return this.linkWithModel(surfaces, graphStore);
    }

    List<LinkedEntity> linkDeterministic(Map<String, String> surfaces, GraphStore graphStore) {
        List<String> lookups = new ArrayList<>();
        for (String surface : surfaces.keySet()) {
            lookups.add(surface);
            String alias = this.aliases.get(surface);
            if (alias != null) {
                lookups.add(alias);
            }
        }
        List<Map<String, Object>> rows = graphStore.query(GraphQueries.LINK_CANDIDATES, Map.of("surfaces", lookups, "limit", CANDIDATE_LIMIT));
        List<LinkedEntity> linked = new ArrayList<>();
        for (Map.Entry<String, String> surface : surfaces.entrySet()) {
            LinkedEntity best = bestMatch(surface.getKey(), surface.getValue(), this.aliases.get(surface.getKey()), rows);
            if (best != null) {
                linked.add(best);
            }
        }
        return linked;
    }

    private List<LinkedEntity> linkWithModel(Map<String, String> surfaces, GraphStore graphStore) {
        try {
            List<Map<String, Object>> rows = graphStore.query(GraphQueries.PROMINENT_NAMES, Map.of("limit", MODEL_CANDIDATE_LIMIT));
            Map<String, Map<String, Object>> byName = new LinkedHashMap<>();
            for (Map<String, Object> row : rows) {
                Object name = row.get("name");
                if (name != null) {
                    byName.putIfAbsent(name.toString().toLowerCase(Locale.ROOT), row);
                }
            }
            if (byName.isEmpty()) {
                return List.of();
            }
            List<String> candidateNames = new ArrayList<>();
            byName.values().forEach(row -> candidateNames.add(row.get("name").toString()));
            String raw = this.textGenerationService.complete(List.of(PromptMessage.user(
                            LINKING_PROMPT.formatted(String.join(", ", surfaces.values()), String.join(", ", candidateNames)))),
                    0.0, Duration.ofSeconds(this.timeoutSeconds));
            JsonNode links = this.jsonResponseParser.parseObject(raw).path("links");
            List<LinkedEntity> linked = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = links.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (field.getValue().isNull()) {
                    continue;
                }
                Map<String, Object> row = byName.get(field.getValue().asText("").toLowerCase(Locale.ROOT));
                if (row != null) {
                    linked.add(new LinkedEntity(field.getKey(), row.get("name").toString(), String.valueOf(row.get("id")), LinkedEntity.Method.MODEL));
                }
            }
            log.debug("Model-assisted linking resolved {} of {} entities", linked.size(), surfaces.size());
            return linked;
        }
        catch (RuntimeException e) {
            log.warn("Model-assisted entity linking failed: {}", LogSanitizer.sanitize(e.getMessage()));
            return List.of();
        }
    }

    private static LinkedEntity bestMatch(String surface, String original, String alias, List<Map<String, Object>> rows) {
        LinkedEntity substring = null;
        int substringDistance = Integer.MAX_VALUE;
        LinkedEntity aliasMatch = null;
        for (Map<String, Object> row : rows) {
            Object rawName = row.get("name");
            if (rawName == null) {
                continue;
            }
            String name = rawName.toString();
            String lower = name.toLowerCase(Locale.ROOT);
            String id = String.valueOf(row.get("id"));
            if (lower.equals(surface)) {
                return new LinkedEntity(original, name, id, LinkedEntity.Method.EXACT);
            }
            if (alias != null && lower.equals(alias) && aliasMatch == null) {
                aliasMatch = new LinkedEntity(original, name, id, LinkedEntity.Method.ALIAS);
            }
            if (lower.contains(surface) || surface.contains(lower)) {
                int distance = Math.abs(lower.length() - surface.length());
                if (distance < substringDistance || (distance == substringDistance && name.compareTo(substring.canonicalName()) < 0)) {
                    substring = new LinkedEntity(original, name, id, LinkedEntity.Method.SUBSTRING);
                    substringDistance = distance;
                }
            }
        }
        return aliasMatch != null ? aliasMatch : substring;
    }

    static Map<String, String> parseAliases(String config) {
        Map<String, String> parsed = new HashMap<>();
        if (config == null || config.isBlank()) {
            return parsed;
        }
        for (String pair : config.split("[,;]")) {
            int separator = pair.indexOf('=');
            if (separator <= 0 || separator == pair.length() - 1) {
                continue;
            }
            String alias = normalize(pair.substring(0, separator));
            String canonical = normalize(pair.substring(separator + 1));
            if (!alias.isEmpty() && !canonical.isEmpty()) {
                parsed.put(alias, canonical);
            }
        }
        return parsed;
    }

    static String normalize(String entity) {
        if (entity == null) {
            return "";
        }
        String lower = entity.toLowerCase(Locale.ROOT).replaceAll("[^\\p{L}\\p{N}\\s'-]", " ").replaceAll("\\s+", " ").trim();
        return lower.startsWith("the ") ? lower.substring(4) : lower;
    }
}
