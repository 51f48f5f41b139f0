package com.jreinhal.veritas.rag.retrieval;

import com.jreinhal.veritas.constant.StopWords;
import com.jreinhal.veritas.graph.GraphStore;
import com.jreinhal.veritas.model.GraphTraversalMode;
import com.jreinhal.veritas.model.Provenance;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.RetrievedItem;
import com.jreinhal.veritas.model.SourceType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Knowledge graph retrieval in one of three traversal modes.
 *
 * <ul>
 *   <li>entity-centric: matched nodes with a few neighbouring relations, best match first</li>
 *   <li>multi-hop: bounded paths from linked nodes, fewest hops first, then native relevance</li>
 *   <li>cross-source: nodes referenced by the most distinct source documents first</li>
 * </ul>
 */
@Component
public class GraphRetriever {
    private static final Logger log = LoggerFactory.getLogger(GraphRetriever.class);
    private static final int MAX_TERMS = 8;
    private static final Pattern CAUSAL_WORDING = Pattern.compile(
            "\\b(cause|causes|caused|influence|influences|lead to|leads to|improve|improves|enable|enables|optimi[sz]e)\\b",
            Pattern.CASE_INSENSITIVE);

    private final EntityLinker entityLinker;

    @Value("${veritas.retrieval.graph-limit:10}")
    private int limit;
    @Value("${veritas.retrieval.max-hops:3}")
    private int maxHops;

    public GraphRetriever(EntityLinker entityLinker) {
        this.entityLinker = entityLinker;
    }

    public List<RetrievedItem> retrieve(QueryPlan plan, GraphStore graphStore) {
        List<LinkedEntity> linked = this.entityLinker.link(plan.entities(), graphStore);
        List<String> names = new ArrayList<>();
        for (LinkedEntity entity : linked) {
            names.add(entity.canonicalName().toLowerCase(Locale.ROOT));
        }
        List<String> terms = names.isEmpty() ? extractTerms(plan.resolvedQuery(), plan.entities()) : List.of();
        if (names.isEmpty() && terms.isEmpty()) {
            log.debug("No graph anchors for query, skipping graph retrieval");
            return List.of();
        }
        GraphTraversalMode mode = plan.retrievalStrategy().graphTraversalMode();
        Map<String, Object> params = new HashMap<>();
        params.put("names", names);
        params.put("terms", terms);
        params.put("limit", this.limit);
        List<RetrievedItem> items = switch (mode) {
            case MULTI_HOP -> this.multiHop(plan, graphStore, params);
            case CROSS_SOURCE -> crossSource(graphStore.query(GraphQueries.CROSS_SOURCE, params));
            case ENTITY_CENTRIC -> entityCentric(graphStore.query(GraphQueries.ENTITY_CENTRIC, params));
        };
        log.debug("Graph retrieval ({}) returned {} items from {} linked entities", mode, items.size(), linked.size());
        return items;
    }

    private List<RetrievedItem> multiHop(QueryPlan plan, GraphStore graphStore, Map<String, Object> params) {
        boolean causal = CAUSAL_WORDING.matcher(plan.resolvedQuery()).find();
        if (causal) {
            params.put("rel_types", GraphQueries.CAUSAL_RELATIONSHIPS);
        }
        List<RetrievedItem> items = multiHopItems(graphStore.query(GraphQueries.multiHop(this.maxHops, causal), params));
        if (items.isEmpty() && causal) {
            params.remove("rel_types");
            items = multiHopItems(graphStore.query(GraphQueries.multiHop(this.maxHops, false), params));
        }
        return items;
    }

    static List<RetrievedItem> entityCentric(List<Map<String, Object>> rows) {
        List<RetrievedItem> items = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String name = text(row.get("name"));
            if (name.isEmpty()) {
                continue;
            }
            StringBuilder content = new StringBuilder(describe(name, text(row.get("label")), text(row.get("description"))));
            List<String> relations = new ArrayList<>();
            if (row.get("relations") instanceof List<?> list) {
                for (Object element : list) {
                    if (element instanceof Map<?, ?> relation && relation.get("name") != null && relation.get("type") != null) {
                        boolean outgoing = Boolean.TRUE.equals(relation.get("outgoing"));
                        relations.add(outgoing
                                ? name + " " + relation.get("type") + " " + relation.get("name")
                                : relation.get("name") + " " + relation.get("type") + " " + name);
                    }
                }
            }
            if (!relations.isEmpty()) {
                content.append(" Relations: ").append(String.join("; ", relations)).append('.');
            }
            List<String> sources = distinct(row.get("source_ids"));
            String documentId = sources.isEmpty() ? text(row.get("id")) : sources.get(0);
            items.add(new RetrievedItem(SourceType.GRAPH, content.toString(),
                    new Provenance(documentId, null, null, null, List.of(name)), number(row.get("relevance"))));
        }
        return items;
    }

    static List<RetrievedItem> multiHopItems(List<Map<String, Object>> rows) {
        List<RetrievedItem> items = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            List<String> nodes = strings(row.get("node_names"));
            List<String> relationships = strings(row.get("rel_types"));
            if (nodes.size() < 2 || relationships.size() != nodes.size() - 1) {
                continue;
            }
            List<String> path = new ArrayList<>();
            StringBuilder content = new StringBuilder();
            for (int i = 0; i < nodes.size(); i++) {
                path.add(nodes.get(i));
                content.append(nodes.get(i));
                if (i < relationships.size()) {
                    path.add(relationships.get(i));
                    content.append(" -[").append(relationships.get(i)).append("]- ");
                }
            }
            String endDescription = text(row.get("end_description"));
            if (!endDescription.isEmpty()) {
                content.append(". ").append(text(row.get("end_name"))).append(": ").append(endDescription);
            }
            List<String> sources = distinct(row.get("source_ids"));
            String documentId = sources.isEmpty() ? text(row.get("end_name")) : sources.get(0);
            items.add(new RetrievedItem(SourceType.GRAPH, content.toString(),
                    new Provenance(documentId, null, null, null, path), number(row.get("relevance"))));
        }
        items.sort(Comparator.comparingInt((RetrievedItem item) -> item.provenance().hopCount())
                .thenComparing(Comparator.comparingDouble(RetrievedItem::relevanceScore).reversed()));
        return items;
    }

    static List<RetrievedItem> crossSource(List<Map<String, Object>> rows) {
        List<RetrievedItem> items = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String name = text(row.get("name"));
            List<String> sources = distinct(row.get("source_ids"));
            if (name.isEmpty() || sources.isEmpty()) {
                continue;
            }
            String content = describe(name, text(row.get("label")), text(row.get("description")))
                    + " Referenced in " + sources.size() + " source documents.";
            items.add(new RetrievedItem(SourceType.GRAPH, content,
                    new Provenance(sources.get(0), null, null, null, List.of(name)), sources.size()));
        }
        items.sort(Comparator.comparingDouble(RetrievedItem::relevanceScore).reversed());
        return items;
    }

    static List<String> extractTerms(String query, Set<String> entities) {
        Set<String> terms = new LinkedHashSet<>();
        for (String entity : entities) {
            String lower = entity.toLowerCase(Locale.ROOT).trim();
            if (lower.length() >= 3) {
                terms.add(lower);
            }
        }
        if (query != null) {
            for (String token : query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}'-]+")) {
                if (token.length() >= 3 && !StopWords.GRAPH_TERMS.contains(token)) {
                    terms.add(token);
                }
            }
        }
        List<String> ordered = new ArrayList<>(terms);
        return ordered.size() > MAX_TERMS ? List.copyOf(ordered.subList(0, MAX_TERMS)) : List.copyOf(ordered);
    }

    private static String describe(String name, String label, String description) {
        StringBuilder text = new StringBuilder(name);
        if (!label.isEmpty()) {
            text.append(" (").append(label).append(')');
        }
        if (!description.isEmpty()) {
            text.append(": ").append(description);
        }
        if (text.charAt(text.length() - 1) != '.') {
            text.append('.');
        }
        return text.toString();
    }

    private static List<String> distinct(Object value) {
        return List.copyOf(new LinkedHashSet<>(strings(value)));
    }

    private static List<String> strings(Object value) {
        List<String> result = new ArrayList<>();
        if (value instanceof List<?> list) {
            for (Object element : list) {
                if (element != null && !element.toString().isBlank()) {
                    result.add(element.toString());
                }
            }
        }
        return result;
    }

    private static String text(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    private static double number(Object value) {
        return value instanceof Number n ? n.doubleValue() : 0.0;
    }
}
