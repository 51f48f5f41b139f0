package com.jreinhal.veritas.rag.retrieval;

import java.util.List;

/**
 * Parameterized Cypher for graph retrieval. Every pattern is scoped by {@code $workspace_id} and
 * variable-length patterns carry an explicit upper bound.
 */
final class GraphQueries {
    static final int MIN_HOPS = 2;
    static final int MAX_HOPS = 3;

    static final List<String> CAUSAL_RELATIONSHIPS = List.of("INFLUENCES", "CAUSES", "OPTIMIZES", "ENABLES", "LEADS_TO");

    static final String LINK_CANDIDATES = """
            MATCH (n)
            WHERE n.workspace_id = $workspace_id
              AND n.name IS NOT NULL AND size(n.name) >= 3
              AND any(s IN $surfaces WHERE toLower(n.name) = s OR toLower(n.name) CONTAINS s OR s CONTAINS toLower(n.name))
            RETURN coalesce(n.id, n.name) AS id, n.name AS name
            LIMIT $limit
            """;

    static final String PROMINENT_NAMES = """
            MATCH (n)
            WHERE n.workspace_id = $workspace_id AND n.name IS NOT NULL
            RETURN coalesce(n.id, n.name) AS id, n.name AS name
            ORDER BY size(coalesce(n.source_ids, [])) DESC, n.name ASC
            LIMIT $limit
            """;

    static final String ENTITY_CENTRIC = """
            MATCH (c)
            WHERE c.workspace_id = $workspace_id
              AND c.name IS NOT NULL
              AND (toLower(c.name) IN $names
                   OR any(term IN $terms WHERE toLower(c.name) CONTAINS term OR toLower(coalesce(c.description, '')) CONTAINS term))
            OPTIONAL MATCH (c)-[r]-(other)
            WHERE other.workspace_id = $workspace_id
            WITH c, collect(DISTINCT {type: type(r), name: other.name, outgoing: startNode(r) = c})[0..5] AS relations
            RETURN coalesce(c.id, c.name) AS id, c.name AS name, labels(c)[0] AS label, c.description AS description,
                   coalesce(c.source_ids, []) AS source_ids, relations,
                   CASE WHEN toLower(c.name) IN $names THEN 3
                        WHEN any(term IN $terms WHERE toLower(c.name) CONTAINS term) THEN 2
                        ELSE 1 END AS relevance
            ORDER BY relevance DESC, size(coalesce(c.source_ids, [])) DESC, c.name ASC
            LIMIT $limit
            """;

    private static final String MULTI_HOP_TEMPLATE = """
            MATCH path = (start)-[rels*1..%d]-(end)
            WHERE start.workspace_id = $workspace_id
              AND all(n IN nodes(path) WHERE n.workspace_id = $workspace_id)
              AND start <> end
              AND (toLower(start.name) IN $names OR any(term IN $terms WHERE toLower(start.name) CONTAINS term))
              %s
            RETURN [n IN nodes(path) | n.name] AS node_names,
                   [rel IN relationships(path) | type(rel)] AS rel_types,
                   end.name AS end_name, end.description AS end_description,
                   coalesce(end.source_ids, []) AS source_ids,
                   length(path) AS hops,
                   CASE WHEN toLower(end.name) IN $names THEN 2 ELSE 1 END AS relevance
            ORDER BY hops ASC, relevance DESC
            LIMIT $limit
            """;

    static final String CROSS_SOURCE = """
            MATCH (c)
            WHERE c.workspace_id = $workspace_id
              AND c.name IS NOT NULL
              AND c.source_ids IS NOT NULL
              AND ((size($names) = 0 AND size($terms) = 0)
                   OR toLower(c.name) IN $names
                   OR any(term IN $terms WHERE toLower(c.name) CONTAINS term OR toLower(coalesce(c.description, '')) CONTAINS term))
            WITH c, reduce(seen = [], s IN c.source_ids | CASE WHEN s IN seen THEN seen ELSE seen + s END) AS distinct_sources
            WHERE size(distinct_sources) > 1
            RETURN coalesce(c.id, c.name) AS id, c.name AS name, labels(c)[0] AS label, c.description AS description,
                   distinct_sources AS source_ids
            ORDER BY size(distinct_sources) DESC, c.name ASC
            LIMIT $limit
            """;

    private GraphQueries() {
    }

    /**
     * Bounds the configured maximum path length to 2..3. Paths always start at one hop.
     */
    static int clampHops(int maxHops) {
        return Math.max(MIN_HOPS, Math.min(MAX_HOPS, maxHops));
    }

    /**
     * The hop bound is an integer literal because Cypher does not accept parameters in variable-length bounds.
     */
    static String multiHop(int maxHops, boolean restrictRelationshipTypes) {
        String relationshipFilter = restrictRelationshipTypes
                ? "AND all(rel IN rels WHERE type(rel) IN $rel_types)"
                : "";
        return String.format(MULTI_HOP_TEMPLATE, clampHops(maxHops), relationshipFilter);
    }
}
