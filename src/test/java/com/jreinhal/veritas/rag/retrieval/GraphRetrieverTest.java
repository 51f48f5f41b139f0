package com.jreinhal.veritas.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.veritas.graph.GraphStore;
import com.jreinhal.veritas.model.Complexity;
import com.jreinhal.veritas.model.GraphTraversalMode;
import com.jreinhal.veritas.model.Intent;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.RetrievalStrategy;
import com.jreinhal.veritas.model.RetrievedItem;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class GraphRetrieverTest {
    private EntityLinker entityLinker;
    private GraphStore graphStore;
    private GraphRetriever retriever;

    @BeforeEach
    void setUp() {
        entityLinker = mock(EntityLinker.class);
        graphStore = mock(GraphStore.class);
        retriever = new GraphRetriever(entityLinker);
        ReflectionTestUtils.setField(retriever, "limit", 10);
        ReflectionTestUtils.setField(retriever, "maxHops", 3);
    }

    private static QueryPlan plan(String query, Intent intent, Set<String> entities, GraphTraversalMode mode) {
        return new QueryPlan(query, query, false, intent, Complexity.MODERATE, entities, List.of(),
                RetrievalStrategy.both(false, mode), null);
    }

    private static Map<String, Object> path(List<String> nodes, List<String> rels, double relevance, List<String> sources) {
        return Map.of("node_names", nodes, "rel_types", rels, "end_name", nodes.get(nodes.size() - 1),
                "source_ids", sources, "relevance", relevance);
    }

    @Nested
    @DisplayName("Multi-hop")
    class MultiHopTest {
        @Test
        @DisplayName("Should order paths by hop count, then by relevance")
        void shouldOrderByHopsThenRelevance() {
            List<RetrievedItem> items = GraphRetriever.multiHopItems(List.of(
                    path(List.of("A", "B", "C"), List.of("R1", "R2"), 5.0, List.of("ep1")),
                    path(List.of("A", "D"), List.of("R3"), 1.0, List.of("ep2")),
                    path(List.of("A", "E"), List.of("R4"), 2.0, List.of("ep3"))));

            assertThat(items).extracting(item -> item.provenance().hopCount()).containsExactly(1, 1, 2);
            assertThat(items.get(0).provenance().relationPath()).containsExactly("A", "R4", "E");
            assertThat(items.get(2).content()).startsWith("A -[R1]- B -[R2]- C");
        }

        @Test
        @DisplayName("Should skip rows whose path shape is inconsistent")
        void shouldSkipMalformedRows() {
            List<RetrievedItem> items = GraphRetriever.multiHopItems(List.of(
                    path(List.of("A", "B"), List.of(), 1.0, List.of()),
                    path(List.of("A"), List.of(), 1.0, List.of())));

            assertThat(items).isEmpty();
        }

        @Test
        @DisplayName("Should restrict causal questions to causal relationships and retry without the restriction")
        void shouldRetryWithoutCausalRestriction() {
            when(entityLinker.link(any(), any())).thenReturn(List.of(
                    new LinkedEntity("Meditation", "Meditation", "n1", LinkedEntity.Method.EXACT)));
            List<Boolean> restricted = new ArrayList<>();
            when(graphStore.query(anyString(), anyMap())).thenAnswer(invocation -> {
                Map<String, Object> params = invocation.getArgument(1);
                boolean hasRestriction = params.containsKey("rel_types");
                restricted.add(hasRestriction);
                return hasRestriction ? List.of() : List.of(path(List.of("Meditation", "Focus"), List.of("RELATES_TO"), 1.0, List.of("ep4")));
            });

            List<RetrievedItem> items = retriever.retrieve(
                    plan("What does meditation lead to?", Intent.CAUSAL, Set.of("Meditation"), GraphTraversalMode.MULTI_HOP), graphStore);

            assertThat(restricted).containsExactly(true, false);
            assertThat(items).hasSize(1);
            assertThat(items.get(0).provenance().documentId()).isEqualTo("ep4");
        }
    }

    @Test
    @DisplayName("Should rank cross-source nodes by distinct source count")
    void shouldRankCrossSourceByDistinctSources() {
        List<RetrievedItem> items = GraphRetriever.crossSource(List.of(
                Map.of("name", "Discipline", "source_ids", List.of("ep1", "ep1", "ep1", "ep2")),
                Map.of("name", "Curiosity", "source_ids", List.of("ep1", "ep2", "ep3")),
                Map.of("name", "Orphan", "source_ids", List.of())));

        assertThat(items).extracting(RetrievedItem::relevanceScore).containsExactly(3.0, 2.0);
        assertThat(items.get(0).content()).contains("Curiosity").contains("Referenced in 3 source documents");
    }

    @Test
    @DisplayName("Should describe neighbouring relations for entity-centric matches")
    void shouldDescribeEntityRelations() {
        List<RetrievedItem> items = GraphRetriever.entityCentric(List.of(Map.of(
                "id", "n1", "name", "Rick Rubin", "label", "Person", "description", "Music producer",
                "source_ids", List.of("ep9"), "relevance", 3L,
                "relations", List.of(Map.of("type", "DISCUSSES", "name", "Creativity", "outgoing", true)))));

        assertThat(items).hasSize(1);
        assertThat(items.get(0).content()).isEqualTo("Rick Rubin (Person): Music producer. Relations: Rick Rubin DISCUSSES Creativity.");
        assertThat(items.get(0).relevanceScore()).isEqualTo(3.0);
        assertThat(items.get(0).provenance().documentId()).isEqualTo("ep9");
    }

    @Test
    @DisplayName("Should not query the graph without any anchor")
    void shouldSkipWithoutAnchors() {
        when(entityLinker.link(any(), any())).thenReturn(List.of());

        List<RetrievedItem> items = retriever.retrieve(
                plan("what is it", Intent.KNOWLEDGE_QUERY, Set.of(), GraphTraversalMode.ENTITY_CENTRIC), graphStore);

        assertThat(items).isEmpty();
        verifyNoInteractions(graphStore);
    }

    @Test
    @DisplayName("Should fall back to query terms when no entity links")
    void shouldUseTermsWhenNothingLinks() {
        when(entityLinker.link(any(), any())).thenReturn(List.of());
        List<Map<String, Object>> captured = new ArrayList<>();
        when(graphStore.query(anyString(), anyMap())).thenAnswer(invocation -> {
            captured.add(Map.copyOf(invocation.getArgument(1)));
            return List.of();
        });

        retriever.retrieve(plan("How does curiosity shape learning?", Intent.KNOWLEDGE_QUERY, Set.of(), GraphTraversalMode.ENTITY_CENTRIC), graphStore);

        assertThat(captured).hasSize(1);
        assertThat(captured.get(0).get("names")).isEqualTo(List.of());
        assertThat(captured.get(0).get("terms")).isEqualTo(List.of("curiosity", "shape", "learning"));
    }
}
