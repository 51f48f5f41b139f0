package com.jreinhal.veritas.rag.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.veritas.graph.GraphStore;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.TextGenerationService;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class EntityLinkerTest {
    private TextGenerationService textGenerationService;
    private GraphStore graphStore;
    private EntityLinker linker;

    @BeforeEach
    void setUp() {
        textGenerationService = mock(TextGenerationService.class);
        graphStore = mock(GraphStore.class);
        linker = new EntityLinker(textGenerationService, new JsonResponseParser(new ObjectMapper()));
        ReflectionTestUtils.setField(linker, "aliasConfig", "rubin=Rick Rubin, the zone=Flow State");
        ReflectionTestUtils.setField(linker, "modelFallbackEnabled", true);
        ReflectionTestUtils.setField(linker, "timeoutSeconds", 5L);
        linker.init();
    }

    private void candidates(List<Map<String, Object>> rows) {
        when(graphStore.query(eq(GraphQueries.LINK_CANDIDATES), anyMap())).thenReturn(rows);
    }

    @Nested
    @DisplayName("Deterministic linking")
    class DeterministicTest {
        @Test
        @DisplayName("Should prefer an exact name match and skip the model")
        void shouldLinkExactly() {
            candidates(List.of(
                    Map.of("id", "n2", "name", "Rick Rubin Interview"),
                    Map.of("id", "n1", "name", "Rick Rubin")));

            List<LinkedEntity> linked = linker.link(List.of("Rick Rubin"), graphStore);

            assertThat(linked).containsExactly(new LinkedEntity("Rick Rubin", "Rick Rubin", "n1", LinkedEntity.Method.EXACT));
            verifyNoInteractions(textGenerationService);
        }

        @Test
        @DisplayName("Should resolve configured aliases before substring matches")
        void shouldUseAliases() {
            candidates(List.of(Map.of("id", "n1", "name", "Rick Rubin")));

            List<LinkedEntity> linked = linker.link(List.of("Rubin"), graphStore);

            assertThat(linked).hasSize(1);
            assertThat(linked.get(0).method()).isEqualTo(LinkedEntity.Method.ALIAS);
            assertThat(linked.get(0).canonicalName()).isEqualTo("Rick Rubin");
        }

        @Test
        @DisplayName("Should pick the closest substring match")
        void shouldPickClosestSubstring() {
            candidates(List.of(
                    Map.of("id", "n1", "name", "Creative Habits of Artists"),
                    Map.of("id", "n2", "name", "Creative Habits")));

            List<LinkedEntity> linked = linker.link(List.of("habits"), graphStore);

            assertThat(linked).extracting(LinkedEntity::nodeId).containsExactly("n2");
            assertThat(linked.get(0).method()).isEqualTo(LinkedEntity.Method.SUBSTRING);
        }
    }

    @Nested
    @DisplayName("Model fallback")
    class ModelFallbackTest {
        @Test
        @DisplayName("Should accept only names that exist in the graph")
        void shouldRestrictModelToCandidates() {
            candidates(List.of());
            when(graphStore.query(eq(GraphQueries.PROMINENT_NAMES), anyMap())).thenReturn(List.of(
                    Map.of("id", "n7", "name", "Flow State"),
                    Map.of("id", "n8", "name", "Deliberate Practice")));
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class))).thenReturn("""
                    {"links": {"being absorbed": "Flow State", "grinding": "Invented Concept", "luck": null}}
                    """);

            List<LinkedEntity> linked = linker.link(List.of("being absorbed", "grinding", "luck"), graphStore);

            assertThat(linked).containsExactly(new LinkedEntity("being absorbed", "Flow State", "n7", LinkedEntity.Method.MODEL));
        }

        @Test
        @DisplayName("Should return nothing when the model output is unreadable")
        void shouldSurviveMalformedOutput() {
            candidates(List.of());
            when(graphStore.query(eq(GraphQueries.PROMINENT_NAMES), anyMap())).thenReturn(List.of(Map.of("id", "n7", "name", "Flow State")));
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class))).thenReturn("no idea");

            assertThat(linker.link(List.of("being absorbed"), graphStore)).isEmpty();
        }
    }

    @Test
    @DisplayName("Should parse alias pairs and normalize both sides")
    void shouldParseAliases() {
        Map<String, String> aliases = EntityLinker.parseAliases("Rubin = Rick Rubin; bad-entry, =x, The Zone=Flow State");

        assertThat(aliases).containsEntry("rubin", "rick rubin").containsEntry("zone", "flow state").hasSize(2);
    }
}
