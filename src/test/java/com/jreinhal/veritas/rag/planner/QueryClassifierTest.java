package com.jreinhal.veritas.rag.planner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.model.Complexity;
import com.jreinhal.veritas.model.Intent;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class QueryClassifierTest {
    private TextGenerationService textGenerationService;
    private QueryClassifier classifier;

    @BeforeEach
    void setUp() {
        textGenerationService = mock(TextGenerationService.class);
        classifier = new QueryClassifier(textGenerationService, new JsonResponseParser(new ObjectMapper()));
        ReflectionTestUtils.setField(classifier, "timeoutSeconds", 5L);
    }

    private void modelReplies(String json) {
        when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class))).thenReturn(json);
    }

    @Nested
    @DisplayName("Definition fast path")
    class DefinitionTest {
        @Test
        @DisplayName("Should classify a short definition without calling the model")
        void shouldSkipModelForDefinitions() {
            QueryClassifier.Classification result = classifier.classify("What is creativity?", Set.of());

            assertThat(result.intent()).isEqualTo(Intent.DEFINITION);
            assertThat(result.complexity()).isEqualTo(Complexity.SIMPLE);
            assertThat(result.entities()).containsExactly("creativity");
            assertThat(result.subQueries()).isEmpty();
            verifyNoInteractions(textGenerationService);
        }

        @Test
        @DisplayName("Should not take the fast path for comparisons phrased as definitions")
        void shouldNotMatchConjunctions() {
            assertThat(classifier.matchSimpleDefinition("What is the difference between focus and flow?", Set.of())).isNull();
            assertThat(classifier.matchSimpleDefinition("Who are Rick and Brian?", Set.of())).isNull();
        }
    }

    @Nested
    @DisplayName("Model classification")
    class ModelTest {
        @Test
        @DisplayName("Should let comparison wording override the model's intent and decompose per entity")
        void shouldDecomposeComparisons() {
            modelReplies("""
                    Here you go: {"intent": "knowledge_query", "complexity": "simple", "entities": ["Rick Rubin", "Brian Eno"], "sub_queries": []}
                    """);

            QueryClassifier.Classification result = classifier.classify("Compare Rick Rubin and Brian Eno", Set.of());

            assertThat(result.intent()).isEqualTo(Intent.COMPARISON);
            assertThat(result.complexity()).isEqualTo(Complexity.MODERATE);
            assertThat(result.subQueries())
                    .containsExactly("What is Rick Rubin?", "What is Brian Eno?", "Compare Rick Rubin and Brian Eno");
        }

        @Test
        @DisplayName("Should never accept a small-talk intent from the model")
        void shouldDowngradeSmallTalkIntent() {
            modelReplies("{\"intent\": \"greeting\", \"complexity\": \"simple\", \"entities\": []}");

            QueryClassifier.Classification result = classifier.classify("Tell me about the creative process", Set.of());

            assertThat(result.intent()).isEqualTo(Intent.KNOWLEDGE_QUERY);
            assertThat(result.subQueries()).isEmpty();
        }

        @Test
        @DisplayName("Should treat more than two entities as a multi-entity question")
        void shouldPromoteToMultiEntity() {
            modelReplies("{\"intent\": \"knowledge_query\", \"complexity\": \"moderate\", \"entities\": [\"Music\", \"Painting\", \"Writing\"]}");

            QueryClassifier.Classification result = classifier.classify("Tell me about music, painting and writing habits", Set.of());

            assertThat(result.intent()).isEqualTo(Intent.MULTI_ENTITY);
            assertThat(result.complexity()).isEqualTo(Complexity.COMPLEX);
            assertThat(result.subQueries()).hasSizeBetween(2, 4);
        }
    }

    @Nested
    @DisplayName("Decomposition bounds")
    class DecompositionTest {
        @Test
        @DisplayName("Should cap sub-queries at four including the original question")
        void shouldCapSubQueries() {
            Set<String> entities = new LinkedHashSet<>(List.of("A1", "B2", "C3", "D4", "E5", "F6"));

            List<String> subQueries = QueryClassifier.decompose("Tell me about all of them", Intent.MULTI_ENTITY, entities, List.of());

            assertThat(subQueries).hasSize(4);
            assertThat(subQueries.get(3)).isEqualTo("Tell me about all of them");
        }

        @Test
        @DisplayName("Should pad to at least two sub-queries")
        void shouldPadSubQueries() {
            List<String> subQueries = QueryClassifier.decompose("How do habits form?", Intent.KNOWLEDGE_QUERY, Set.of(), List.of());

            assertThat(subQueries).hasSize(2).contains("How do habits form?");
        }

        @Test
        @DisplayName("Should raise complexity to the intent's floor")
        void shouldApplyComplexityFloor() {
            assertThat(QueryClassifier.reconcile(Complexity.SIMPLE, Intent.CAUSAL, Set.of())).isEqualTo(Complexity.MODERATE);
            assertThat(QueryClassifier.reconcile(Complexity.SIMPLE, Intent.CROSS_EPISODE, Set.of())).isEqualTo(Complexity.COMPLEX);
            assertThat(QueryClassifier.reconcile(Complexity.COMPLEX, Intent.DEFINITION, Set.of())).isEqualTo(Complexity.COMPLEX);
        }
    }
}
