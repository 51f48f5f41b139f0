package com.jreinhal.veritas.rag.synthesis;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.jreinhal.veritas.constant.AnswerMessages;
import com.jreinhal.veritas.exception.AnswerUnavailableException;
import com.jreinhal.veritas.llm.LlmUnavailableException;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.model.Citation;
import com.jreinhal.veritas.model.ConversationTurn;
import com.jreinhal.veritas.model.Provenance;
import com.jreinhal.veritas.model.RankedItem;
import com.jreinhal.veritas.model.RetrievedItem;
import com.jreinhal.veritas.model.SourceType;
import com.jreinhal.veritas.model.SynthesisResult;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class AnswerSynthesizerTest {
    private TextGenerationService textGenerationService;
    private AnswerSynthesizer synthesizer;

    @BeforeEach
    void setUp() {
        textGenerationService = mock(TextGenerationService.class);
        synthesizer = new AnswerSynthesizer(textGenerationService);
        ReflectionTestUtils.setField(synthesizer, "rejectionMessage", AnswerMessages.DEFAULT_REJECTION);
        ReflectionTestUtils.setField(synthesizer, "vectorContext", 5);
        ReflectionTestUtils.setField(synthesizer, "graphContext", 10);
        ReflectionTestUtils.setField(synthesizer, "temperature", 0.2);
        ReflectionTestUtils.setField(synthesizer, "timeoutSeconds", 60L);
    }

    private static RankedItem passage(String content, String documentId, String locator, double fusionScore) {
        return new RankedItem(new RetrievedItem(SourceType.VECTOR, content, Provenance.of(documentId, null, locator, "SPEAKER_01"), 0.8),
                null, fusionScore, null, 0);
    }

    private static RankedItem fact(String content, double fusionScore) {
        return new RankedItem(new RetrievedItem(SourceType.GRAPH, content,
                new Provenance("ep_7", null, null, null, List.of("Rick Rubin", "DISCUSSES", "Creativity")), 2.0),
                null, fusionScore, null, 0);
    }

    private List<RankedItem> evidence() {
        return List.of(
                passage("Rick Rubin says creativity is a way of being.", "rick_rubin_interview.mp3", "754", 0.032),
                passage("He describes listening as the core of production.", "rick_rubin_interview.mp3", "1210", 0.016),
                fact("Rick Rubin -[DISCUSSES]- Creativity", 0.024));
    }

    @Nested
    @DisplayName("Empty evidence")
    class EmptyEvidenceTest {
        @Test
        @DisplayName("Should return the rejection message without calling the model")
        void shouldRejectWithoutModelCall() {
            SynthesisResult result = synthesizer.synthesize("What is creativity?", List.of(), List.of());

            assertThat(result.grounded()).isFalse();
            assertThat(result.answerText()).isEqualTo(AnswerMessages.DEFAULT_REJECTION);
            assertThat(result.citations()).isEmpty();
            verifyNoInteractions(textGenerationService);
        }

        @Test
        @DisplayName("Should not stream for an empty context")
        void shouldNotStreamEmptyContext() {
            AnswerSynthesizer.SynthesisContext context = synthesizer.prepare("q", null, null);

            StepVerifier.create(synthesizer.stream(context)).verifyComplete();
            verifyNoInteractions(textGenerationService);
        }
    }

    @Nested
    @DisplayName("Citations")
    class CitationTest {
        @Test
        @DisplayName("Should cite marked sources in order of first appearance and drop unknown markers")
        void shouldCiteOnlyValidMarkers() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class)))
                    .thenReturn("Creativity is a way of being [S1]. Rubin links it to creativity itself [S3, S9]. Again [S1].");

            SynthesisResult result = synthesizer.synthesize("What does Rick Rubin say about creativity?", evidence(), List.of());

            assertThat(result.grounded()).isTrue();
            assertThat(result.citations()).hasSize(2);
            Citation first = result.citations().get(0);
            assertThat(first.documentLabel()).isEqualTo("Rick Rubin Interview");
            assertThat(first.locator()).isEqualTo("00:12:34");
            assertThat(first.speakerLabel()).isEqualTo("Speaker 2");
            assertThat(first.confidence()).isCloseTo(1.0, offset(1e-9));
            Citation second = result.citations().get(1);
            assertThat(second.sourceType()).isEqualTo(SourceType.GRAPH);
            assertThat(second.locator()).isEqualTo("Rick Rubin -> DISCUSSES -> Creativity");
            assertThat(second.confidence()).isCloseTo(0.75, offset(1e-9));
        }

        @Test
        @DisplayName("Should cite every context item at reduced confidence when the answer carries no markers")
        void shouldCiteAllContextWhenUnmarked() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class)))
                    .thenReturn("Creativity is described as a way of being.");

            SynthesisResult result = synthesizer.synthesize("What is creativity?", evidence(), List.of());

            assertThat(result.grounded()).isTrue();
            assertThat(result.citations()).hasSize(3);
            assertThat(result.citations().get(0).confidence()).isCloseTo(0.5, offset(1e-9));
        }

        @Test
        @DisplayName("Should cap context per source type in ranked order")
        void shouldCapContext() {
            ReflectionTestUtils.setField(synthesizer, "vectorContext", 1);
            ReflectionTestUtils.setField(synthesizer, "graphContext", 0);

            List<RankedItem> selected = synthesizer.selectContext(evidence());

            assertThat(selected).extracting(RankedItem::content).containsExactly("Rick Rubin says creativity is a way of being.");
        }
    }

    @Nested
    @DisplayName("Declines and failures")
    class DeclineTest {
        @Test
        @DisplayName("Should map a model decline to the rejection message")
        void shouldMapDecline() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class))).thenReturn("NO_ANSWER");

            SynthesisResult result = synthesizer.synthesize("What is the capital of Peru?", evidence(), List.of());

            assertThat(result.grounded()).isFalse();
            assertThat(result.answerText()).isEqualTo(AnswerMessages.DEFAULT_REJECTION);
        }

        @Test
        @DisplayName("Should recognize natural language declines but not cited answers")
        void shouldDetectDeclineWording() {
            assertThat(AnswerSynthesizer.isDecline("I couldn't find that in the provided sources.")).isTrue();
            assertThat(AnswerSynthesizer.isDecline("The context does not mention Peru.")).isTrue();
            assertThat(AnswerSynthesizer.isDecline("The context does not mention Peru, but [S1] covers Chile.")).isFalse();
            assertThat(AnswerSynthesizer.isDecline("Creativity is a practice [S2].")).isFalse();
        }

        @Test
        @DisplayName("Should raise a retryable synthesis failure when the model is unavailable")
        void shouldWrapModelFailure() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class)))
                    .thenThrow(new LlmUnavailableException("connection refused"));

            assertThatThrownBy(() -> synthesizer.synthesize("What is creativity?", evidence(), List.of()))
                    .isInstanceOf(AnswerUnavailableException.class)
                    .satisfies(e -> {
                        AnswerUnavailableException failure = (AnswerUnavailableException) e;
                        assertThat(failure.getStage()).isEqualTo(AnswerUnavailableException.Stage.SYNTHESIS);
                        assertThat(failure.isRetryable()).isTrue();
                    });
        }

        @Test
        @DisplayName("Should map streaming failures to synthesis failures")
        void shouldWrapStreamFailure() {
            when(textGenerationService.stream(anyList(), anyDouble(), any(Duration.class)))
                    .thenReturn(Flux.concat(Flux.just("Creativity "), Flux.error(new LlmUnavailableException("reset"))));
            AnswerSynthesizer.SynthesisContext context = synthesizer.prepare("What is creativity?", evidence(), List.of());

            StepVerifier.create(synthesizer.stream(context))
                    .expectNext("Creativity ")
                    .expectError(AnswerUnavailableException.class)
                    .verify();
        }
    }

    @Test
    @DisplayName("Should hold streamed text until it cites a source")
    void shouldHoldStreamUntilCited() {
        StepVerifier.create(AnswerSynthesizer.holdUntilCited(Flux.just("Creativity ", "is a way ", "of being [S1]", " and more.")))
                .expectNext("Creativity ", "is a way ", "of being [S1]", " and more.")
                .verifyComplete();
        StepVerifier.create(AnswerSynthesizer.holdUntilCited(Flux.just("NO_", "ANSWER [S1]")))
                .verifyComplete();
        StepVerifier.create(AnswerSynthesizer.holdUntilCited(Flux.just("The sources don't ", "mention it.")))
                .verifyComplete();
    }

    @Test
    @DisplayName("Should include conversation turns and numbered context in the prompt")
    void shouldBuildPrompt() {
        when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class))).thenReturn("It is a way of being [S1].");
        List<ConversationTurn> history = List.of(
                new ConversationTurn(ConversationTurn.Role.USER, "Who is Rick Rubin?", Instant.now()),
                new ConversationTurn(ConversationTurn.Role.ASSISTANT, "A music producer [S1].", Instant.now()));

        synthesizer.synthesize("What does he say about creativity?", evidence(), history);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<PromptMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(textGenerationService).complete(captor.capture(), anyDouble(), any(Duration.class));
        List<PromptMessage> messages = new ArrayList<>(captor.getValue());
        assertThat(messages).extracting(PromptMessage::role).containsExactly(
                PromptMessage.Role.SYSTEM, PromptMessage.Role.USER, PromptMessage.Role.ASSISTANT, PromptMessage.Role.USER);
        String prompt = messages.get(3).content();
        assertThat(prompt).contains("[S1] (passage, Rick Rubin Interview, 00:12:34, speaker: Speaker 2)")
                .contains("[S3] (graph, Ep 7, Rick Rubin -> DISCUSSES -> Creativity)")
                .endsWith("Question: What does he say about creativity?");
    }
}
