package com.jreinhal.veritas.rag.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.veritas.constant.AnswerMessages;
import com.jreinhal.veritas.exception.AnswerUnavailableException;
import com.jreinhal.veritas.llm.JsonResponseParser;
import com.jreinhal.veritas.llm.LlmUnavailableException;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.model.Citation;
import com.jreinhal.veritas.model.EvidenceCounts;
import com.jreinhal.veritas.model.Intent;
import com.jreinhal.veritas.model.QueryPlan;
import com.jreinhal.veritas.model.SourceType;
import com.jreinhal.veritas.model.SynthesisResult;
import com.jreinhal.veritas.model.Verdict;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class ValidationGateTest {
    private static final String QUERY = "What does Rick Rubin say about creativity?";
    private static final Citation CITATION = new Citation(SourceType.VECTOR, "Rick Rubin Interview", "00:12:34", null, 1.0);

    private TextGenerationService textGenerationService;
    private ValidationGate gate;

    @BeforeEach
    void setUp() {
        textGenerationService = mock(TextGenerationService.class);
        gate = new ValidationGate(textGenerationService, new JsonResponseParser(new ObjectMapper()));
        ReflectionTestUtils.setField(gate, "rejectionMessage", AnswerMessages.DEFAULT_REJECTION);
        ReflectionTestUtils.setField(gate, "selfCheckEnabled", false);
        ReflectionTestUtils.setField(gate, "selfCheckThreshold", 0.7);
        ReflectionTestUtils.setField(gate, "timeoutSeconds", 30L);
    }

    private static SynthesisResult grounded() {
        return SynthesisResult.grounded("Creativity is a way of being [S1].", List.of(CITATION));
    }

    @Nested
    @DisplayName("Grounding")
    class GroundingTest {
        @Test
        @DisplayName("Should replace any answer produced without evidence")
        void shouldRejectAnswerWithoutEvidence() {
            ValidationOutcome outcome = gate.validate(QUERY, null, grounded(), EvidenceCounts.NONE);

            assertThat(outcome.verdict()).isEqualTo(Verdict.REJECTED);
            assertThat(outcome.reason()).isEqualTo(ValidationGate.REASON_NO_EVIDENCE);
            assertThat(outcome.result().answerText()).isEqualTo(AnswerMessages.DEFAULT_REJECTION);
            assertThat(outcome.result().citations()).isEmpty();
        }

        @Test
        @DisplayName("Should carry the planner's rejection reason for out-of-scope queries")
        void shouldUsePlanRejectionReason() {
            QueryPlan plan = QueryPlan.outOfScope("What's the weather?", "weather");

            ValidationOutcome outcome = gate.validate("What's the weather?", plan,
                    SynthesisResult.rejected(AnswerMessages.DEFAULT_REJECTION), EvidenceCounts.NONE);

            assertThat(outcome.reason()).isEqualTo("weather");
        }

        @Test
        @DisplayName("Should accept a greeting reply without evidence or citations")
        void shouldAcceptVerifiedGreeting() {
            SynthesisResult greeting = SynthesisResult.grounded("Hello! Ask me anything about the knowledge base.", List.of());

            ValidationOutcome outcome = gate.validate("Hi", QueryPlan.smallTalk("Hi", Intent.GREETING), greeting, EvidenceCounts.NONE);

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.result().grounded()).isTrue();
            assertThat(outcome.result().answerText()).startsWith("Hello!");
            assertThat(outcome.result().citations()).isEmpty();
        }

        @Test
        @DisplayName("Should replace an ungrounded greeting reply with the rejection message")
        void shouldNotAcceptUngroundedGreetingReply() {
            SynthesisResult reply = new SynthesisResult("Hello there!", List.of(), false);

            ValidationOutcome outcome = gate.validate("hello", QueryPlan.smallTalk("hello", Intent.GREETING), reply, EvidenceCounts.NONE);

            assertThat(outcome.isAccepted()).isFalse();
            assertThat(outcome.result().grounded()).isFalse();
            assertThat(outcome.result().answerText()).isEqualTo(AnswerMessages.DEFAULT_REJECTION);
        }

        @Test
        @DisplayName("Should not trust a greeting intent for a query that is not a greeting")
        void shouldRecomputeGreetingFromQuery() {
            SynthesisResult reply = new SynthesisResult("Hello there!", List.of(), false);

            ValidationOutcome outcome = gate.validate("hello, what is the capital of Peru?",
                    QueryPlan.smallTalk("hello, what is the capital of Peru?", Intent.GREETING), reply, EvidenceCounts.NONE);

            assertThat(outcome.isAccepted()).isFalse();
        }

        @Test
        @DisplayName("Should reject declined and uncited answers")
        void shouldRejectDeclinedAndUncited() {
            EvidenceCounts counts = new EvidenceCounts(3, 2);

            ValidationOutcome declined = gate.validate(QUERY, null, SynthesisResult.rejected(AnswerMessages.DEFAULT_REJECTION), counts);
            ValidationOutcome uncited = gate.validate(QUERY, null, SynthesisResult.grounded("Creativity matters.", List.of()), counts);

            assertThat(declined.reason()).isEqualTo(ValidationGate.REASON_DECLINED);
            assertThat(uncited.reason()).isEqualTo(ValidationGate.REASON_NO_CITATIONS);
            assertThat(uncited.result().answerText()).isEqualTo(AnswerMessages.DEFAULT_REJECTION);
        }

        @Test
        @DisplayName("Should accept a cited answer with evidence")
        void shouldAcceptGroundedAnswer() {
            ValidationOutcome outcome = gate.validate(QUERY, null, grounded(), new EvidenceCounts(0, 2));

            assertThat(outcome.isAccepted()).isTrue();
            assertThat(outcome.reason()).isNull();
            assertThat(outcome.result().citations()).containsExactly(CITATION);
            verifyNoInteractions(textGenerationService);
        }
    }

    @Nested
    @DisplayName("Self-check")
    class SelfCheckTest {
        @BeforeEach
        void enable() {
            ReflectionTestUtils.setField(gate, "selfCheckEnabled", true);
        }

        @Test
        @DisplayName("Should reject when the model is confident the answer is unsupported")
        void shouldRejectConfidentlyUnsupported() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class)))
                    .thenReturn("```json\n{\"supported\": false, \"confidence\": 0.9, \"reason\": \"invented quote\"}\n```");

            ValidationOutcome outcome = gate.validate(QUERY, null, grounded(), new EvidenceCounts(3, 0), List.of("passage"));

            assertThat(outcome.reason()).isEqualTo(ValidationGate.REASON_UNSUPPORTED);
        }

        @Test
        @DisplayName("Should keep the answer when the model is unsure")
        void shouldAcceptLowConfidenceObjection() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class)))
                    .thenReturn("{\"supported\": false, \"confidence\": 0.7}");

            assertThat(gate.validate(QUERY, null, grounded(), new EvidenceCounts(3, 0)).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("Should ignore unreadable self-check output")
        void shouldIgnoreMalformedOutput() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class))).thenReturn("Looks fine to me.");

            assertThat(gate.validate(QUERY, null, grounded(), new EvidenceCounts(3, 0)).isAccepted()).isTrue();
        }

        @Test
        @DisplayName("Should fail the request when the model cannot be reached")
        void shouldFailWhenModelUnavailable() {
            when(textGenerationService.complete(anyList(), anyDouble(), any(Duration.class)))
                    .thenThrow(new LlmUnavailableException("timed out", null, true));

            assertThatThrownBy(() -> gate.validate(QUERY, null, grounded(), new EvidenceCounts(3, 0)))
                    .isInstanceOf(AnswerUnavailableException.class)
                    .extracting(e -> ((AnswerUnavailableException) e).getStage())
                    .isEqualTo(AnswerUnavailableException.Stage.VALIDATION);
        }

        @Test
        @DisplayName("Should skip the self-check for greetings")
        void shouldSkipSelfCheckForGreeting() {
            ValidationOutcome outcome = gate.validate("hello", null, grounded(), new EvidenceCounts(1, 0));

            assertThat(outcome.isAccepted()).isTrue();
            verifyNoInteractions(textGenerationService);
        }
    }
}
