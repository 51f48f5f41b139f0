package com.jreinhal.veritas.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

class LlmRateLimiterTest {
    private final List<Long> sleeps = new CopyOnWriteArrayList<>();

    private LlmRateLimiter limiter(long rpm, long tpm, int maxRetries) {
        return new LlmRateLimiter(rpm, tpm, maxRetries, 100L, 400L, sleeps::add);
    }

    @Nested
    @DisplayName("Retry")
    class RetryTest {
        @Test
        @DisplayName("Should retry limit-exceeded failures with growing backoff")
        void shouldRetryRateLimitErrors() {
            LlmRateLimiter limiter = limiter(1000L, 100000L, 5);
            AtomicInteger attempts = new AtomicInteger();

            String result = limiter.execute("complete", 10, () -> {
                if (attempts.incrementAndGet() <= 2) {
                    throw new IllegalStateException("HTTP 429 Too Many Requests");
                }
                return "ok";
            });

            assertThat(result).isEqualTo("ok");
            assertThat(attempts.get()).isEqualTo(3);
            assertThat(limiter.getRetriedCalls()).isEqualTo(2L);
            assertThat(sleeps).hasSize(2);
            assertThat(sleeps.get(0)).isBetween(100L, 125L);
            assertThat(sleeps.get(1)).isBetween(200L, 250L);
        }

        @Test
        @DisplayName("Should give up after the retry budget")
        void shouldExhaustRetries() {
            LlmRateLimiter limiter = limiter(1000L, 100000L, 2);

            assertThatThrownBy(() -> limiter.execute("embed", 10, () -> {
                throw new IllegalStateException("rate limit exceeded");
            }))
                    .isInstanceOf(RateLimitExhaustedException.class)
                    .isInstanceOf(LlmUnavailableException.class)
                    .extracting(e -> ((RateLimitExhaustedException) e).getAttempts())
                    .isEqualTo(3);
        }

        @Test
        @DisplayName("Should pass other failures through without retrying")
        void shouldNotRetryOtherErrors() {
            LlmRateLimiter limiter = limiter(1000L, 100000L, 5);
            AtomicInteger attempts = new AtomicInteger();

            assertThatThrownBy(() -> limiter.execute("complete", 10, () -> {
                attempts.incrementAndGet();
                throw new IllegalArgumentException("bad prompt");
            })).isInstanceOf(IllegalArgumentException.class);
            assertThat(attempts.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }

    @Nested
    @DisplayName("Streaming retry")
    class StreamRetryTest {
        @Test
        @DisplayName("Should resubscribe after limit errors raised before the first element")
        void shouldRetryStreamBeforeFirstElement() {
            LlmRateLimiter limiter = limiter(1000L, 100000L, 5);
            AtomicInteger subscriptions = new AtomicInteger();

            Flux<String> stream = limiter.executeStream("stream", 10, () -> subscriptions.incrementAndGet() <= 2
                    ? Flux.error(new IllegalStateException("HTTP 429 Too Many Requests"))
                    : Flux.just("Creativity ", "matters."));

            StepVerifier.create(stream)
                    .expectNext("Creativity ", "matters.")
                    .verifyComplete();
            assertThat(subscriptions.get()).isEqualTo(3);
            assertThat(limiter.getRetriedCalls()).isEqualTo(2L);
            assertThat(sleeps).hasSize(2);
            assertThat(sleeps.get(0)).isBetween(100L, 125L);
            assertThat(sleeps.get(1)).isBetween(200L, 250L);
        }

        @Test
        @DisplayName("Should stop retrying a stream after the retry budget")
        void shouldExhaustStreamRetries() {
            LlmRateLimiter limiter = limiter(1000L, 100000L, 1);

            StepVerifier.create(limiter.executeStream("stream", 10, () -> Flux.<String>error(new IllegalStateException("rate limit exceeded"))))
                    .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(RateLimitExhaustedException.class)
                            .extracting(error -> ((RateLimitExhaustedException) error).getAttempts()).isEqualTo(2))
                    .verify();
        }

        @Test
        @DisplayName("Should not replay a stream that already emitted text")
        void shouldNotRetryAfterFirstElement() {
            LlmRateLimiter limiter = limiter(1000L, 100000L, 5);
            AtomicInteger subscriptions = new AtomicInteger();

            Flux<String> stream = limiter.executeStream("stream", 10, () -> {
                subscriptions.incrementAndGet();
                return Flux.just("Creativity ").concatWith(Flux.error(new IllegalStateException("HTTP 429")));
            });

            StepVerifier.create(stream)
                    .expectNext("Creativity ")
                    .expectErrorMessage("HTTP 429")
                    .verify();
            assertThat(subscriptions.get()).isEqualTo(1);
            assertThat(sleeps).isEmpty();
        }
    }

    @Test
    @DisplayName("Should wait for token capacity once the bucket is drained")
    void shouldThrottleOnTokenBudget() {
        List<Long> realSleeps = new ArrayList<>();
        LlmRateLimiter limiter = new LlmRateLimiter(100000L, 60000L, 0, 100L, 400L, millis -> {
            realSleeps.add(millis);
            Thread.sleep(millis);
        });

        limiter.acquire(1_000_000);
        limiter.acquire(20);

        assertThat(limiter.getThrottledCalls()).isPositive();
        assertThat(realSleeps).isNotEmpty();
    }

    @Test
    @DisplayName("Should cap backoff at the configured maximum")
    void shouldCapBackoff() {
        LlmRateLimiter limiter = limiter(1000L, 100000L, 5);

        assertThat(limiter.backoffDelayMs(0)).isBetween(100L, 125L);
        assertThat(limiter.backoffDelayMs(8)).isBetween(400L, 500L);
    }

    @Test
    @DisplayName("Should recognize limit errors by type or message anywhere in the cause chain")
    void shouldDetectRateLimitErrors() {
        assertThat(LlmRateLimiter.isRateLimitError(new RuntimeException("wrapper", new IllegalStateException("Too many requests")))).isTrue();
        assertThat(LlmRateLimiter.isRateLimitError(new RateLimitExhaustedException("x", 1, null))).isTrue();
        assertThat(LlmRateLimiter.isRateLimitError(new RuntimeException("connection refused"))).isFalse();
    }

    @Test
    void shouldEstimateTokensFromLength() {
        assertThat(LlmRateLimiter.estimateTokens(null)).isEqualTo(1);
        assertThat(LlmRateLimiter.estimateTokens("abcdefgh")).isEqualTo(3);
    }
}
