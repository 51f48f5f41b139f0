package com.jreinhal.veritas.llm;

import io.github.bucket4j.Bandwidth;
import io.github.bucket4j.Bucket;
import io.github.bucket4j.ConsumptionProbe;
import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

/**
 * Process-wide limiter for every call to the language model endpoint.
 *
 * <p>Two token buckets refill per minute: one counts requests, one counts estimated prompt tokens.
 * Calls wait for capacity before they are issued. When the endpoint still answers with a
 * limit-exceeded error the call is retried with exponential backoff plus 0-25% jitter.</p>
 */
@Component
public class LlmRateLimiter {
    private static final Logger log = LoggerFactory.getLogger(LlmRateLimiter.class);
    private static final double MAX_JITTER_FRACTION = 0.25;

    private final Bucket requestBucket;
    private final Bucket tokenBucket;
    private final long tokenCapacity;
    private final int maxRetries;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Sleeper sleeper;
    private final AtomicLong throttledCalls = new AtomicLong();
    private final AtomicLong retriedCalls = new AtomicLong();

    @Autowired
    public LlmRateLimiter(
            @Value("${veritas.llm.rate-limit.requests-per-minute:500}") long requestsPerMinute,
            @Value("${veritas.llm.rate-limit.tokens-per-minute:200000}") long tokensPerMinute,
            @Value("${veritas.llm.rate-limit.max-retries:5}") int maxRetries,
            @Value("${veritas.llm.rate-limit.initial-backoff-ms:1000}") long initialBackoffMs,
            @Value("${veritas.llm.rate-limit.max-backoff-ms:120000}") long maxBackoffMs) {
        this(requestsPerMinute, tokensPerMinute, maxRetries, initialBackoffMs, maxBackoffMs, Thread::sleep);
    }

    LlmRateLimiter(long requestsPerMinute, long tokensPerMinute, int maxRetries, long initialBackoffMs, long maxBackoffMs, Sleeper sleeper) {
        long rpm = Math.max(1L, requestsPerMinute);
        this.tokenCapacity = Math.max(1L, tokensPerMinute);
        this.requestBucket = Bucket.builder()
                .addLimit(Bandwidth.builder().capacity(rpm).refillGreedy(rpm, Duration.ofMinutes(1L)).build())
                .build();
        this.tokenBucket = Bucket.builder()
                .addLimit(Bandwidth.builder().capacity(this.tokenCapacity).refillGreedy(this.tokenCapacity, Duration.ofMinutes(1L)).build())
                .build();
        this.maxRetries = Math.max(0, maxRetries);
        this.initialBackoffMs = Math.max(1L, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.sleeper = sleeper;
        log.info("LLM rate limiter initialized: rpm={}, tpm={}, maxRetries={}, backoff={}..{}ms",
                rpm, this.tokenCapacity, this.maxRetries, this.initialBackoffMs, this.maxBackoffMs);
    }

    /**
     * Run {@code call} once capacity is available, retrying limit-exceeded failures.
     *
     * @throws RateLimitExhaustedException when the endpoint keeps refusing after the retry budget
     */
    public <T> T execute(String operation, int estimatedTokens, Supplier<T> call) {
        int attempt = 0;
        while (true) {
            this.acquire(estimatedTokens);
            try {
                return call.get();
            }
            catch (RuntimeException e) {
                if (!isRateLimitError(e)) {
                    throw e;
                }
                if (attempt >= this.maxRetries) {
                    log.error("LLM rate limit exhausted for '{}' after {} attempts", operation, attempt + 1);
                    throw new RateLimitExhaustedException(operation, attempt + 1, e);
                }
                long delay = this.backoffDelayMs(attempt);
                this.retriedCalls.incrementAndGet();
                log.warn("LLM rate limit hit for '{}' (attempt {}/{}), backing off {}ms",
                        operation, attempt + 1, this.maxRetries + 1, delay);
                this.pause(delay);
                attempt++;
            }
        }
    }

    /**
     * Streaming counterpart of {@link #execute}. A limit-exceeded failure before the first element
     * resubscribes to {@code call} after the same backoff; once an element has been emitted failures
     * pass through unchanged.
     */
    public <T> Flux<T> executeStream(String operation, int estimatedTokens, Supplier<Flux<T>> call) {
        return Flux.defer(() -> {
            AtomicBoolean emitted = new AtomicBoolean();
            AtomicInteger attempt = new AtomicInteger();
            return Flux.defer(() -> {
                        this.acquire(estimatedTokens);
                        return call.get();
                    })
                    .doOnNext(element -> emitted.set(true))
                    .retryWhen(Retry.from(signals -> signals.concatMap(signal -> {
                        Throwable failure = signal.failure();
                        if (emitted.get() || !isRateLimitError(failure)) {
                            return Mono.<Long>error(failure);
                        }
                        int current = attempt.getAndIncrement();
                        if (current >= this.maxRetries) {
                            log.error("LLM rate limit exhausted for '{}' after {} attempts", operation, current + 1);
                            return Mono.<Long>error(new RateLimitExhaustedException(operation, current + 1, failure));
                        }
                        long delay = this.backoffDelayMs(current);
                        this.retriedCalls.incrementAndGet();
                        log.warn("LLM rate limit hit for '{}' (attempt {}/{}), backing off {}ms",
                                operation, current + 1, this.maxRetries + 1, delay);
                        return Mono.fromCallable(() -> {
                            this.pause(delay);
                            return delay;
                        }).subscribeOn(Schedulers.boundedElastic());
                    })));
        });
    }

    /**
     * Block until one request and {@code estimatedTokens} tokens are available.
     */
    public void acquire(int estimatedTokens) {
        long tokens = Math.min(this.tokenCapacity, Math.max(1L, estimatedTokens));
        this.waitFor(this.requestBucket, 1L);
        this.waitFor(this.tokenBucket, tokens);
    }

    long backoffDelayMs(int attempt) {
        long base = this.initialBackoffMs;
        for (int i = 0; i < attempt && base < this.maxBackoffMs; i++) {
            base *= 2L;
        }
        base = Math.min(base, this.maxBackoffMs);
        long jitter = (long) (base * ThreadLocalRandom.current().nextDouble(0.0, MAX_JITTER_FRACTION));
        return base + jitter;
    }

    public long getThrottledCalls() {
        return this.throttledCalls.get();
    }

    public long getRetriedCalls() {
        return this.retriedCalls.get();
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 1;
        }
        return text.length() / 4 + 1;
    }

    static boolean isRateLimitError(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth < 8) {
            if (current.getClass().getSimpleName().contains("RateLimit")) {
                return true;
            }
            String message = current.getMessage();
            if (message != null) {
                String lower = message.toLowerCase(Locale.ROOT);
                if (lower.contains("429") || lower.contains("rate limit") || lower.contains("too many requests")) {
                    return true;
                }
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }

    private void waitFor(Bucket bucket, long tokens) {
        while (true) {
            ConsumptionProbe probe = bucket.tryConsumeAndReturnRemaining(tokens);
            if (probe.isConsumed()) {
                return;
            }
            this.throttledCalls.incrementAndGet();
            long waitMs = Math.max(1L, TimeUnit.NANOSECONDS.toMillis(probe.getNanosToWaitForRefill()));
            this.pause(waitMs);
        }
    }

    private void pause(long millis) {
        try {
            this.sleeper.sleep(millis);
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("Interrupted while waiting for LLM rate limit", e);
        }
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
