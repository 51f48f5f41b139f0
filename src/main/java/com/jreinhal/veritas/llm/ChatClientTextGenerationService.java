package com.jreinhal.veritas.llm;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

/**
 * {@link TextGenerationService} backed by a Spring AI {@link ChatClient}.
 *
 * <p>Blocking completions run on the dedicated {@code llmExecutor} so a slow model never holds a
 * request thread past its timeout.</p>
 */
@Service
public class ChatClientTextGenerationService implements TextGenerationService {
    private static final Logger log = LoggerFactory.getLogger(ChatClientTextGenerationService.class);

    private final ChatClient chatClient;
    private final LlmRateLimiter rateLimiter;
    private final ExecutorService llmExecutor;

    public ChatClientTextGenerationService(ChatClient.Builder builder, LlmRateLimiter rateLimiter,
                                           @Qualifier("llmExecutor") ExecutorService llmExecutor) {
        this.chatClient = builder.build();
        this.rateLimiter = rateLimiter;
        this.llmExecutor = llmExecutor;
    }

    @Override
    public String complete(List<PromptMessage> messages, double temperature, Duration timeout) {
        int estimatedTokens = estimateTokens(messages);
        CompletableFuture<String> future;
        try {
            future = CompletableFuture.supplyAsync(
                    () -> this.rateLimiter.execute("complete", estimatedTokens, () -> this.call(messages, temperature)),
                    this.llmExecutor);
        }
        catch (RejectedExecutionException e) {
            throw new LlmUnavailableException("LLM executor saturated", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        catch (TimeoutException e) {
            future.cancel(true);
            log.warn("LLM completion timed out after {}ms", timeout.toMillis());
            throw new LlmUnavailableException("LLM completion timed out after " + timeout.toMillis() + "ms", e, true);
        }
        catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmUnavailableException("Interrupted while waiting for LLM completion", e);
        }
        catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LlmUnavailableException unavailable) {
                throw unavailable;
            }
            log.error("LLM completion failed: {}", cause.getMessage());
            throw new LlmUnavailableException("LLM completion failed: " + cause.getMessage(), cause);
        }
    }

    @Override
    public Flux<String> stream(List<PromptMessage> messages, double temperature, Duration idleTimeout) {
        int estimatedTokens = estimateTokens(messages);
        return this.rateLimiter.executeStream("stream", estimatedTokens, () -> this.chatClient.prompt()
                        .messages(toSpringMessages(messages))
                        .options(ChatOptions.builder().temperature(temperature).build())
                        .stream()
                        .content())
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(idleTimeout)
                .onErrorMap(e -> !(e instanceof LlmUnavailableException), e -> {
                    boolean timedOut = e instanceof TimeoutException;
                    log.error("LLM stream failed: {}", e.getMessage());
                    return new LlmUnavailableException("LLM stream failed: " + e.getMessage(), e, timedOut);
                });
    }

    private String call(List<PromptMessage> messages, double temperature) {
        String content = this.chatClient.prompt()
                .messages(toSpringMessages(messages))
                .options(ChatOptions.builder().temperature(temperature).build())
                .call()
                .content();
        return content == null ? "" : content;
    }

    static List<Message> toSpringMessages(List<PromptMessage> messages) {
        List<Message> converted = new ArrayList<>(messages.size());
        for (PromptMessage message : messages) {
            converted.add(switch (message.role()) {
                case SYSTEM -> new SystemMessage(message.content());
                case USER -> new UserMessage(message.content());
                case ASSISTANT -> new AssistantMessage(message.content());
            });
        }
        return converted;
    }

    private static int estimateTokens(List<PromptMessage> messages) {
        int total = 0;
        for (PromptMessage message : messages) {
            total += LlmRateLimiter.estimateTokens(message.content());
        }
        return total;
    }
}
