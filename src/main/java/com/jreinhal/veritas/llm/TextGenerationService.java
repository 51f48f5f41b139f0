package com.jreinhal.veritas.llm;

import java.time.Duration;
import java.util.List;
import reactor.core.publisher.Flux;

/**
 * Text completion against the external language model.
 *
 * <p>Implementations enforce the shared rate limit and the supplied timeout. Any failure,
 * including an exhausted retry budget, surfaces as {@link LlmUnavailableException}.</p>
 */
public interface TextGenerationService {

    String complete(List<PromptMessage> messages, double temperature, Duration timeout);

    /**
     * Stream the completion token by token. {@code idleTimeout} bounds the gap between two tokens.
     */
    Flux<String> stream(List<PromptMessage> messages, double temperature, Duration idleTimeout);
}
