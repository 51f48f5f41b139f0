package com.jreinhal.veritas.rag.synthesis;

import com.jreinhal.veritas.rag.planner.FastPathMatcher.GreetingKind;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Fixed replies for small talk. No model call, so the same input always gets the same reply.
 */
@Component
public class GreetingResponder {
    private static final Map<GreetingKind, String> RESPONSES = new EnumMap<>(GreetingKind.class);

    static {
        RESPONSES.put(GreetingKind.HELLO, "Hello! Ask me anything about the knowledge base and I'll answer from its sources.");
        RESPONSES.put(GreetingKind.THANKS, "You're welcome! Let me know if there is anything else you'd like to look up.");
        RESPONSES.put(GreetingKind.GOODBYE, "Goodbye! Come back any time you have another question.");
        RESPONSES.put(GreetingKind.ACKNOWLEDGEMENT, "Sure. What would you like to know next?");
    }

    public String respond(GreetingKind kind) {
        return RESPONSES.getOrDefault(kind, RESPONSES.get(GreetingKind.HELLO));
    }
}
