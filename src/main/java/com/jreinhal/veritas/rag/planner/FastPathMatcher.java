package com.jreinhal.veritas.rag.planner;

import com.jreinhal.veritas.model.Intent;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Model-free classification of unambiguous inputs.
 *
 * <p>The greeting set is checked before the out-of-scope set, so the two fast paths never both
 * match. The validation gate re-runs {@link #isVerifiedGreeting(String)} on its own instead of
 * trusting the planner's label.</p>
 */
public final class FastPathMatcher {

    public enum GreetingKind {
        HELLO,
        THANKS,
        GOODBYE,
        ACKNOWLEDGEMENT
    }

    public record FastPath(Intent intent, String reason, GreetingKind greetingKind) {
    }

    private static final Map<GreetingKind, Pattern> GREETING_PATTERNS = new LinkedHashMap<>();
    private static final Map<String, List<Pattern>> OUT_OF_SCOPE_PATTERNS = new LinkedHashMap<>();

    static {
        GREETING_PATTERNS.put(GreetingKind.HELLO, Pattern.compile("^(hi|hello|hey)(\\s+there)?\\s*[!.]*$"));
        GREETING_PATTERNS.put(GreetingKind.THANKS, Pattern.compile("^(thanks|thank you)(\\s+so much|\\s+a lot)?\\s*[!.]*$"));
        GREETING_PATTERNS.put(GreetingKind.GOODBYE, Pattern.compile("^(bye|goodbye)\\s*[!.]*$"));
        GREETING_PATTERNS.put(GreetingKind.ACKNOWLEDGEMENT, Pattern.compile("^(hmm+|ok|okay|cool|got it)\\s*[!.]*$"));

        OUT_OF_SCOPE_PATTERNS.put("arithmetic", List.of(
                Pattern.compile("\\b\\d+(\\.\\d+)?\\s*[+*/^×]\\s*\\d+(\\.\\d+)?\\b"),
                Pattern.compile("\\bwhat is \\d+(\\.\\d+)?\\s*(plus|minus|times|divided by|-)\\s*\\d+"),
                Pattern.compile("\\b(solve for|solve the equation|calculate|derivative of|integral of|square root of)\\b"),
                Pattern.compile("\\b(find|what is) x\\b")));
        OUT_OF_SCOPE_PATTERNS.put("coding", List.of(
                Pattern.compile("\\b(write|debug|fix|refactor|generate)\\b.{0,40}\\b(code|function|script|program|regex|sql query)\\b"),
                Pattern.compile("\\b(python|javascript|java|c\\+\\+|typescript|rust|golang)\\s+(code|script|function|program|snippet)\\b")));
        OUT_OF_SCOPE_PATTERNS.put("weather", List.of(
                Pattern.compile("\\b(weather|forecast|will it rain|is it raining|will it snow)\\b")));
        OUT_OF_SCOPE_PATTERNS.put("market prices", List.of(
                Pattern.compile("\\b(stock price|share price|bitcoin price|crypto(currency)? price|exchange rate)\\b")));
        OUT_OF_SCOPE_PATTERNS.put("current events", List.of(
                Pattern.compile("\\b(latest news|breaking news|current events|news today|today's news|headlines)\\b")));
    }

    private FastPathMatcher() {
    }

    public static Optional<FastPath> match(String query) {
        String normalized = normalize(query);
        if (normalized.isEmpty()) {
            return Optional.of(new FastPath(Intent.OUT_OF_SCOPE, "empty query", null));
        }
        Optional<GreetingKind> greeting = greetingKind(normalized);
        if (greeting.isPresent()) {
            Intent intent = greeting.get() == GreetingKind.ACKNOWLEDGEMENT ? Intent.CONVERSATIONAL : Intent.GREETING;
            return Optional.of(new FastPath(intent, null, greeting.get()));
        }
        for (Map.Entry<String, List<Pattern>> entry : OUT_OF_SCOPE_PATTERNS.entrySet()) {
            for (Pattern pattern : entry.getValue()) {
                if (pattern.matcher(normalized).find()) {
                    return Optional.of(new FastPath(Intent.OUT_OF_SCOPE, "outside knowledge base domain: " + entry.getKey(), null));
                }
            }
        }
        return Optional.empty();
    }

    public static Optional<GreetingKind> greetingKind(String query) {
        String normalized = normalize(query);
        for (Map.Entry<GreetingKind, Pattern> entry : GREETING_PATTERNS.entrySet()) {
            if (entry.getValue().matcher(normalized).matches()) {
                return Optional.of(entry.getKey());
            }
        }
        return Optional.empty();
    }

    public static boolean isVerifiedGreeting(String query) {
        return greetingKind(query).isPresent();
    }

    static String normalize(String query) {
        if (query == null) {
            return "";
        }
        return query.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }
}
