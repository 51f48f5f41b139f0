package com.jreinhal.veritas.rag.planner;

import com.jreinhal.veritas.model.ConversationTurn;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Detects follow-up questions and carries entities over from recent turns.
 */
@Component
public class ContextAnalyzer {
    private static final Pattern FOLLOW_UP_PHRASE = Pattern.compile(
            "^(and|also|so|what about|how about|tell me more|what else|more about|elaborate|go on|why is that)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PRONOUN = Pattern.compile(
            "\\b(it|its|this|that|these|those|they|them|their|he|him|his|she|her)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern REPLACEABLE_PRONOUN = Pattern.compile(
            "\\b(it|this|that|he|him|she|her|they|them)\\b",
            Pattern.CASE_INSENSITIVE);

    public record ContextAnalysis(boolean followUp, Set<String> contextEntities, String resolvedQuery) {
    }

    /**
     * @param recentTurns the last N turns, oldest first
     */
    public ContextAnalysis analyze(String query, List<ConversationTurn> recentTurns) {
        if (recentTurns == null || recentTurns.isEmpty() || query == null || query.isBlank()) {
            return new ContextAnalysis(false, Set.of(), query);
        }
        String trimmed = query.trim();
        boolean hasPhrase = FOLLOW_UP_PHRASE.matcher(trimmed).find();
        boolean hasPronoun = PRONOUN.matcher(trimmed).find();
        if (!hasPhrase && !hasPronoun) {
            return new ContextAnalysis(false, Set.of(), query);
        }
        Set<String> contextEntities = new LinkedHashSet<>();
        List<ConversationTurn> newestFirst = new ArrayList<>(recentTurns);
        Collections.reverse(newestFirst);
        for (ConversationTurn turn : newestFirst) {
            contextEntities.addAll(EntityExtractor.extract(turn.content()));
        }
        String resolved = resolve(trimmed, contextEntities, hasPronoun);
        return new ContextAnalysis(true, contextEntities, resolved);
    }

    private static String resolve(String query, Set<String> contextEntities, boolean hasPronoun) {
        if (contextEntities.isEmpty()) {
            return query;
        }
        String activeEntity = contextEntities.iterator().next();
        if (hasPronoun) {
            Matcher matcher = REPLACEABLE_PRONOUN.matcher(query);
            if (matcher.find()) {
                return query.substring(0, matcher.start()) + activeEntity + query.substring(matcher.end());
            }
        }
        if (EntityExtractor.extract(query).isEmpty()) {
            String base = query.endsWith("?") ? query.substring(0, query.length() - 1) : query;
            return base + " about " + activeEntity + (query.endsWith("?") ? "?" : "");
        }
        return query;
    }
}
