package com.jreinhal.veritas.rag.synthesis;

import com.jreinhal.veritas.constant.AnswerMessages;
import com.jreinhal.veritas.exception.AnswerUnavailableException;
import com.jreinhal.veritas.llm.LlmUnavailableException;
import com.jreinhal.veritas.llm.PromptMessage;
import com.jreinhal.veritas.llm.TextGenerationService;
import com.jreinhal.veritas.model.Citation;
import com.jreinhal.veritas.model.ConversationTurn;
import com.jreinhal.veritas.model.RankedItem;
import com.jreinhal.veritas.model.SourceType;
import com.jreinhal.veritas.model.SynthesisResult;
import com.jreinhal.veritas.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Writes the answer from ranked evidence.
 *
 * <p>The model only sees the numbered context block and must cite it with {@code [Sn]} markers.
 * Citations are built from those markers and never point outside the context. Empty evidence
 * returns the rejection message without calling the model.</p>
 */
@Service
public class AnswerSynthesizer {
    private static final Logger log = LoggerFactory.getLogger(AnswerSynthesizer.class);
    static final String NO_ANSWER = "NO_ANSWER";
    static final double UNMARKED_CONFIDENCE_FACTOR = 0.5;
    private static final Pattern MARKER_GROUP = Pattern.compile("\\[(S\\d+(?:\\s*,\\s*S\\d+)*)\\]");
    private static final Pattern MARKER = Pattern.compile("S(\\d+)");
    private static final List<Pattern> DECLINE_PATTERNS = List.of(
            Pattern.compile("\\b(couldn't|could not|can't|cannot|am unable to) (find|answer|determine)\\b"),
            Pattern.compile("\\b(context|sources?|provided information) (does not|doesn't|do not|don't) (contain|mention|include|say|cover)\\b"),
            Pattern.compile("\\b(no|not enough|insufficient) information\\b"),
            Pattern.compile("\\bi don't have (enough )?information\\b"),
            Pattern.compile("\\bnot (mentioned|discussed|covered) in the (context|sources?)\\b"));
    private static final String SYSTEM_PROMPT = """
            You answer questions using ONLY the numbered sources in the context below.
            Rules:
            - Every factual sentence must cite the source it came from with its marker, for example [S1] or [S2, S4].
            - Never use knowledge that is not in the sources, even if you are confident it is true.
            - If the sources do not answer the question, reply with exactly %s and nothing else.
            - Graph sources describe relationships between entities; quote them as relationships, not as direct speech.
            - Be concise. Attribute statements to their speaker when one is given.
            """.formatted(NO_ANSWER);

    private final TextGenerationService textGenerationService;

    @Value(AnswerMessages.REJECTION_PROPERTY)
    private String rejectionMessage;
    @Value("${veritas.synthesis.vector-context:5}")
    private int vectorContext;
    @Value("${veritas.synthesis.graph-context:10}")
    private int graphContext;
    @Value("${veritas.synthesis.temperature:0.2}")
    private double temperature;
    @Value("${veritas.synthesis.timeout-seconds:60}")
    private long timeoutSeconds;

    /**
     * Evidence and prompt for one synthesis call.
     */
    public record SynthesisContext(List<RankedItem> contextItems, List<PromptMessage> messages) {
        public boolean isEmpty() {
            return this.contextItems.isEmpty();
        }
    }

    public AnswerSynthesizer(TextGenerationService textGenerationService) {
        this.textGenerationService = textGenerationService;
    }

    @PostConstruct
    public void init() {
        log.info("Answer synthesizer initialized (vectorContext={}, graphContext={}, timeout={}s)",
                this.vectorContext, this.graphContext, this.timeoutSeconds);
    }

    public SynthesisResult synthesize(String query, List<RankedItem> rankedItems, List<ConversationTurn> conversation) {
        SynthesisContext context = this.prepare(query, rankedItems, conversation);
        if (context.isEmpty()) {
            log.info("No evidence for query {}, skipping generation", LogSanitizer.querySummary(query));
            return SynthesisResult.rejected(this.rejectionMessage);
        }
        String raw;
        try {
            raw = this.textGenerationService.complete(context.messages(), this.temperature, Duration.ofSeconds(this.timeoutSeconds));
        }
        catch (LlmUnavailableException e) {
            log.error("Answer generation failed for query {}: {}", LogSanitizer.querySummary(query), LogSanitizer.sanitize(e.getMessage()));
            throw new AnswerUnavailableException(AnswerUnavailableException.Stage.SYNTHESIS, "Answer generation unavailable", e);
        }
        return this.interpret(raw, context);
    }

    public SynthesisContext prepare(String query, List<RankedItem> rankedItems, List<ConversationTurn> conversation) {
        List<RankedItem> contextItems = this.selectContext(rankedItems);
        if (contextItems.isEmpty()) {
            return new SynthesisContext(List.of(), List.of());
        }
        List<PromptMessage> messages = new ArrayList<>();
        messages.add(PromptMessage.system(SYSTEM_PROMPT));
        if (conversation != null) {
            for (ConversationTurn turn : conversation) {
                messages.add(turn.role() == ConversationTurn.Role.USER
                        ? PromptMessage.user(turn.content()) : PromptMessage.assistant(turn.content()));
            }
        }
        messages.add(PromptMessage.user("Context:\n" + formatContext(contextItems) + "\nQuestion: " + query));
        return new SynthesisContext(contextItems, messages);
    }

    /**
     * Stream raw model output for a prepared context. The caller must have verified that grounding
     * evidence exists and is responsible for passing the joined text to {@link #interpret}.
     */
    public Flux<String> stream(SynthesisContext context) {
        if (context.isEmpty()) {
            return Flux.empty();
        }
        return this.textGenerationService.stream(context.messages(), this.temperature, Duration.ofSeconds(this.timeoutSeconds))
                .onErrorMap(LlmUnavailableException.class,
                        e -> new AnswerUnavailableException(AnswerUnavailableException.Stage.SYNTHESIS, "Answer generation unavailable", e));
    }

    public SynthesisResult interpret(String raw, SynthesisContext context) {
        if (context.isEmpty() || raw == null || raw.isBlank() || isDecline(raw)) {
            return SynthesisResult.rejected(this.rejectionMessage);
        }
        String answer = raw.trim();
        List<Integer> markers = citedMarkers(answer, context.contextItems().size());
        double topScore = context.contextItems().stream().mapToDouble(RankedItem::fusionScore).max().orElse(0.0);
        List<Citation> citations = new ArrayList<>();
        if (markers.isEmpty()) {
            for (RankedItem item : context.contextItems()) {
                citations.add(citationFor(item, confidence(item, topScore) * UNMARKED_CONFIDENCE_FACTOR));
            }
        }
        else {
            for (int marker : markers) {
                RankedItem item = context.contextItems().get(marker - 1);
                citations.add(citationFor(item, confidence(item, topScore)));
            }
        }
        return SynthesisResult.grounded(answer, citations);
    }

    public String rejectionMessage() {
        return this.rejectionMessage;
    }

    /**
     * Ranked order is kept; at most {@code vectorContext} passages and {@code graphContext} graph facts.
     */
    List<RankedItem> selectContext(List<RankedItem> rankedItems) {
        List<RankedItem> selected = new ArrayList<>();
        if (rankedItems == null) {
            return selected;
        }
        int vectors = 0;
        int graphs = 0;
        for (RankedItem item : rankedItems) {
            if (item.sourceType() == SourceType.VECTOR && vectors < this.vectorContext) {
                vectors++;
                selected.add(item);
            }
            else if (item.sourceType() == SourceType.GRAPH && graphs < this.graphContext) {
                graphs++;
                selected.add(item);
            }
        }
        return selected;
    }

    static String formatContext(List<RankedItem> items) {
        StringBuilder context = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            RankedItem item = items.get(i);
            Citation label = citationFor(item, 1.0);
            context.append("[S").append(i + 1).append("] (").append(item.sourceType() == SourceType.GRAPH ? "graph" : "passage")
                    .append(", ").append(label.documentLabel());
            if (label.locator() != null) {
                context.append(", ").append(label.locator());
            }
            if (label.speakerLabel() != null) {
                context.append(", speaker: ").append(label.speakerLabel());
            }
            context.append(")\n").append(item.content().trim()).append("\n\n");
        }
        return context.toString();
    }

    /**
     * Distinct valid marker numbers in order of first appearance. Markers beyond the context are dropped.
     */
    static List<Integer> citedMarkers(String answer, int contextSize) {
        Set<Integer> markers = new LinkedHashSet<>();
        Matcher group = MARKER_GROUP.matcher(answer);
        while (group.find()) {
            Matcher marker = MARKER.matcher(group.group(1));
            while (marker.find()) {
                int number = Integer.parseInt(marker.group(1));
                if (number >= 1 && number <= contextSize) {
                    markers.add(number);
                }
            }
        }
        return new ArrayList<>(markers);
    }

    /**
     * Withholds streamed text until it carries a citation marker and cannot be the
     * {@value #NO_ANSWER} token, then releases the held deltas in order. Text that never qualifies is
     * dropped; the final validated answer still carries it.
     */
    public static Flux<String> holdUntilCited(Flux<String> deltas) {
        return Flux.defer(() -> {
            StringBuilder seen = new StringBuilder();
            List<String> held = new ArrayList<>();
            AtomicBoolean released = new AtomicBoolean();
            return deltas.concatMap(delta -> {
                if (released.get()) {
                    return Flux.just(delta);
                }
                seen.append(delta);
                held.add(delta);
                String text = seen.toString().trim();
                if (!MARKER_GROUP.matcher(text).find() || text.toUpperCase(Locale.ROOT).startsWith(NO_ANSWER)) {
                    return Flux.empty();
                }
                released.set(true);
                List<String> pending = List.copyOf(held);
                held.clear();
                return Flux.fromIterable(pending);
            });
        });
    }

    static boolean isDecline(String raw) {
        String normalized = raw.trim();
        if (normalized.toUpperCase(Locale.ROOT).startsWith(NO_ANSWER)) {
            return true;
        }
        if (MARKER_GROUP.matcher(normalized).find()) {
            return false;
        }
        String lower = normalized.toLowerCase(Locale.ROOT);
        return DECLINE_PATTERNS.stream().anyMatch(pattern -> pattern.matcher(lower).find());
    }

    private static double confidence(RankedItem item, double topScore) {
        return topScore <= 0.0 ? 0.0 : item.fusionScore() / topScore;
    }

    private static Citation citationFor(RankedItem item, double confidence) {
        return CitationFormatter.toCitation(item.sourceType(), item.provenances().isEmpty() ? item.item().provenance() : item.provenances().get(0), confidence);
    }
}
