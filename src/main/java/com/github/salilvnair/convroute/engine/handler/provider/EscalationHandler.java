package com.github.salilvnair.convroute.engine.handler.provider;

import com.github.salilvnair.convroute.config.ConvRouteHandlerConfig;
import com.github.salilvnair.convroute.engine.handler.AbstractSupportHandler;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.support.KeywordScorer;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.prompt.renderer.ThymeleafTemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Target of every forced escalation. Classifies the case so the hand-off note can
 * carry a priority and an expected resolution window.
 */
@Component
public class EscalationHandler extends AbstractSupportHandler {

    static final List<String> KEYWORDS = List.of(
            "manager", "supervisor", "human", "speak to someone", "real person", "complex",
            "urgent", "emergency", "complaint", "dissatisfied", "escalate", "escalation",
            "serious", "critical", "unresolved", "multiple attempts", "still not working",
            "frustrated", "angry", "unacceptable", "terrible service", "worst experience");

    private static final double BASELINE = 0.20d;

    private static final List<Category> CATEGORIES = List.of(
            new Category("urgent_technical",
                    List.of("urgent", "emergency", "critical", "not working", "broken"),
                    "high",
                    "I understand this is an urgent technical issue. Let me immediately connect you with our senior technical specialist.",
                    "within 2-4 hours"),
            new Category("customer_complaint",
                    List.of("complaint", "dissatisfied", "unhappy", "terrible", "worst"),
                    "medium",
                    "I apologize for your experience. Let me connect you with a supervisor who can address your concerns.",
                    "within 24 hours"),
            new Category("complex_billing",
                    List.of("fraud", "unauthorized", "dispute", "complex billing"),
                    "high",
                    "This billing matter requires immediate attention. Let me connect you with our billing specialist.",
                    "within 4-8 hours"),
            new Category("human_request",
                    List.of("human", "real person", "speak to someone", "supervisor"),
                    "medium",
                    "I understand you'd like to speak with a human representative. Let me connect you with a supervisor.",
                    "within 1-2 hours"));

    private static final String DEFAULT_RESPONSE = "I understand this requires immediate attention. Let me connect you with a specialist.";
    private static final String DEFAULT_RESOLUTION = "within 24 hours";

    private static final Map<String, List<String>> EMOTIONS = emotions();

    private static final List<String> URGENT_WORDS = List.of("urgent", "emergency", "critical", "immediate", "now");
    private static final List<String> HIGH_IMPACT_WORDS = List.of("critical", "urgent", "emergency", "broken", "not working");

    private static final List<Pattern> DURATION_PATTERNS = List.of(
            Pattern.compile("(\\d+)\\s*(?:days?|weeks?|months?)\\s*(?:ago|for)"),
            Pattern.compile("(?:been|trying)\\s+(?:for|since)\\s+(\\d+)\\s*(?:days?|weeks?|months?)"),
            Pattern.compile("(?:issue|problem)\\s+(?:for|since)\\s+(\\d+)\\s*(?:days?|weeks?|months?)"));

    private static final List<Pattern> ATTEMPT_PATTERNS = List.of(
            Pattern.compile("(\\d+)\\s*(?:times?|attempts?)"),
            Pattern.compile("(?:tried|called|contacted)\\s+(\\d+)\\s*(?:times?|attempts?)"),
            Pattern.compile("(?:multiple|several)\\s+(?:times?|attempts?)"));

    private static final String REPLY = "{{response}}\n\nYour concern: '{{query}}'\n\n"
            + "I'm escalating this to ensure you receive the assistance you need. "
            + "Priority: {{priority}}. Expected response {{resolution}}.";

    private static final String SYSTEM_PROMPT = """
            You are a senior customer support escalation specialist.
            Acknowledge the customer's frustration, apologise for poor experiences,
            explain who will take over and set a clear expectation for the response time.""";

    public EscalationHandler(GenerationService generationService,
                             ThymeleafTemplateRenderer renderer,
                             ConvRouteHandlerConfig handlerConfig) {
        super(generationService, renderer, handlerConfig);
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.ESCALATION;
    }

    @Override
    public double confidence(String text) {
        return KeywordScorer.tiered(KeywordScorer.countHits(text, KEYWORDS), BASELINE);
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected Map<String, Object> analyze(String query) {
        String lower = KeywordScorer.normalize(query);
        Category category = null;
        List<String> keywordsFound = List.of();
        for (Category candidate : CATEGORIES) {
            List<String> found = KeywordScorer.matched(lower, candidate.keywords());
            if (!found.isEmpty()) {
                category = candidate;
                keywordsFound = found;
                break;
            }
        }
        String emotion = null;
        for (Map.Entry<String, List<String>> entry : EMOTIONS.entrySet()) {
            if (KeywordScorer.containsAny(lower, entry.getValue())) {
                emotion = entry.getKey();
                break;
            }
        }
        String previousAttempts = firstMatch(ATTEMPT_PATTERNS, lower);
        String impact = KeywordScorer.containsAny(lower, HIGH_IMPACT_WORDS) ? "high" : "normal";

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("category", category == null ? null : category.name());
        details.put("priority", category == null ? "normal" : category.priority());
        details.put("keywordsFound", keywordsFound);
        details.put("urgencyLevel", KeywordScorer.containsAny(lower, URGENT_WORDS) ? "high" : "normal");
        details.put("customerEmotion", emotion);
        details.put("issueDuration", firstMatch(DURATION_PATTERNS, lower));
        details.put("previousAttempts", previousAttempts);
        details.put("impactLevel", impact);
        details.put("humanRequested", lower.contains("human")
                || lower.contains("real person")
                || lower.contains("supervisor")
                || "angry".equals(emotion)
                || "frustrated".equals(emotion)
                || "high".equals(impact)
                || previousAttempts != null);
        details.put("estimatedResolution", category == null ? DEFAULT_RESOLUTION : category.resolution());
        return details;
    }

    @Override
    protected String templateReply(String query, Map<String, Object> details) {
        String categoryName = (String) details.get("category");
        String response = DEFAULT_RESPONSE;
        for (Category category : CATEGORIES) {
            if (category.name().equals(categoryName)) {
                response = category.response();
            }
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("response", response);
        variables.put("query", query);
        variables.put("priority", details.get("priority"));
        variables.put("resolution", details.get("estimatedResolution"));
        return render(REPLY, variables);
    }

    /**
     * Capture group 1 when the pattern has one, otherwise the whole match.
     */
    private static String firstMatch(List<Pattern> patterns, String lower) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(lower);
            if (matcher.find()) {
                return matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
            }
        }
        return null;
    }

    private static Map<String, List<String>> emotions() {
        Map<String, List<String>> emotions = new LinkedHashMap<>();
        emotions.put("frustrated", List.of("frustrated", "frustration", "annoyed", "irritated"));
        emotions.put("angry", List.of("angry", "mad", "furious", "outraged", "livid"));
        emotions.put("dissatisfied", List.of("dissatisfied", "unhappy", "disappointed", "let down"));
        emotions.put("urgent", List.of("urgent", "emergency", "critical", "immediate"));
        return emotions;
    }

    private record Category(String name, List<String> keywords, String priority, String response, String resolution) {
    }
}
