package com.github.salilvnair.convroute.engine.handler.provider;

import com.github.salilvnair.convroute.config.ConvRouteHandlerConfig;
import com.github.salilvnair.convroute.config.ConvRouteRoutingConfig;
import com.github.salilvnair.convroute.engine.handler.AbstractSupportHandler;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.support.KeywordScorer;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.prompt.renderer.ThymeleafTemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * First point of contact. Its confidence is inverted: the more a message looks like
 * a specialist's vocabulary, the less this handler wants it.
 */
@Component
public class GeneralSupportHandler extends AbstractSupportHandler {

    static final List<String> TECHNICAL_VOCABULARY = List.of(
            "error", "bug", "crash", "not working", "broken", "issue", "problem", "technical",
            "software", "hardware", "installation", "update", "upgrade", "compatibility",
            "performance", "slow", "freeze", "hang", "crashes");

    static final List<String> BILLING_VOCABULARY = List.of(
            "payment", "billing", "invoice", "charge", "cost", "price", "fee", "subscription",
            "refund", "credit", "discount", "promotion", "coupon", "bill", "account",
            "payment method", "credit card", "debit card");

    static final List<String> ESCALATION_VOCABULARY = List.of(
            "manager", "supervisor", "human", "speak to someone", "real person", "complex",
            "urgent", "emergency", "complaint", "dissatisfied", "escalate", "escalation",
            "serious", "critical");

    private static final Map<HandlerKind, List<String>> ROUTING_VOCABULARIES = routingVocabularies();

    private static final Map<HandlerKind, String> ROUTING_MESSAGES = Map.of(
            HandlerKind.TECHNICAL, "I understand you're experiencing a technical issue. Let me connect you with our technical support specialist who can provide more detailed assistance.",
            HandlerKind.BILLING, "I can see you have a billing or payment question. Let me transfer you to our billing specialist who can help with your account and payment matters.",
            HandlerKind.ESCALATION, "I understand this is a complex matter that requires immediate attention. Let me connect you with a supervisor who can provide the assistance you need.");

    private static final String WELCOME_REPLY = "Thanks for reaching out! I can help with questions about our products, services, "
            + "business hours and policies. Our support team is available Monday to Friday, 9am to 6pm, "
            + "and you can always browse {{helpCenterUrl}} for guides and FAQs. What would you like to know?";

    private static final String ROUTING_REPLY = "{{routingMessage}}\n\nYour query: '{{query}}'";

    private static final String RECOVERY_REPLY = "I ran into a problem with that request, but I'm still here to help. "
            + "Could you tell me a little more about what you need? You can also reach us at {{supportEmail}}.";

    private static final String SYSTEM_PROMPT = """
            You are a friendly general customer support agent and the first point of contact.
            Answer questions about products, services, business hours and policies.
            When a question needs a specialist, say which team can help and why.""";

    private final String errorMarker;

    public GeneralSupportHandler(GenerationService generationService,
                                 ThymeleafTemplateRenderer renderer,
                                 ConvRouteHandlerConfig handlerConfig,
                                 ConvRouteRoutingConfig routingConfig) {
        super(generationService, renderer, handlerConfig);
        this.errorMarker = routingConfig.getErrorMarker();
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.GENERAL;
    }

    @Override
    public double confidence(String text) {
        double maxRoutingScore = 0.0d;
        for (double score : routingScores(text).values()) {
            maxRoutingScore = Math.max(maxRoutingScore, score);
        }
        if (maxRoutingScore > 0.3d) {
            return 0.2d;
        }
        if (maxRoutingScore > 0.1d) {
            return 0.5d;
        }
        return 0.9d;
    }

    /**
     * Keyword density per specialised vocabulary, in {@link HandlerKind} order.
     */
    public Map<HandlerKind, Double> routingScores(String text) {
        Map<HandlerKind, Double> scores = new LinkedHashMap<>();
        ROUTING_VOCABULARIES.forEach((kind, vocabulary) -> scores.put(kind, KeywordScorer.density(text, vocabulary)));
        return scores;
    }

    @Override
    protected String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    @Override
    protected Map<String, Object> analyze(String query) {
        Map<HandlerKind, Double> scores = routingScores(query);
        HandlerKind recommended = null;
        double best = 0.0d;
        Map<String, Object> byWireName = new LinkedHashMap<>();
        for (Map.Entry<HandlerKind, Double> entry : scores.entrySet()) {
            byWireName.put(entry.getKey().wireName(), entry.getValue());
            if (entry.getValue() > best) {
                best = entry.getValue();
                recommended = entry.getKey();
            }
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("recommendedHandler", recommended == null ? HandlerKind.GENERAL.wireName() : recommended.wireName());
        details.put("recommendationScore", best);
        details.put("vocabularyScores", byWireName);
        details.put("recovering", isRecovery(query));
        return details;
    }

    @Override
    protected String templateReply(String query, Map<String, Object> details) {
        if (isRecovery(query)) {
            return render(RECOVERY_REPLY, Map.of());
        }
        HandlerKind recommended = HandlerKind.fromWireName(String.valueOf(details.get("recommendedHandler")))
                .orElse(HandlerKind.GENERAL);
        double score = ((Number) details.get("recommendationScore")).doubleValue();
        if (recommended != HandlerKind.GENERAL && score > 0.1d) {
            return render(ROUTING_REPLY, Map.of("routingMessage", ROUTING_MESSAGES.get(recommended), "query", query));
        }
        return render(WELCOME_REPLY, Map.of());
    }

    private boolean isRecovery(String query) {
        return errorMarker != null && !errorMarker.isEmpty() && query.startsWith(errorMarker.trim());
    }

    private static Map<HandlerKind, List<String>> routingVocabularies() {
        Map<HandlerKind, List<String>> vocabularies = new LinkedHashMap<>();
        vocabularies.put(HandlerKind.TECHNICAL, TECHNICAL_VOCABULARY);
        vocabularies.put(HandlerKind.BILLING, BILLING_VOCABULARY);
        vocabularies.put(HandlerKind.ESCALATION, ESCALATION_VOCABULARY);
        return vocabularies;
    }
}
