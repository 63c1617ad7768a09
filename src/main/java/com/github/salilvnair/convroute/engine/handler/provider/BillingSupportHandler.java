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

@Component
public class BillingSupportHandler extends AbstractSupportHandler {

    static final List<String> KEYWORDS = List.of(
            "payment", "billing", "invoice", "charge", "cost", "price", "fee", "subscription",
            "refund", "credit", "discount", "promotion", "coupon", "bill", "account",
            "payment method", "credit card", "debit card", "paypal", "bank transfer",
            "wire transfer", "check", "money order", "overcharge", "double charge",
            "unauthorized charge", "fraud", "cancellation", "upgrade", "downgrade",
            "plan change", "renewal");

    private static final double BASELINE = 0.15d;

    private static final List<Scenario> SCENARIOS = List.of(
            new Scenario("refund_request",
                    List.of("refund", "return", "money back", "credit back"),
                    "I understand you're requesting a refund. Let me help you with that process.",
                    "Our standard refund policy allows for refunds within 30 days of purchase for most products. Some digital products may have different terms."),
            new Scenario("payment_issue",
                    List.of("payment failed", "declined", "error", "not working"),
                    "I can help you resolve this payment issue. Let me gather some information.",
                    "We accept major credit cards, PayPal, and bank transfers. Payment issues are typically resolved within 1-2 business days."),
            new Scenario("subscription_change",
                    List.of("upgrade", "downgrade", "change plan", "modify"),
                    "I can assist you with modifying your subscription plan.",
                    "You can modify your subscription at any time. Changes take effect at the next billing cycle."),
            new Scenario("billing_dispute",
                    List.of("dispute", "wrong amount", "overcharge", "unauthorized"),
                    "I understand you have a billing concern. Let me investigate this for you.",
                    "We take billing disputes seriously and investigate all claims thoroughly. You can also contact your payment provider to dispute charges."));

    private static final String DEFAULT_OPENING = "I can help you with your billing inquiry.";
    private static final String DEFAULT_POLICY = "Let me gather some information to assist you better.";

    private static final List<String> URGENT_WORDS = List.of("urgent", "emergency", "fraud", "unauthorized", "dispute");

    private static final List<Pattern> AMOUNT_PATTERNS = List.of(
            Pattern.compile("\\$(\\d+(?:\\.\\d{2})?)"),
            Pattern.compile("(\\d+(?:\\.\\d{2})?)\\s*(?:dollars?|usd)"),
            Pattern.compile("charged\\s+(\\d+(?:\\.\\d{2})?)"));

    private static final Map<String, List<String>> PAYMENT_METHODS = paymentMethods();

    private static final List<Pattern> TRANSACTION_PATTERNS = List.of(
            Pattern.compile("transaction\\s+(?:id|#)?[:\\s]*([a-z0-9-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(?:txn|tx)\\s*(?:id|#)?[:\\s]*([a-z0-9-]+)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("receipt\\s+(?:id|#)?[:\\s]*([a-z0-9-]+)", Pattern.CASE_INSENSITIVE));

    private static final String REPLY = "{{opening}} {{policy}}{{amountLine}}{{nextStep}}";

    private static final String SYSTEM_PROMPT = """
            You are a professional billing support specialist.
            Help with payments, invoices, refunds, subscriptions and billing disputes.
            Never ask for full card numbers. Explain the relevant policy and the next step.""";

    public BillingSupportHandler(GenerationService generationService,
                                 ThymeleafTemplateRenderer renderer,
                                 ConvRouteHandlerConfig handlerConfig) {
        super(generationService, renderer, handlerConfig);
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.BILLING;
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
        Scenario scenario = null;
        List<String> scenarioKeywords = List.of();
        for (Scenario candidate : SCENARIOS) {
            List<String> found = KeywordScorer.matched(lower, candidate.keywords());
            if (!found.isEmpty()) {
                scenario = candidate;
                scenarioKeywords = found;
                break;
            }
        }
        String urgency = KeywordScorer.containsAny(lower, URGENT_WORDS) ? "high" : "normal";

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("scenario", scenario == null ? null : scenario.name());
        details.put("scenarioKeywords", scenarioKeywords);
        details.put("urgency", urgency);
        details.put("amountMentioned", firstGroup(AMOUNT_PATTERNS, lower));
        details.put("paymentMethod", paymentMethod(lower));
        details.put("transactionId", firstGroup(TRANSACTION_PATTERNS, query));
        details.put("policy", scenario == null ? DEFAULT_POLICY : scenario.policy());
        details.put("shouldEscalate", lower.contains("fraud")
                || lower.contains("unauthorized charge")
                || lower.contains("dispute")
                || "high".equals(urgency)
                || (scenario != null && "billing_dispute".equals(scenario.name())));
        return details;
    }

    @Override
    protected String templateReply(String query, Map<String, Object> details) {
        String scenarioName = (String) details.get("scenario");
        String opening = DEFAULT_OPENING;
        for (Scenario scenario : SCENARIOS) {
            if (scenario.name().equals(scenarioName)) {
                opening = scenario.opening();
            }
        }
        Object amount = details.get("amountMentioned");
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("opening", opening);
        variables.put("policy", details.get("policy"));
        variables.put("amountLine", amount == null ? "" : "\n\nI've noted the amount of $" + amount + ".");
        variables.put("nextStep", Boolean.TRUE.equals(details.get("shouldEscalate"))
                ? "\n\nBecause this may involve an unauthorized or disputed charge, I'm flagging it for our billing team to review with priority."
                : "\n\nCould you share the date of the charge and the last four digits of the card used?");
        return render(REPLY, variables);
    }

    static String paymentMethod(String lower) {
        for (Map.Entry<String, List<String>> entry : PAYMENT_METHODS.entrySet()) {
            if (KeywordScorer.containsAny(lower, entry.getValue())) {
                return entry.getKey();
            }
        }
        return null;
    }

    private static String firstGroup(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group(1);
            }
        }
        return null;
    }

    private static Map<String, List<String>> paymentMethods() {
        Map<String, List<String>> methods = new LinkedHashMap<>();
        methods.put("credit card", List.of("credit card", "visa", "mastercard", "amex", "discover"));
        methods.put("debit card", List.of("debit card", "debit"));
        methods.put("paypal", List.of("paypal", "pay pal"));
        methods.put("bank transfer", List.of("bank transfer", "wire transfer"));
        methods.put("check", List.of("check", "cheque"));
        return methods;
    }

    private record Scenario(String name, List<String> keywords, String opening, String policy) {
    }
}
