package com.github.salilvnair.convroute.engine.handler.provider;

import com.github.salilvnair.convroute.config.ConvRouteHandlerConfig;
import com.github.salilvnair.convroute.engine.handler.AbstractSupportHandler;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.support.KeywordScorer;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.prompt.renderer.ThymeleafTemplateRenderer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class TechnicalSupportHandler extends AbstractSupportHandler {

    static final List<String> KEYWORDS = List.of(
            "error", "bug", "crash", "not working", "broken", "issue", "problem", "technical",
            "software", "hardware", "installation", "update", "upgrade", "compatibility",
            "performance", "slow", "freeze", "hang", "crashes", "driver", "firmware",
            "configuration", "settings", "network", "connection", "login", "password",
            "authentication", "permission", "access", "security", "backup", "restore", "data",
            "file", "corrupt", "virus", "malware");

    private static final double BASELINE = 0.20d;

    private static final List<Pattern> ERROR_PATTERNS = List.of(
            Pattern.compile("\"([^\"]*error[^\"]*)\""),
            Pattern.compile("error[:\\s]+([^\\n]+)"),
            Pattern.compile("failed[:\\s]+([^\\n]+)"),
            Pattern.compile("crash[:\\s]+([^\\n]+)"));

    private static final List<String> URGENT_WORDS = List.of("urgent", "emergency", "critical", "broken", "not working");

    private static final Map<String, List<String>> TROUBLESHOOTING = Map.of(
            "performance", List.of(
                    "Check system resources (CPU, memory, disk space)",
                    "Close unnecessary applications",
                    "Update drivers and software",
                    "Run system maintenance tools"),
            "connection", List.of(
                    "Check network cables and connections",
                    "Restart router/modem",
                    "Check firewall settings",
                    "Test with different network"),
            "installation", List.of(
                    "Check system requirements",
                    "Run as administrator",
                    "Disable antivirus temporarily",
                    "Download fresh copy of installer"));

    private static final List<String> DEFAULT_STEPS = List.of(
            "Restart the application or device",
            "Check for software updates",
            "Clear cache and temporary files",
            "Contact support if the issue persists");

    private static final String REPLY = "I'm sorry you're running into this. {{summary}}\n\n"
            + "Here are some steps to try:\n{{steps}}{{followUp}}";

    private static final String SYSTEM_PROMPT = """
            You are a highly skilled technical support specialist.
            Diagnose the problem systematically, give clear step-by-step troubleshooting,
            explain technical concepts in simple terms and recommend escalation for
            hardware failure, data loss or security incidents.""";

    public TechnicalSupportHandler(GenerationService generationService,
                                   ThymeleafTemplateRenderer renderer,
                                   ConvRouteHandlerConfig handlerConfig) {
        super(generationService, renderer, handlerConfig);
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.TECHNICAL;
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
        List<String> errorMessages = extractErrorMessages(lower);
        String problemType = problemType(lower);
        String urgency = KeywordScorer.containsAny(lower, URGENT_WORDS) ? "high" : "normal";

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("errorMessages", errorMessages);
        details.put("problemType", problemType);
        details.put("urgencyLevel", urgency);
        details.put("troubleshootingSteps", troubleshootingSteps(problemType));
        details.put("shouldEscalate", shouldEscalate(lower, urgency, errorMessages));
        return details;
    }

    @Override
    @SuppressWarnings("unchecked")
    protected String templateReply(String query, Map<String, Object> details) {
        String problemType = (String) details.get("problemType");
        List<String> errorMessages = (List<String>) details.get("errorMessages");
        List<String> steps = (List<String>) details.get("troubleshootingSteps");

        String summary = problemType == null
                ? "Let's work through it together."
                : "This looks like a " + problemType + " problem.";
        if (!errorMessages.isEmpty()) {
            summary += " I noted the error: \"" + errorMessages.get(0).trim() + "\".";
        }
        StringBuilder numbered = new StringBuilder();
        for (int i = 0; i < steps.size(); i++) {
            numbered.append(i + 1).append(". ").append(steps.get(i)).append('\n');
        }
        String followUp = Boolean.TRUE.equals(details.get("shouldEscalate"))
                ? "\nIf these steps don't resolve it, I can escalate this to a senior technician right away."
                : "\nLet me know how it goes and I'll help with the next steps.";

        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("summary", summary);
        variables.put("steps", numbered.toString());
        variables.put("followUp", followUp);
        return render(REPLY, variables);
    }

    static List<String> extractErrorMessages(String lower) {
        List<String> found = new ArrayList<>();
        for (Pattern pattern : ERROR_PATTERNS) {
            Matcher matcher = pattern.matcher(lower);
            while (matcher.find()) {
                found.add(matcher.group(1));
            }
        }
        return found;
    }

    static String problemType(String lower) {
        if (KeywordScorer.containsAny(lower, List.of("slow", "performance", "lag"))) {
            return "performance";
        }
        if (KeywordScorer.containsAny(lower, List.of("connection", "network", "internet"))) {
            return "connection";
        }
        if (KeywordScorer.containsAny(lower, List.of("install", "setup", "configuration"))) {
            return "installation";
        }
        if (KeywordScorer.containsAny(lower, List.of("crash", "freeze", "hang"))) {
            return "stability";
        }
        return null;
    }

    static List<String> troubleshootingSteps(String problemType) {
        if (problemType == null) {
            return DEFAULT_STEPS;
        }
        return TROUBLESHOOTING.getOrDefault(problemType, DEFAULT_STEPS);
    }

    private boolean shouldEscalate(String lower, String urgency, List<String> errorMessages) {
        return lower.contains("hardware failure")
                || lower.contains("data loss")
                || lower.contains("security breach")
                || "high".equals(urgency)
                || errorMessages.size() > 2;
    }
}
