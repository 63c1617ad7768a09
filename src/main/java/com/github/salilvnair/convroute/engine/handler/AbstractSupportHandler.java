package com.github.salilvnair.convroute.engine.handler;

import com.github.salilvnair.convroute.config.ConvRouteHandlerConfig;
import com.github.salilvnair.convroute.engine.constants.ReplyMetadataKey;
import com.github.salilvnair.convroute.engine.exception.ConvRouteErrorCode;
import com.github.salilvnair.convroute.engine.exception.ConvRouteException;
import com.github.salilvnair.convroute.engine.handler.support.RollingTranscript;
import com.github.salilvnair.convroute.engine.handler.support.TranscriptEntry;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.prompt.renderer.ThymeleafTemplateRenderer;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared reply pipeline for every handler: extract details, resolve anything the
 * handler needs from its collaborators, then answer through the generation backend
 * when one is configured or through the handler's templated reply otherwise.
 * Failures never leave this class as exceptions; they come back as a zero-confidence
 * apology carrying {@code error} and {@code errorCode} metadata.
 */
@Slf4j
public abstract class AbstractSupportHandler implements SupportHandler {

    private static final String PROMPT_TEMPLATE = """
            {{systemPrompt}}

            Recent conversation:
            {{history}}

            Extracted details:
            {{details}}

            Customer query: {{query}}

            Respond helpfully and concisely.""";

    private static final String GENERATION_APOLOGY = "I'm sorry, I'm having trouble putting together an answer right now. "
            + "You can try again in a moment, email us at {{supportEmail}}, or browse {{helpCenterUrl}} for self-service help.";

    private static final String STORAGE_APOLOGY = "I'm sorry, I can't reach our order records at the moment. "
            + "Please try again in a few minutes, or email {{supportEmail}} with your order number and we'll follow up.";

    private static final String GENERIC_APOLOGY = "I'm sorry, something went wrong while handling your request. "
            + "Please try again, or contact {{supportEmail}} if the problem continues.";

    protected final GenerationService generationService;
    protected final ThymeleafTemplateRenderer renderer;
    protected final ConvRouteHandlerConfig handlerConfig;
    private final RollingTranscript transcript;

    protected AbstractSupportHandler(GenerationService generationService,
                                     ThymeleafTemplateRenderer renderer,
                                     ConvRouteHandlerConfig handlerConfig) {
        this.generationService = generationService;
        this.renderer = renderer;
        this.handlerConfig = handlerConfig;
        this.transcript = new RollingTranscript(handlerConfig.getTranscriptLimit());
    }

    protected abstract String systemPrompt();

    /**
     * Handler-specific string analysis. Must be free of side effects.
     */
    protected abstract Map<String, Object> analyze(String query);

    protected abstract String templateReply(String query, Map<String, Object> details);

    /**
     * Hook for handlers that consult a collaborator before answering.
     */
    protected Map<String, Object> resolve(String query, String userId, Map<String, Object> details) {
        return details;
    }

    @Override
    public RollingTranscript transcript() {
        return transcript;
    }

    @Override
    public HandlerReply process(String text, String userId) {
        String query = text == null ? "" : text.trim();
        try {
            double confidence = confidence(query);
            Map<String, Object> details = resolve(query, userId, new LinkedHashMap<>(analyze(query)));

            String response;
            String mode;
            if (generationService.isAvailable()) {
                response = generationService.generate(renderPrompt(query, userId, details));
                mode = ReplyMetadataKey.MODE_GENERATED;
            }
            else {
                response = templateReply(query, details);
                mode = ReplyMetadataKey.MODE_TEMPLATE;
            }
            transcript.append(userId, query, response);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ReplyMetadataKey.RESPONSE_MODE, mode);
            metadata.put(ReplyMetadataKey.USER_ID, userId);
            metadata.put(ReplyMetadataKey.DETAILS, details);
            return HandlerReply.of(response, confidence, kind(), metadata);
        }
        catch (ConvRouteException e) {
            log.warn("Handler {} failed for userId={} errorCode={} message={}",
                    kind().wireName(), userId, e.getErrorCode(), e.getMessage());
            return failure(e.getErrorCode(), e.getMessage(), userId);
        }
        catch (RuntimeException e) {
            log.warn("Handler {} failed unexpectedly for userId={}", kind().wireName(), userId, e);
            return failure(ConvRouteErrorCode.HANDLER_FAILED, e.getMessage(), userId);
        }
    }

    protected HandlerReply failure(ConvRouteErrorCode errorCode, String message, String userId) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(ReplyMetadataKey.ERROR, message == null ? errorCode.defaultMessage() : message);
        metadata.put(ReplyMetadataKey.ERROR_CODE, errorCode.name());
        metadata.put(ReplyMetadataKey.FALLBACK, true);
        metadata.put(ReplyMetadataKey.RESPONSE_MODE, ReplyMetadataKey.MODE_FALLBACK);
        metadata.put(ReplyMetadataKey.USER_ID, userId);
        return HandlerReply.of(apology(errorCode), 0.0d, kind(), metadata);
    }

    protected String apology(ConvRouteErrorCode errorCode) {
        String template = switch (errorCode) {
            case GENERATION_FAILED, GENERATION_TIMEOUT, GENERATION_DISABLED -> GENERATION_APOLOGY;
            case STORAGE_UNAVAILABLE -> STORAGE_APOLOGY;
            default -> GENERIC_APOLOGY;
        };
        return render(template, Map.of());
    }

    protected String render(String template, Map<String, Object> variables) {
        Map<String, Object> all = new LinkedHashMap<>();
        all.put("supportEmail", handlerConfig.getSupportEmail());
        all.put("helpCenterUrl", handlerConfig.getHelpCenterUrl());
        all.putAll(variables);
        return renderer.render(template, all);
    }

    String renderPrompt(String query, String userId, Map<String, Object> details) {
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("systemPrompt", systemPrompt());
        variables.put("history", formatHistory(transcript.recent(userId, handlerConfig.getPromptHistoryTurns())));
        variables.put("details", formatDetails(details));
        variables.put("query", query);
        return renderer.render(PROMPT_TEMPLATE, variables);
    }

    private String formatHistory(List<TranscriptEntry> entries) {
        if (entries.isEmpty()) {
            return "(none)";
        }
        StringBuilder out = new StringBuilder();
        for (TranscriptEntry entry : entries) {
            out.append("Customer: ").append(entry.query()).append('\n');
            out.append("Agent: ").append(entry.response()).append('\n');
        }
        return out.toString().trim();
    }

    private String formatDetails(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return "(none)";
        }
        StringBuilder out = new StringBuilder();
        details.forEach((key, value) -> out.append("- ").append(key).append(": ").append(value).append('\n'));
        return out.toString().trim();
    }
}
