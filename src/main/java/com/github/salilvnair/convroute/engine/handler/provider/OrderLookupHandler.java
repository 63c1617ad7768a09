package com.github.salilvnair.convroute.engine.handler.provider;

import com.github.salilvnair.convroute.config.ConvRouteHandlerConfig;
import com.github.salilvnair.convroute.engine.handler.AbstractSupportHandler;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.support.ContactInfo;
import com.github.salilvnair.convroute.engine.handler.support.ContactInfoExtractor;
import com.github.salilvnair.convroute.engine.handler.support.KeywordScorer;
import com.github.salilvnair.convroute.entity.OrderRecord;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.prompt.renderer.ThymeleafTemplateRenderer;
import com.github.salilvnair.convroute.store.OrderStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Answers order questions from the order store, keyed by order number, email or
 * phone number found in the message.
 */
@Component
@Slf4j
public class OrderLookupHandler extends AbstractSupportHandler {

    static final List<String> KEYWORDS = List.of(
            "order", "orders", "tracking", "track", "shipment", "shipping", "delivery",
            "delivered", "package", "parcel", "shipped");

    private static final double BASELINE = 0.15d;

    private static final String ASK_FOR_KEY_REPLY = "I can look up your orders. Please share your order number "
            + "(for example ORD-10001), or the email address or phone number on your account.";

    private static final String NOT_FOUND_REPLY = "I couldn't find any orders for {{lookupKey}}. Please double-check it, "
            + "or email {{supportEmail}} and our team will look into it.";

    private static final String FOUND_REPLY = "I found {{orderCount}} order(s) for {{lookupKey}}:\n{{orderLines}}";

    private static final String SYSTEM_PROMPT = """
            You are an order support agent with read access to the customer's orders.
            Summarise the order records provided in the details, answer questions about
            status, totals and delivery, and never invent orders that are not listed.""";

    private final OrderStore orderStore;

    public OrderLookupHandler(GenerationService generationService,
                              ThymeleafTemplateRenderer renderer,
                              ConvRouteHandlerConfig handlerConfig,
                              OrderStore orderStore) {
        super(generationService, renderer, handlerConfig);
        this.orderStore = orderStore;
    }

    @Override
    public HandlerKind kind() {
        return HandlerKind.ORDER_LOOKUP;
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
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("orderNumber", ContactInfoExtractor.extractOrderNumber(query).orElse(null));
        details.put("email", ContactInfoExtractor.extractEmail(query).orElse(null));
        details.put("phone", ContactInfoExtractor.extractPhone(query).orElse(null));
        return details;
    }

    @Override
    protected Map<String, Object> resolve(String query, String userId, Map<String, Object> details) {
        Optional<ContactInfo> contact = ContactInfoExtractor.extract(query);
        if (contact.isEmpty()) {
            return details;
        }
        List<OrderRecord> orders = lookup(contact.get());
        log.info("Order lookup userId={} type={} found={}", userId, contact.get().type(), orders.size());

        List<Map<String, Object>> summaries = new ArrayList<>();
        for (OrderRecord order : orders) {
            summaries.add(summarize(order));
        }
        details.put("lookupType", contact.get().type().name());
        details.put("lookupKey", contact.get().value());
        details.put("orderCount", orders.size());
        details.put("orders", summaries);
        return details;
    }

    List<OrderRecord> lookup(ContactInfo contact) {
        return switch (contact.type()) {
            case ORDER_NUMBER -> orderStore.findOrderByNumber(contact.value()).map(List::of).orElse(List.of());
            case EMAIL -> orderStore.findOrdersByEmail(contact.value());
            case PHONE -> orderStore.findOrdersByPhone(contact.value());
        };
    }

    @Override
    @SuppressWarnings("unchecked")
    protected String templateReply(String query, Map<String, Object> details) {
        if (!details.containsKey("lookupKey")) {
            return render(ASK_FOR_KEY_REPLY, Map.of());
        }
        List<Map<String, Object>> orders = (List<Map<String, Object>>) details.get("orders");
        if (orders.isEmpty()) {
            return render(NOT_FOUND_REPLY, Map.of("lookupKey", details.get("lookupKey")));
        }
        StringBuilder lines = new StringBuilder();
        for (Map<String, Object> order : orders) {
            lines.append("- ").append(order.get("orderNumber"))
                    .append(": ").append(order.get("status"))
                    .append(", total ").append(order.get("totalPaid"))
                    .append(' ').append(order.get("currency"));
            if (order.get("created") != null) {
                lines.append(", placed ").append(order.get("created"));
            }
            lines.append('\n');
        }
        Map<String, Object> variables = new LinkedHashMap<>();
        variables.put("orderCount", orders.size());
        variables.put("lookupKey", details.get("lookupKey"));
        variables.put("orderLines", lines.toString().trim());
        return render(FOUND_REPLY, variables);
    }

    private Map<String, Object> summarize(OrderRecord order) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("orderNumber", order.getOrderNumber());
        summary.put("status", order.getStatus());
        summary.put("totalPaid", order.getTotalPaid() == null ? null : order.getTotalPaid().toPlainString());
        summary.put("currency", order.getTotalPaidCurrency());
        summary.put("created", order.getCreated() == null ? null : order.getCreated().toLocalDate().toString());
        summary.put("shippingAddress", order.getShippingAddress());
        return summary;
    }
}
