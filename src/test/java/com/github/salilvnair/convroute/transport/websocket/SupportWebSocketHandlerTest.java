package com.github.salilvnair.convroute.transport.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.github.salilvnair.convroute.config.ConvRouteRoutingConfig;
import com.github.salilvnair.convroute.config.ConvRouteTransportConfig;
import com.github.salilvnair.convroute.engine.handler.HandlerRegistry;
import com.github.salilvnair.convroute.engine.provider.DefaultSupportOrchestrator;
import com.github.salilvnair.convroute.engine.routing.SupportRouter;
import com.github.salilvnair.convroute.engine.state.ConversationStateStore;
import com.github.salilvnair.convroute.entity.OrderRecord;
import com.github.salilvnair.convroute.generation.core.GenerationService;
import com.github.salilvnair.convroute.store.OrderStore;
import com.github.salilvnair.convroute.support.TestHandlers;
import com.github.salilvnair.convroute.transport.protocol.FrameCodec;
import com.github.salilvnair.convroute.transport.protocol.FrameDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.math.BigDecimal;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.github.salilvnair.convroute.support.TestConstants.EMAIL_JANE;
import static com.github.salilvnair.convroute.support.TestConstants.ORDER_NUMBER;
import static com.github.salilvnair.convroute.support.TestConstants.TEXT_BUSINESS_HOURS;
import static com.github.salilvnair.convroute.support.TestConstants.TEXT_WHERE_IS_MY_ORDER;
import static com.github.salilvnair.convroute.support.TestConstants.USER_ALICE;
import static com.github.salilvnair.convroute.support.TestConstants.USER_BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SupportWebSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .findAndRegisterModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private OrderStore orderStore;
    private ConnectionRegistry registry;
    private SupportWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        orderStore = mock(OrderStore.class);
        ConvRouteRoutingConfig routingConfig = new ConvRouteRoutingConfig();
        HandlerRegistry handlers = TestHandlers.realRegistry(mock(GenerationService.class), orderStore, routingConfig);
        registry = new ConnectionRegistry();
        DefaultSupportOrchestrator orchestrator = new DefaultSupportOrchestrator(
                new ConversationStateStore(routingConfig),
                new SupportRouter(handlers, routingConfig),
                handlers,
                registry);
        handler = new SupportWebSocketHandler(registry, new FrameCodec(objectMapper), new FrameDispatcher(orchestrator),
                new ConvRouteTransportConfig(), Runnable::run);
    }

    @Test
    void sendsConnectionFrameOnOpen() throws Exception {
        Socket alice = socket("s1", USER_ALICE);

        handler.afterConnectionEstablished(alice.session);

        JsonNode frame = alice.frame(0);
        assertEquals("connection", frame.path("type").asText());
        assertEquals("connected", frame.path("status").asText());
        assertEquals(USER_ALICE, frame.path("userId").asText());
        assertEquals(1, registry.activeSessions());
    }

    @Test
    void fallsBackToConnectionIdWithoutUserParameter() throws Exception {
        Socket anonymous = socket("s1", null);

        handler.afterConnectionEstablished(anonymous.session);

        JsonNode frame = anonymous.frame(0);
        assertEquals(frame.path("connectionId").asText(), frame.path("userId").asText());
    }

    @Test
    void repliesToChatInOrder() throws Exception {
        Socket alice = socket("s1", USER_ALICE);
        handler.afterConnectionEstablished(alice.session);

        handler.handleTextMessage(alice.session, new TextMessage(TEXT_BUSINESS_HOURS));
        handler.handleTextMessage(alice.session, new TextMessage("{\"type\":\"session\",\"action\":\"get\"}"));

        assertEquals("message", alice.frame(1).path("type").asText());
        assertEquals("general_support", alice.frame(1).path("agentType").asText());
        JsonNode session = alice.frame(2);
        assertEquals("session", session.path("type").asText());
        assertEquals(1, session.path("data").path("turnCount").asInt());
    }

    @Test
    void reconnectKeepsThePendingOrderLookup() throws Exception {
        when(orderStore.findOrdersByEmail(EMAIL_JANE)).thenReturn(List.of(OrderRecord.builder()
                .orderNumber(ORDER_NUMBER)
                .status("SHIPPED")
                .totalPaid(new BigDecimal("49.99"))
                .totalPaidCurrency("USD")
                .build()));
        Socket first = socket("s1", USER_ALICE);
        handler.afterConnectionEstablished(first.session);
        handler.handleTextMessage(first.session, new TextMessage(TEXT_WHERE_IS_MY_ORDER));
        assertEquals("AWAITING_CONTACT_INFO", first.frame(1).path("metadata").path("subDialog").asText());

        handler.afterConnectionClosed(first.session, CloseStatus.NORMAL);
        assertEquals(0, registry.activeSessions());

        Socket second = socket("s2", USER_ALICE);
        handler.afterConnectionEstablished(second.session);
        handler.handleTextMessage(second.session, new TextMessage(EMAIL_JANE));

        JsonNode reply = second.frame(1);
        assertEquals("order_lookup", reply.path("agentType").asText());
        assertTrue(reply.path("content").asText().contains(ORDER_NUMBER));
    }

    @Test
    void usersDoNotShareConversationState() throws Exception {
        Socket alice = socket("s1", USER_ALICE);
        Socket bob = socket("s2", USER_BOB);
        handler.afterConnectionEstablished(alice.session);
        handler.afterConnectionEstablished(bob.session);

        handler.handleTextMessage(alice.session, new TextMessage(TEXT_WHERE_IS_MY_ORDER));
        handler.handleTextMessage(bob.session, new TextMessage("{\"type\":\"session\"}"));

        JsonNode bobSession = bob.frame(1);
        assertEquals("Session not found", bobSession.path("data").path("error").asText());
        assertNotEquals(alice.frame(0).path("connectionId").asText(), bob.frame(0).path("connectionId").asText());
    }

    @Test
    void unknownFrameTypeGetsAnErrorFrame() throws Exception {
        Socket alice = socket("s1", USER_ALICE);
        handler.afterConnectionEstablished(alice.session);

        handler.handleTextMessage(alice.session, new TextMessage("{\"type\":\"ping\"}"));

        assertEquals("error", alice.frame(1).path("type").asText());
        assertEquals("Unknown message type: ping", alice.frame(1).path("message").asText());
    }

    @Test
    void framesAfterCloseAreDropped() throws Exception {
        Socket alice = socket("s1", USER_ALICE);
        handler.afterConnectionEstablished(alice.session);
        ConnectionSession connection = registry.all().iterator().next();
        handler.afterConnectionClosed(alice.session, CloseStatus.GOING_AWAY);

        handler.process(connection, TEXT_BUSINESS_HOURS);

        assertEquals(1, alice.sent.size());
    }

    private Socket socket(String id, String userId) throws Exception {
        WebSocketSession session = mock(WebSocketSession.class);
        List<String> sent = new CopyOnWriteArrayList<>();
        Map<String, Object> attributes = new HashMap<>();
        when(session.getId()).thenReturn(id);
        when(session.getAttributes()).thenReturn(attributes);
        when(session.isOpen()).thenReturn(true);
        when(session.getUri()).thenReturn(URI.create(userId == null
                ? "ws://localhost/ws/support"
                : "ws://localhost/ws/support?userId=" + userId));
        doAnswer(invocation -> {
            sent.add(((TextMessage) invocation.getArgument(0)).getPayload());
            return null;
        }).when(session).sendMessage(any());
        return new Socket(session, sent);
    }

    private final class Socket {
        private final WebSocketSession session;
        private final List<String> sent;

        private Socket(WebSocketSession session, List<String> sent) {
            this.session = session;
            this.sent = sent;
        }

        private JsonNode frame(int index) throws Exception {
            return objectMapper.readTree(sent.get(index));
        }
    }
}
