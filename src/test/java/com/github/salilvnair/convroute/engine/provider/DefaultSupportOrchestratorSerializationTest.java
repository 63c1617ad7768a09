package com.github.salilvnair.convroute.engine.provider;

import com.github.salilvnair.convroute.config.ConvRouteRoutingConfig;
import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import com.github.salilvnair.convroute.engine.handler.HandlerRegistry;
import com.github.salilvnair.convroute.engine.handler.HandlerReply;
import com.github.salilvnair.convroute.engine.model.SessionInfo;
import com.github.salilvnair.convroute.engine.routing.SupportRouter;
import com.github.salilvnair.convroute.engine.state.ConversationStateStore;
import com.github.salilvnair.convroute.support.StubHandler;
import com.github.salilvnair.convroute.support.TestHandlers;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.github.salilvnair.convroute.support.TestConstants.TEXT_CHECK_MY_ORDERS;
import static com.github.salilvnair.convroute.support.TestConstants.TEXT_SOFTWARE_CRASH;
import static com.github.salilvnair.convroute.support.TestConstants.USER_ALICE;
import static com.github.salilvnair.convroute.support.TestConstants.USER_BOB;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefaultSupportOrchestratorSerializationTest {

    private final CountDownLatch entered = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private final ExecutorService pool = Executors.newFixedThreadPool(3);

    private DefaultSupportOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        Map<HandlerKind, StubHandler> stubs = TestHandlers.stubs(0.5d);
        stubs.get(HandlerKind.TECHNICAL).confidence(0.9d).blockUntil(entered, release);
        HandlerRegistry registry = TestHandlers.stubRegistry(stubs);
        ConvRouteRoutingConfig routingConfig = new ConvRouteRoutingConfig();
        orchestrator = new DefaultSupportOrchestrator(
                new ConversationStateStore(routingConfig),
                new SupportRouter(registry, routingConfig),
                registry,
                () -> 1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        pool.shutdownNow();
    }

    @Test
    void secondSubmitForSameUserWaitsForTheFirstTurn() throws Exception {
        Future<HandlerReply> first = pool.submit(() -> orchestrator.submit(TEXT_SOFTWARE_CRASH, USER_ALICE));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Future<HandlerReply> second = pool.submit(() -> orchestrator.submit(TEXT_CHECK_MY_ORDERS, USER_ALICE));
        assertThrows(TimeoutException.class, () -> second.get(200, TimeUnit.MILLISECONDS));

        release.countDown();

        assertEquals(HandlerKind.TECHNICAL, first.get(5, TimeUnit.SECONDS).handler());
        assertEquals(HandlerKind.ORDER_LOOKUP, second.get(5, TimeUnit.SECONDS).handler());
        SessionInfo session = orchestrator.sessionInfo(USER_ALICE).orElseThrow();
        assertEquals("AWAITING_CONTACT_INFO", session.getPendingSubDialog());
        assertEquals(HandlerKind.ORDER_LOOKUP.wireName(), session.getCurrentHandler());
        assertEquals(2, session.getTurnCount());
    }

    @Test
    void otherUsersAreNotBlockedBySlowHandler() throws Exception {
        pool.submit(() -> orchestrator.submit(TEXT_SOFTWARE_CRASH, USER_ALICE));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        Future<HandlerReply> bob = pool.submit(() -> orchestrator.submit(TEXT_CHECK_MY_ORDERS, USER_BOB));

        assertEquals(HandlerKind.ORDER_LOOKUP, bob.get(5, TimeUnit.SECONDS).handler());
        assertEquals(1, orchestrator.sessionInfo(USER_BOB).orElseThrow().getTurnCount());
        assertEquals(0, orchestrator.sessionInfo(USER_ALICE).orElseThrow().getTurnCount());
    }
}
