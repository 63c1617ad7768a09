package com.github.salilvnair.convroute.engine.state;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.github.salilvnair.convroute.support.TestConstants.EMAIL_JANE;
import static com.github.salilvnair.convroute.support.TestConstants.USER_ALICE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationStateTest {

    private static final int HISTORY_LIMIT = 100;

    private final Instant now = Instant.parse("2024-06-01T12:00:00Z");

    @Test
    void streakGrowsWithTheSameHandlerAndRestartsOnChange() {
        ConversationState state = ConversationState.initial(USER_ALICE)
                .apply(StateUpdate.routed(HandlerKind.TECHNICAL, "a"), now, HISTORY_LIMIT)
                .apply(StateUpdate.routed(HandlerKind.TECHNICAL, "b"), now, HISTORY_LIMIT);

        assertEquals(2, state.consecutiveTurns());

        state = state.apply(StateUpdate.routed(HandlerKind.BILLING, "c"), now, HISTORY_LIMIT);

        assertEquals(HandlerKind.BILLING, state.currentHandler());
        assertEquals(1, state.consecutiveTurns());
        assertEquals(3, state.turnCount());
        assertEquals(3, state.history().size());
    }

    @Test
    void emptyInputOnlyMovesTheTurnCounter() {
        ConversationState routed = ConversationState.initial(USER_ALICE)
                .apply(StateUpdate.routed(HandlerKind.GENERAL, "hi"), now, HISTORY_LIMIT);

        ConversationState afterEmpty = routed.apply(StateUpdate.emptyInput(), now.plusSeconds(5), HISTORY_LIMIT);

        assertEquals(2, afterEmpty.turnCount());
        assertEquals(HandlerKind.GENERAL, afterEmpty.currentHandler());
        assertEquals(1, afterEmpty.consecutiveTurns());
        assertEquals(1, afterEmpty.history().size());
        assertEquals(now.plusSeconds(5), afterEmpty.lastActivity());
    }

    @Test
    void subDialogAttemptsCountOnlyWhileAwaiting() {
        ConversationState state = ConversationState.initial(USER_ALICE)
                .apply(StateUpdate.enterSubDialog(HandlerKind.ORDER_LOOKUP, "where is my order"), now, HISTORY_LIMIT);

        assertTrue(state.awaitingContactInfo());
        assertEquals(0, state.subDialogAttempts());

        state = state.apply(StateUpdate.subDialogRetry(HandlerKind.ORDER_LOOKUP, "hmm"), now, HISTORY_LIMIT)
                .apply(StateUpdate.subDialogRetry(HandlerKind.ORDER_LOOKUP, "what"), now, HISTORY_LIMIT);

        assertEquals(2, state.subDialogAttempts());

        state = state.apply(StateUpdate.resolved(HandlerKind.ORDER_LOOKUP, EMAIL_JANE, EMAIL_JANE), now, HISTORY_LIMIT);

        assertFalse(state.awaitingContactInfo());
        assertEquals(0, state.subDialogAttempts());
        assertEquals(0, state.consecutiveTurns());
        assertEquals(EMAIL_JANE, state.resolvedContact());
    }

    @Test
    void historyIsBoundedOldestFirst() {
        ConversationState state = ConversationState.initial(USER_ALICE);
        for (int i = 0; i < 5; i++) {
            state = state.apply(StateUpdate.routed(HandlerKind.GENERAL, "q" + i), now, 3);
        }

        assertEquals(3, state.history().size());
        assertEquals("q2", state.history().get(0).query());
        assertEquals(5, state.turnCount());
    }

    @Test
    void initialStateHasNoHandler() {
        ConversationState state = ConversationState.initial(USER_ALICE);

        assertNull(state.currentHandler());
        assertEquals(SubDialog.NONE, state.pendingSubDialog());
        assertEquals(0, state.turnCount());
    }
}
