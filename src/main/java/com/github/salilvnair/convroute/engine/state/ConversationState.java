package com.github.salilvnair.convroute.engine.state;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable per-user conversation record. Every turn produces a new instance through
 * {@link #apply(StateUpdate, Instant, int)}.
 */
public record ConversationState(
        String userId,
        HandlerKind currentHandler,
        SubDialog pendingSubDialog,
        int turnCount,
        int consecutiveTurns,
        int subDialogAttempts,
        List<HandlerTransition> history,
        Instant createdAt,
        Instant lastActivity,
        String resolvedContact
) {

    public ConversationState {
        pendingSubDialog = pendingSubDialog == null ? SubDialog.NONE : pendingSubDialog;
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static ConversationState initial(String userId) {
        Instant now = Instant.now();
        return new ConversationState(userId, null, SubDialog.NONE, 0, 0, 0, List.of(), now, now, null);
    }

    public boolean awaitingContactInfo() {
        return pendingSubDialog == SubDialog.AWAITING_CONTACT_INFO;
    }

    public ConversationState apply(StateUpdate update, Instant now, int historyLimit) {
        if (update.inputError()) {
            return new ConversationState(userId, currentHandler, pendingSubDialog, turnCount + 1,
                    consecutiveTurns, subDialogAttempts, history, createdAt, now, resolvedContact);
        }
        List<HandlerTransition> nextHistory = new ArrayList<>(history);
        nextHistory.add(new HandlerTransition(update.handler(), now, update.query()));
        while (historyLimit > 0 && nextHistory.size() > historyLimit) {
            nextHistory.remove(0);
        }

        int nextStreak;
        if (update.resetStreak()) {
            nextStreak = 0;
        }
        else if (update.handler() == currentHandler) {
            nextStreak = consecutiveTurns + 1;
        }
        else {
            nextStreak = 1;
        }

        int nextAttempts = 0;
        if (update.nextSubDialog() == SubDialog.AWAITING_CONTACT_INFO && awaitingContactInfo()) {
            nextAttempts = update.failedAttempt() ? subDialogAttempts + 1 : subDialogAttempts;
        }

        return new ConversationState(
                userId,
                update.handler(),
                update.nextSubDialog(),
                turnCount + 1,
                nextStreak,
                nextAttempts,
                nextHistory,
                createdAt,
                now,
                update.resolvedContact() == null ? resolvedContact : update.resolvedContact()
        );
    }
}
