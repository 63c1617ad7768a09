package com.github.salilvnair.convroute.engine.state;

import com.github.salilvnair.convroute.engine.handler.HandlerKind;

/**
 * What one turn changes. Applied against the latest stored state, so concurrent
 * turns for the same user compose instead of overwriting each other.
 *
 * @param handler         handler that produced the reply
 * @param query           text recorded in the history
 * @param nextSubDialog   sub-dialog the user is in after this turn
 * @param failedAttempt   contact extraction failed while awaiting contact info
 * @param resetStreak     restart the same-handler streak (sub-dialog resolved)
 * @param resolvedContact lookup key that resolved this turn, or null
 * @param inputError      empty input, only the turn counter moves
 */
public record StateUpdate(
        HandlerKind handler,
        String query,
        SubDialog nextSubDialog,
        boolean failedAttempt,
        boolean resetStreak,
        String resolvedContact,
        boolean inputError
) {

    public static StateUpdate routed(HandlerKind handler, String query) {
        return new StateUpdate(handler, query, SubDialog.NONE, false, false, null, false);
    }

    public static StateUpdate enterSubDialog(HandlerKind handler, String query) {
        return new StateUpdate(handler, query, SubDialog.AWAITING_CONTACT_INFO, false, false, null, false);
    }

    public static StateUpdate subDialogRetry(HandlerKind handler, String query) {
        return new StateUpdate(handler, query, SubDialog.AWAITING_CONTACT_INFO, true, false, null, false);
    }

    public static StateUpdate resolved(HandlerKind handler, String query, String resolvedContact) {
        return new StateUpdate(handler, query, SubDialog.NONE, false, true, resolvedContact, false);
    }

    public static StateUpdate emptyInput() {
        return new StateUpdate(null, "", null, false, false, null, true);
    }
}
