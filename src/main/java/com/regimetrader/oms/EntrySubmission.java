package com.regimetrader.oms;

import com.regimetrader.domain.model.Position;

/** Result of {@link TradeLifecycleManager#submitEntry}: a snapshot of the new position, or why none was opened. */
public record EntrySubmission(Position position, String rejectionReason) {

    public static EntrySubmission accepted(Position position) {
        return new EntrySubmission(position, null);
    }

    public static EntrySubmission rejected(String reason) {
        return new EntrySubmission(null, reason);
    }

    public boolean isAccepted() {
        return position != null;
    }
}
