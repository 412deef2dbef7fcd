package de.bsommerfeld.finance.core.event;

import java.util.Map;

/**
 * Events describing changes to the stored transactions. Posted on the UI
 * thread after the store call has completed.
 */
public class TransactionEvents {

    /** What kind of mutation produced a {@link TransactionsChangedEvent}. */
    public enum Change {
        ADDED,
        UPDATED,
        DELETED,
        IMPORTED
    }

    /**
     * Fired after any write that changes the set of visible transactions.
     *
     * @param change the kind of write
     * @param count  number of affected rows
     */
    public record TransactionsChangedEvent(Change change, int count) {
    }

    /**
     * Fired after the id compaction rebuilt the table. Any id held from before
     * the event is stale; {@code mapping} translates old ids to new ones.
     */
    public record IdsCompactedEvent(Map<Long, Long> mapping) {
    }
}
