package io.outputhost.metrics;

/**
 * Metrics emitted by an ack manager. Implementations must be cheap and must not block.
 */
public interface AckMetrics {

    /** Upstream messages skipped between two consecutive deliveries (retention trimming). */
    void skippedMessages(long count);

    /** A delivery was rolled back because it never reached the consumer. */
    void resetMsg();

    /** A rollback did not match the ledger. Reported right before the process aborts. */
    void resetMsgError();

    /** An ack arrived for a sequence the ledger does not know. */
    void seqNotFound();

    /** Number of entries the ack level moved over in one persisted cycle. */
    void levelUpdate(long count);

    /** Entries currently tracked by the ledger. */
    void ledgerSize(long size);

    /** The extent became consumed and that was persisted. */
    void consumed();

    /** Releases whatever the implementation registered. Called once when the manager stops. */
    default void close() {
    }

    AckMetrics NOOP = new AckMetrics() {
        @Override
        public void skippedMessages(final long count) {
        }

        @Override
        public void resetMsg() {
        }

        @Override
        public void resetMsgError() {
        }

        @Override
        public void seqNotFound() {
        }

        @Override
        public void levelUpdate(final long count) {
        }

        @Override
        public void ledgerSize(final long size) {
        }

        @Override
        public void consumed() {
        }
    };
}
