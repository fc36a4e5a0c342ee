package io.outputhost.ack;

/**
 * The delivery ledger no longer matches what the delivery path believes it handed out.
 * There is no safe way to continue; this is never caught and is expected to take the process down.
 */
public final class LedgerCorruptionError extends Error {
    public LedgerCorruptionError(final String message) {
        super(message);
    }
}
