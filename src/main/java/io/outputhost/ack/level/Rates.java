package io.outputhost.ack.level;

import java.time.Duration;
import java.time.Instant;

public final class Rates {
    private static final long MIN_ELAPSED_NANOS = 1_000_000L;

    private Rates() {
    }

    /**
     * Per-second rate of change of a level between two snapshots.
     * Returns 0 when less than a millisecond separates them or either timestamp is unknown.
     */
    public static double perSecond(final long previous,
                                   final long current,
                                   final Instant previousAsOf,
                                   final Instant currentAsOf) {
        if (previousAsOf == null || currentAsOf == null) return 0d;

        final long elapsedNanos = Duration.between(previousAsOf, currentAsOf).toNanos();
        if (elapsedNanos < MIN_ELAPSED_NANOS) return 0d;

        return (current - previous) * 1e9d / elapsedNanos;
    }
}
