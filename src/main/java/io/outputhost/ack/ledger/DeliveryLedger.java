package io.outputhost.ack.ledger;

import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.Map;

/**
 * Local sequence -> delivery record map for one consumer-group extent.
 * <p>
 * Not thread-safe. The owning ack manager only touches it while holding its lock.
 * </p>
 */
@Slf4j
public final class DeliveryLedger {
    private final Map<Long, DeliveryRecord> records = new HashMap<>();

    public void put(final long seq, final DeliveryRecord record) {
        records.put(seq, record);
    }

    public DeliveryRecord get(final long seq) {
        return records.get(seq);
    }

    public DeliveryRecord remove(final long seq) {
        return records.remove(seq);
    }

    public int size() {
        return records.size();
    }

    /**
     * Walks forward from {@code ackLevel + 1} through the unbroken run of acked records,
     * dropping each one as it is passed. Stops at the first unacked record or the first gap.
     * The scan never looks further than {@code ackLevel + size()}.
     */
    public Advance advance(final long ackLevel) {
        final long stop = ackLevel + records.size();
        long level = ackLevel;
        int processed = 0;
        DeliveryRecord last = null;

        for (long curr = ackLevel + 1; curr <= stop; curr++) {
            final DeliveryRecord r = records.get(curr);
            if (r == null || !r.isAcked()) break;

            records.remove(curr);
            level = curr;
            last = r;
            processed++;
        }
        return new Advance(level, processed, last);
    }

    /**
     * Counts acked and unacked records above the ack level without mutating anything.
     * Missing sequences in the range are logged; they should not exist.
     */
    public Tally tally(final long ackLevel) {
        final long stop = ackLevel + records.size();
        long acked = 0;
        long unacked = 0;

        for (long curr = ackLevel + 1; curr <= stop; curr++) {
            final DeliveryRecord r = records.get(curr);
            if (r == null) {
                log.error("Sequence number {} not found in the ack ledger", curr);
            } else if (r.isAcked()) {
                acked++;
            } else {
                unacked++;
            }
        }
        return new Tally(acked, unacked);
    }

    /**
     * @param ackLevel  ack level after the pass
     * @param processed number of records the pass moved over
     * @param last      record now sitting at the ack level, or null if nothing moved
     */
    public record Advance(long ackLevel, int processed, DeliveryRecord last) {
        public boolean moved() {
            return processed > 0;
        }
    }

    public record Tally(long acked, long unacked) {
    }
}
