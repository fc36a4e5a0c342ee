package io.outputhost.ack.ledger;

import lombok.Getter;
import lombok.ToString;

/**
 * Delivery state of one message handed to a consumer, keyed in the ledger by its local sequence.
 * The acked flag only ever moves from false to true.
 */
@Getter
@ToString
public final class DeliveryRecord {
    private final long storeAddress;
    private final long upstreamSeq;
    private boolean acked;

    public DeliveryRecord(final long storeAddress, final long upstreamSeq) {
        this.storeAddress = storeAddress;
        this.upstreamSeq = upstreamSeq;
    }

    /**
     * @return true if this call flipped the flag, false if it was already acked
     */
    public boolean markAcked() {
        if (acked) return false;
        acked = true;
        return true;
    }
}
