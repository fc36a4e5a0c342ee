package io.outputhost.ack;

import java.time.Instant;

/** Point-in-time view of an ack manager for operational introspection. */
public record AckManagerState(int ackMgrId,
                              boolean sealed,
                              long readLevelSeq,
                              long ackLevelSeq,
                              long readLevelOffset,
                              long ackLevelOffset,
                              Instant lastAckLevelUpdateTime,
                              long lastAckedSeq,
                              long numAckedMsgs,
                              long numUnackedMsgs) {
}
