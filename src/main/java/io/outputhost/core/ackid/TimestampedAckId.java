package io.outputhost.core.ackid;

import java.time.Instant;

/** An ack or nack forwarded to the message-state tracker, stamped with the time it was received. */
public record TimestampedAckId(AckId ackId, Instant receivedAt) {
}
