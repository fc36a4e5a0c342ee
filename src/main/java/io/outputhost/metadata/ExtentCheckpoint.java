package io.outputhost.metadata;

import java.util.Objects;

/** Last persisted levels of a consumer-group extent, used to seed a fresh ack manager. */
public record ExtentCheckpoint(long ackLevelSeq,
                               long ackLevelAddress,
                               long readLevelSeq,
                               long readLevelAddress,
                               ConsumerGroupExtentStatus status) {
    public ExtentCheckpoint {
        Objects.requireNonNull(status, "status");
    }

    public static ExtentCheckpoint initial() {
        return new ExtentCheckpoint(0L, -1L, 0L, -1L, ConsumerGroupExtentStatus.OPEN);
    }

    public boolean consumed() {
        return status == ConsumerGroupExtentStatus.CONSUMED;
    }
}
