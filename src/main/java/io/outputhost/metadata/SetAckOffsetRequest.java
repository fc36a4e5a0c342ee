package io.outputhost.metadata;

import java.util.Objects;

/**
 * Absolute ack/read levels of one consumer-group extent as reported by an output host.
 * Carries levels rather than deltas, so re-sending the same request is harmless.
 */
public record SetAckOffsetRequest(String outputHostId,
                                  String consumerGroupId,
                                  String extentId,
                                  String connectedStoreId,
                                  long ackLevelAddress,
                                  long ackLevelSeq,
                                  long readLevelAddress,
                                  long readLevelSeq,
                                  ConsumerGroupExtentStatus status,
                                  double ackLevelSeqRate,
                                  double readLevelSeqRate) {
    public SetAckOffsetRequest {
        Objects.requireNonNull(consumerGroupId, "consumerGroupId");
        Objects.requireNonNull(extentId, "extentId");
        Objects.requireNonNull(status, "status");
    }

    public ExtentCheckpoint toCheckpoint() {
        return new ExtentCheckpoint(ackLevelSeq, ackLevelAddress, readLevelSeq, readLevelAddress, status);
    }
}
