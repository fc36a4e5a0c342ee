package io.outputhost.metadata;

import java.io.IOException;
import java.util.Optional;

/**
 * Metadata service view of consumer-group extents.
 * Implementations must treat {@link #setAckOffset} as an upsert: the same request may arrive
 * more than once, and a newer request always carries the full levels.
 */
public interface ExtentMetadataStore {

    /**
     * Records the ack and read levels carried by the request.
     */
    void setAckOffset(SetAckOffsetRequest request) throws IOException;

    /**
     * Returns the last recorded levels for the consumer group on the extent, if any.
     */
    Optional<ExtentCheckpoint> checkpoint(String consumerGroupId, String extentId) throws IOException;
}
