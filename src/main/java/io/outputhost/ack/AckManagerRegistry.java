package io.outputhost.ack;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.outputhost.config.impl.OutputHostConfig;
import io.outputhost.core.ackid.AckId;
import io.outputhost.core.ackid.TimestampedAckId;
import io.outputhost.metadata.ExtentCheckpoint;
import io.outputhost.metadata.ExtentMetadataStore;
import io.outputhost.metrics.MicrometerAckMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;

/**
 * Owns the ack managers open on this output host.
 * <p>
 * Hands out host-unique 16-bit manager ids, seeds each manager from the metadata store and
 * routes encoded ack ids coming back from consumers to the manager that issued them.
 * </p>
 */
@Slf4j
public final class AckManagerRegistry implements AutoCloseable {
    private static final int MAX_ACK_MGR_ID = 0xFFFF;

    private final OutputHostConfig cfg;
    private final ExtentMetadataStore store;
    private final MeterRegistry meterRegistry;
    private final BlockingQueue<TimestampedAckId> ackQueue;
    private final BlockingQueue<TimestampedAckId> nackQueue;
    private final Counter unknownAckMgr;

    private final Map<Integer, AckManager> byId = new HashMap<>();
    private final Map<String, AckManager> byExtent = new HashMap<>();
    private int lastId;

    public AckManagerRegistry(final OutputHostConfig cfg,
                              final ExtentMetadataStore store,
                              final MeterRegistry meterRegistry,
                              final BlockingQueue<TimestampedAckId> ackQueue,
                              final BlockingQueue<TimestampedAckId> nackQueue) {
        this.cfg = cfg;
        this.store = store;
        this.meterRegistry = meterRegistry;
        this.ackQueue = ackQueue;
        this.nackQueue = nackQueue;
        this.unknownAckMgr = meterRegistry.counter("outputhost.ackmgr.unknown");
    }

    /**
     * Opens and starts the ack manager for a consumer group on an extent, or returns the one
     * already open.
     *
     * @param consumedQueue receives a pulse each cycle once the extent is consumed
     */
    public synchronized AckManager open(final String consumerGroupId,
                                        final String extentId,
                                        final String connectedStoreId,
                                        final BlockingQueue<Boolean> consumedQueue) throws IOException {
        final String key = key(consumerGroupId, extentId);
        final AckManager existing = byExtent.get(key);
        if (existing != null) return existing;

        final ExtentCheckpoint cp = store.checkpoint(consumerGroupId, extentId).orElse(ExtentCheckpoint.initial());
        final int id = nextFreeId();

        final AckManager mgr = AckManager.builder()
                .ackMgrId(id)
                .sessionId(cfg.getSessionId())
                .outputHostId(cfg.getHostId())
                .consumerGroupId(consumerGroupId)
                .extentId(extentId)
                .connectedStoreId(connectedStoreId)
                .checkpoint(cp)
                .store(store)
                .metrics(new MicrometerAckMetrics(meterRegistry, consumerGroupId, extentId))
                .ackQueue(ackQueue)
                .nackQueue(nackQueue)
                .consumedQueue(consumedQueue)
                .ackLevelInterval(cfg.getAckLevelInterval())
                .metadataTimeout(cfg.getMetadataTimeout())
                .traceAcks(cfg.isTraceAcks())
                .build();

        byId.put(id, mgr);
        byExtent.put(key, mgr);
        mgr.start();

        log.info("Opened ack manager {} for extent {} of consumer group {} at ackLevel={}",
                id, extentId, consumerGroupId, cp.ackLevelSeq());
        return mgr;
    }

    public synchronized Optional<AckManager> get(final int ackMgrId) {
        return Optional.ofNullable(byId.get(ackMgrId));
    }

    public synchronized Optional<AckManager> get(final String consumerGroupId, final String extentId) {
        return Optional.ofNullable(byExtent.get(key(consumerGroupId, extentId)));
    }

    /**
     * Routes an ack id received from a consumer to the manager that issued it.
     * Ids from another session or for a manager that is no longer open are counted and dropped.
     *
     * @throws IllegalArgumentException    if the id cannot be decoded
     * @throws AckAddressMismatchException if the id's address does not match the delivery
     */
    public void acknowledge(final String encodedAckId, final boolean isNack) {
        final AckId ackId = AckId.decode(encodedAckId);
        final AckManager mgr;
        synchronized (this) {
            mgr = ackId.sessionId() == cfg.getSessionId() ? byId.get(ackId.ackMgrId()) : null;
        }
        if (mgr == null) {
            unknownAckMgr.increment();
            log.debug("Dropping ack for unknown ack manager: session={} ackMgrId={} seq={}",
                    ackId.sessionId(), ackId.ackMgrId(), ackId.seqNum());
            return;
        }
        mgr.acknowledgeMessage(ackId, isNack);
    }

    /** Stops and forgets the manager for a consumer group on an extent, if open. */
    public void close(final String consumerGroupId, final String extentId) {
        final AckManager mgr;
        synchronized (this) {
            mgr = byExtent.remove(key(consumerGroupId, extentId));
            if (mgr != null) {
                byId.remove(mgr.getAckMgrId());
            }
        }
        if (mgr != null) {
            mgr.stop();
        }
    }

    public synchronized List<AckManagerState> states() {
        final List<AckManagerState> out = new ArrayList<>(byId.size());
        for (final AckManager mgr : byId.values()) {
            out.add(mgr.getState());
        }
        return out;
    }

    @Override
    public void close() {
        final List<AckManager> all;
        synchronized (this) {
            all = new ArrayList<>(byId.values());
            byId.clear();
            byExtent.clear();
        }
        for (final AckManager mgr : all) {
            try {
                mgr.stop();
            } catch (final RuntimeException e) {
                log.error("Failed to stop ack manager {}", mgr.getAckMgrId(), e);
            }
        }
    }

    private int nextFreeId() {
        for (int attempt = 0; attempt < MAX_ACK_MGR_ID; attempt++) {
            lastId = (lastId % MAX_ACK_MGR_ID) + 1;
            if (!byId.containsKey(lastId)) return lastId;
        }
        throw new IllegalStateException("No free ack manager id; " + byId.size() + " managers open");
    }

    private static String key(final String consumerGroupId, final String extentId) {
        return consumerGroupId + "/" + extentId;
    }
}
