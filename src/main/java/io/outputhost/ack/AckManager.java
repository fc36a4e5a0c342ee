package io.outputhost.ack;

import io.outputhost.ack.ledger.DeliveryLedger;
import io.outputhost.ack.ledger.DeliveryRecord;
import io.outputhost.ack.level.Levels;
import io.outputhost.ack.level.Rates;
import io.outputhost.core.ackid.AckId;
import io.outputhost.core.ackid.TimestampedAckId;
import io.outputhost.metadata.ConsumerGroupExtentStatus;
import io.outputhost.metadata.ExtentCheckpoint;
import io.outputhost.metadata.ExtentMetadataStore;
import io.outputhost.metadata.SetAckOffsetRequest;
import io.outputhost.metrics.AckMetrics;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Tracks deliveries and acks for one consumer group on one extent.
 * <p>
 * The delivery path asks for an ack id per message ({@link #getNextAckId}), consumers ack or nack
 * those ids ({@link #acknowledgeMessage}) in any order, and a background task periodically moves
 * the ack level through the contiguous run of acked messages and reports the levels to the
 * metadata store. Once the extent is sealed and everything read has been acked the extent is
 * reported consumed and the extent lifecycle owner is pulsed.
 * </p>
 * All mutable state is guarded by {@link #lock}. Metadata writes and queue hand-offs always
 * happen after the lock is released.
 */
@Slf4j
public final class AckManager {
    public static final Duration DEFAULT_ACK_LEVEL_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_METADATA_TIMEOUT = Duration.ofSeconds(10);

    @Getter
    private final int ackMgrId;
    private final int sessionId;
    private final String outputHostId;
    @Getter
    private final String consumerGroupId;
    @Getter
    private final String extentId;
    private final String connectedStoreId;

    private final ExtentMetadataStore store;
    private final AckMetrics metrics;
    private final BlockingQueue<TimestampedAckId> ackQueue;
    private final BlockingQueue<TimestampedAckId> nackQueue;
    private final BlockingQueue<Boolean> consumedQueue;
    private final Clock clock;
    private final Duration ackLevelInterval;
    private final Duration metadataTimeout;
    private final boolean traceAcks;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final DeliveryLedger ledger = new DeliveryLedger();
    private Levels levels;
    private Levels prev;
    private boolean sealed;
    private long lastAckedSeq;

    private final ScheduledExecutorService scheduler;
    private final ExecutorService metadataExecutor;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    // Set when the last metadata write failed so the next cycle re-sends even if nothing moved.
    private final AtomicBoolean persistPending = new AtomicBoolean(false);

    private AckManager(final Builder b) {
        this.ackMgrId = b.ackMgrId;
        this.sessionId = b.sessionId;
        this.outputHostId = b.outputHostId;
        this.consumerGroupId = Objects.requireNonNull(b.consumerGroupId, "consumerGroupId");
        this.extentId = Objects.requireNonNull(b.extentId, "extentId");
        this.connectedStoreId = b.connectedStoreId;
        this.store = Objects.requireNonNull(b.store, "store");
        this.metrics = b.metrics != null ? b.metrics : AckMetrics.NOOP;
        this.ackQueue = Objects.requireNonNull(b.ackQueue, "ackQueue");
        this.nackQueue = Objects.requireNonNull(b.nackQueue, "nackQueue");
        this.consumedQueue = b.consumedQueue;
        this.clock = b.clock != null ? b.clock : Clock.systemUTC();
        this.ackLevelInterval = b.ackLevelInterval != null ? b.ackLevelInterval : DEFAULT_ACK_LEVEL_INTERVAL;
        this.metadataTimeout = b.metadataTimeout != null ? b.metadataTimeout : DEFAULT_METADATA_TIMEOUT;
        this.traceAcks = b.traceAcks;

        if (ackLevelInterval.isZero() || ackLevelInterval.isNegative()) {
            throw new IllegalArgumentException("ackLevelInterval must be > 0");
        }

        final ExtentCheckpoint cp = b.checkpoint != null ? b.checkpoint : ExtentCheckpoint.initial();
        // The local read level starts at the persisted ack level and must leave room in the 32-bit ack id sequence.
        if (cp.ackLevelSeq() < 0 || cp.ackLevelSeq() >= AckId.MAX_SEQ_NUM) {
            throw new IllegalArgumentException("checkpoint ackLevelSeq out of range [0, " + AckId.MAX_SEQ_NUM + "): " + cp.ackLevelSeq());
        }

        // Seed prev with a timestamp so the first cycle already computes sensible rates.
        this.prev = new Levels(clock.instant(), cp.ackLevelSeq(), cp.ackLevelAddress(), cp.readLevelAddress());
        this.levels = new Levels(null, cp.ackLevelSeq(), cp.ackLevelAddress(), cp.readLevelAddress());
        this.lastAckedSeq = cp.ackLevelSeq();

        this.scheduler = Executors.newSingleThreadScheduledExecutor(daemonFactory("ack-level-" + extentId));
        this.metadataExecutor = Executors.newSingleThreadExecutor(daemonFactory("ack-meta-" + extentId));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Assigns the next local sequence to a message about to be delivered and records it.
     * Must be called once per delivered message, from the single delivery thread.
     *
     * @param address     store address of the message
     * @param upstreamSeq upstream sequence of the message; 0 disables discontinuity checks
     * @return the encoded ack id for the message
     */
    public String getNextAckId(final long address, final long upstreamSeq) {
        lock.writeLock().lock();
        try {
            final long readLevel = levels.getReadLevel() + 1; // first id handed out is 1
            final String ackId = AckId.construct(sessionId, ackMgrId, readLevel, address);
            levels.setReadLevel(readLevel);
            levels.setReadLevelAddress(address);

            final DeliveryRecord previous = ledger.get(readLevel);
            final long expectedSeq = previous != null ? previous.getUpstreamSeq() : upstreamSeq;

            // Timer destinations have discontinuous sequences and always send 0.
            if (upstreamSeq != 0 && expectedSeq != upstreamSeq) {
                final long skipped = upstreamSeq - expectedSeq;
                if (skipped < 0) {
                    // Gauges can't carry negative values, so this only shows up in the log.
                    log.error("Negative discontinuity detected (rollback): gotSeqNum={} gotAddress={} expectedSeqNum={} readLevel={}",
                            upstreamSeq, address, expectedSeq, readLevel);
                } else {
                    // The same skip can be reported again if the host restarts before the ack level passes it.
                    metrics.skippedMessages(skipped);
                }
            }

            levels.setReadLevelSeq(upstreamSeq);
            ledger.put(readLevel, new DeliveryRecord(address, upstreamSeq));

            return ackId;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Records an ack or nack and forwards it to the message-state tracker.
     * Acks for unknown sequences are counted and dropped.
     *
     * @throws AckAddressMismatchException if the id's address differs from the delivered one
     */
    public void acknowledgeMessage(final AckId ackId, final boolean isNack) {
        final long seq = ackId.seqNum();
        final long address = ackId.address();
        boolean notify = false;
        AckAddressMismatchException mismatch = null;

        lock.writeLock().lock();
        try {
            final DeliveryRecord record = ledger.get(seq);
            if (record == null) {
                metrics.seqNotFound();
            } else if (record.getStoreAddress() != address) {
                log.error("Ack address does not match: address={} expected={} seq={}",
                        address, record.getStoreAddress(), seq);
                mismatch = new AckAddressMismatchException(seq, address, record.getStoreAddress());
            } else {
                notify = true;
                if (traceAcks) {
                    log.info("msg ack: address={} seq={} isNack={}", address, seq, isNack);
                }
                if (!isNack && record.markAcked() && lastAckedSeq < seq) {
                    lastAckedSeq = seq;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }

        if (notify) {
            final TimestampedAckId stamped = new TimestampedAckId(ackId, clock.instant());
            try {
                (isNack ? nackQueue : ackQueue).put(stamped);
            } catch (final InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while forwarding {} for seq {}", isNack ? "nack" : "ack", seq);
            }
        }

        if (mismatch != null) {
            throw mismatch;
        }
    }

    /**
     * Undoes the last {@link #getNextAckId} when the message never made it to the consumer.
     *
     * @throws LedgerCorruptionError if the current read level does not hold a message at {@code address}
     */
    public void resetMsg(final long address) {
        lock.writeLock().lock();
        try {
            final long readLevel = levels.getReadLevel();
            final DeliveryRecord record = ledger.get(readLevel);
            if (record == null || record.getStoreAddress() != address) {
                metrics.resetMsgError();
                final String expected = record == null ? "<none>" : Long.toString(record.getStoreAddress());
                log.error("resetMsg: offsets don't match! readLevel={} expectedOffset={} offset={}",
                        readLevel, expected, address);
                throw new LedgerCorruptionError("resetMsg at read level " + readLevel
                        + ": expected offset " + expected + " but got " + address);
            }

            metrics.resetMsg();
            ledger.remove(readLevel);
            levels.setReadLevel(readLevel - 1);

            final DeliveryRecord below = ledger.get(readLevel - 1);
            if (below != null) {
                levels.setReadLevelSeq(below.getUpstreamSeq());
                levels.setReadLevelAddress(below.getStoreAddress());
            } else {
                levels.setReadLevelSeq(levels.getAckLevelSeq());
                levels.setReadLevelAddress(levels.getAckLevelAddress());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** Notes that no more messages will be appended to the extent. */
    public void notifySealed() {
        lock.writeLock().lock();
        try {
            if (!sealed) {
                log.info("Extent {} sealed for consumer group {}", extentId, consumerGroupId);
            }
            sealed = true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ReadLevel getCurrentReadLevel() {
        lock.readLock().lock();
        try {
            return new ReadLevel(levels.getReadLevelAddress(), levels.getReadLevel());
        } finally {
            lock.readLock().unlock();
        }
    }

    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("AckManager " + ackMgrId + " already stopped");
        }
        if (!started.compareAndSet(false, true)) return;

        final long periodMs = ackLevelInterval.toMillis();
        scheduler.scheduleAtFixedRate(this::tick, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.info("AckManager {} started for extent {} of consumer group {}", ackMgrId, extentId, consumerGroupId);
    }

    /**
     * Stops the periodic task, waits for a running cycle to finish and runs one last cycle so
     * pending acks are persisted before teardown.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;

        scheduler.shutdown();
        try {
            final long waitMs = metadataTimeout.plus(ackLevelInterval).toMillis();
            if (!scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
                log.warn("Ack level task for extent {} did not finish within {}ms", extentId, waitMs);
                scheduler.shutdownNow();
            }
        } catch (final InterruptedException ie) {
            Thread.currentThread().interrupt();
            scheduler.shutdownNow();
        }

        updateAckLevel();
        metadataExecutor.shutdown();
        metrics.close();

        log.info("AckManager stopped, state={}", getState());
    }

    public AckManagerState getState() {
        lock.readLock().lock();
        try {
            final DeliveryLedger.Tally tally = ledger.tally(levels.getAckLevel());
            return new AckManagerState(
                    ackMgrId,
                    sealed,
                    levels.getReadLevel(),
                    levels.getAckLevel(),
                    levels.getReadLevelAddress(),
                    levels.getAckLevelAddress(),
                    levels.getAsOf(),
                    lastAckedSeq,
                    tally.acked(),
                    tally.unacked());
        } finally {
            lock.readLock().unlock();
        }
    }

    private void tick() {
        try {
            updateAckLevel();
        } catch (final RuntimeException e) {
            // An escaping exception would cancel the fixed-rate task.
            log.error("Ack level update failed for extent {}", extentId, e);
        }
    }

    /**
     * Moves the ack level through the acked run, detects the consumed state and persists the
     * levels when either changed.
     */
    void updateAckLevel() {
        final SetAckOffsetRequest request;
        final boolean consumed;
        final int processed;
        final int ledgerSize;

        lock.writeLock().lock();
        try {
            final DeliveryLedger.Advance advance = ledger.advance(levels.getAckLevel());
            processed = advance.processed();
            boolean update = advance.moved() | persistPending.getAndSet(false);
            if (advance.moved()) {
                final DeliveryRecord last = advance.last();
                levels.setAckLevel(advance.ackLevel());
                levels.setAckLevelSeq(last.getUpstreamSeq());
                levels.setAckLevelAddress(last.getStoreAddress());
            }

            consumed = sealed && levels.getAckLevel() == levels.getReadLevel();
            if (consumed) {
                log.debug("Extent {} sealed and consumed", extentId);
                update = true;
            }

            if (update) {
                levels.setAsOf(clock.instant());
                if (consumed) {
                    levels.setAckRate(0d);
                    levels.setReadRate(0d);
                } else {
                    levels.setAckRate(Rates.perSecond(prev.getAckLevel(), levels.getAckLevel(), prev.getAsOf(), levels.getAsOf()));
                    levels.setReadRate(Rates.perSecond(prev.getReadLevel(), levels.getReadLevel(), prev.getAsOf(), levels.getAsOf()));
                }
                request = new SetAckOffsetRequest(
                        outputHostId,
                        consumerGroupId,
                        extentId,
                        connectedStoreId,
                        levels.getAckLevelAddress(),
                        levels.getAckLevelSeq(),
                        levels.getReadLevelAddress(),
                        levels.getReadLevelSeq(),
                        consumed ? ConsumerGroupExtentStatus.CONSUMED : ConsumerGroupExtentStatus.OPEN,
                        levels.getAckRate(),
                        levels.getReadRate());
                prev = levels.copy();
            } else {
                request = null;
            }
            ledgerSize = ledger.size();
        } finally {
            lock.writeLock().unlock();
        }

        if (request != null) {
            if (persist(request)) {
                metrics.levelUpdate(processed);
                if (consumed) {
                    metrics.consumed();
                    notifyConsumed(request);
                }
            } else {
                persistPending.set(true);
            }
        }

        if (ledgerSize > 0) {
            metrics.ledgerSize(ledgerSize);
        }
    }

    private boolean persist(final SetAckOffsetRequest request) {
        final Future<?> pending;
        try {
            pending = metadataExecutor.submit(() -> {
                store.setAckOffset(request);
                return null;
            });
        } catch (final RejectedExecutionException e) {
            log.error("Metadata executor rejected ack level update for extent {}", extentId, e);
            return false;
        }

        try {
            pending.get(metadataTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (final ExecutionException e) {
            log.error("Error updating ackLevel: extent={} ackLevelAddress={}",
                    extentId, request.ackLevelAddress(), e.getCause());
        } catch (final TimeoutException e) {
            pending.cancel(true);
            log.error("Timed out after {}ms updating ackLevel: extent={} ackLevelAddress={}",
                    metadataTimeout.toMillis(), extentId, request.ackLevelAddress());
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while updating ackLevel for extent {}", extentId);
        }
        return false;
    }

    // Never blocks; a full or missing receiver gets the pulse on a later cycle.
    private void notifyConsumed(final SetAckOffsetRequest request) {
        if (consumedQueue != null && consumedQueue.offer(Boolean.TRUE)) {
            log.info("Extent {} consumed by consumer group {} at ackLevelAddress={}",
                    extentId, consumerGroupId, request.ackLevelAddress());
        }
    }

    private static ThreadFactory daemonFactory(final String name) {
        return r -> {
            final Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        };
    }

    /** Store address and local sequence of the last message handed out. */
    public record ReadLevel(long address, long seq) {
    }

    public static final class Builder {
        private int ackMgrId;
        private int sessionId;
        private String outputHostId;
        private String consumerGroupId;
        private String extentId;
        private String connectedStoreId;
        private ExtentCheckpoint checkpoint;
        private ExtentMetadataStore store;
        private AckMetrics metrics;
        private BlockingQueue<TimestampedAckId> ackQueue;
        private BlockingQueue<TimestampedAckId> nackQueue;
        private BlockingQueue<Boolean> consumedQueue;
        private Clock clock;
        private Duration ackLevelInterval;
        private Duration metadataTimeout;
        private boolean traceAcks;

        public Builder ackMgrId(final int ackMgrId) {
            this.ackMgrId = ackMgrId;
            return this;
        }

        public Builder sessionId(final int sessionId) {
            this.sessionId = sessionId;
            return this;
        }

        public Builder outputHostId(final String outputHostId) {
            this.outputHostId = outputHostId;
            return this;
        }

        public Builder consumerGroupId(final String consumerGroupId) {
            this.consumerGroupId = consumerGroupId;
            return this;
        }

        public Builder extentId(final String extentId) {
            this.extentId = extentId;
            return this;
        }

        public Builder connectedStoreId(final String connectedStoreId) {
            this.connectedStoreId = connectedStoreId;
            return this;
        }

        /** Last persisted levels; defaults to {@link ExtentCheckpoint#initial()}. */
        public Builder checkpoint(final ExtentCheckpoint checkpoint) {
            this.checkpoint = checkpoint;
            return this;
        }

        public Builder store(final ExtentMetadataStore store) {
            this.store = store;
            return this;
        }

        public Builder metrics(final AckMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder ackQueue(final BlockingQueue<TimestampedAckId> ackQueue) {
            this.ackQueue = ackQueue;
            return this;
        }

        public Builder nackQueue(final BlockingQueue<TimestampedAckId> nackQueue) {
            this.nackQueue = nackQueue;
            return this;
        }

        public Builder consumedQueue(final BlockingQueue<Boolean> consumedQueue) {
            this.consumedQueue = consumedQueue;
            return this;
        }

        public Builder clock(final Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder ackLevelInterval(final Duration ackLevelInterval) {
            this.ackLevelInterval = ackLevelInterval;
            return this;
        }

        public Builder metadataTimeout(final Duration metadataTimeout) {
            this.metadataTimeout = metadataTimeout;
            return this;
        }

        public Builder traceAcks(final boolean traceAcks) {
            this.traceAcks = traceAcks;
            return this;
        }

        public AckManager build() {
            return new AckManager(this);
        }
    }
}
