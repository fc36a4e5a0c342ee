package io.outputhost.ack;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.outputhost.core.ackid.AckId;
import io.outputhost.core.ackid.TimestampedAckId;
import io.outputhost.metadata.ConsumerGroupExtentStatus;
import io.outputhost.metadata.ExtentCheckpoint;
import io.outputhost.metadata.SetAckOffsetRequest;
import io.outputhost.metrics.MicrometerAckMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

final class AckManagerTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final MutableClock clock = new MutableClock(T0);
    private final RecordingExtentStore store = new RecordingExtentStore();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final BlockingQueue<TimestampedAckId> acks = new LinkedBlockingQueue<>();
    private final BlockingQueue<TimestampedAckId> nacks = new LinkedBlockingQueue<>();
    private final BlockingQueue<Boolean> consumed = new ArrayBlockingQueue<>(1);

    private AckManager mgr;

    @AfterEach
    void tearDown() {
        if (mgr != null) mgr.stop();
    }

    private AckManager manager(final ExtentCheckpoint cp, final Duration interval, final Duration metadataTimeout) {
        mgr = AckManager.builder()
                .ackMgrId(3)
                .sessionId(9)
                .outputHostId("oh-1")
                .consumerGroupId("cg-1")
                .extentId("ext-1")
                .connectedStoreId("store-1")
                .checkpoint(cp)
                .store(store)
                .metrics(new MicrometerAckMetrics(meters, "cg-1", "ext-1"))
                .ackQueue(acks)
                .nackQueue(nacks)
                .consumedQueue(consumed)
                .clock(clock)
                .ackLevelInterval(interval)
                .metadataTimeout(metadataTimeout)
                .build();
        return mgr;
    }

    private AckManager manager() {
        return manager(ExtentCheckpoint.initial(), Duration.ofHours(1), Duration.ofSeconds(5));
    }

    private static List<String> deliver(final AckManager m, final long firstAddress, final long firstUpstreamSeq, final int n) {
        final List<String> ids = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            ids.add(m.getNextAckId(firstAddress + i, firstUpstreamSeq + i));
        }
        return ids;
    }

    private static void ack(final AckManager m, final String id) {
        m.acknowledgeMessage(AckId.decode(id), false);
    }

    private double counter(final String name) {
        return meters.get(name).counter().count();
    }

    private double gauge(final String name) {
        return meters.get(name).gauge().value();
    }

    @Test
    void ackIdsDecodeToIncreasingSequencesStartingAtOne() {
        final AckManager m = manager();
        final List<String> ids = deliver(m, 100L, 1L, 5);

        for (int i = 0; i < ids.size(); i++) {
            final AckId id = AckId.decode(ids.get(i));
            assertEquals(i + 1, id.seqNum());
            assertEquals(100L + i, id.address());
            assertEquals(9, id.sessionId());
            assertEquals(3, id.ackMgrId());
        }
        assertEquals(new AckManager.ReadLevel(104L, 5L), m.getCurrentReadLevel());
    }

    @Test
    void ackLevelStopsAtFirstUnackedMessage() {
        final AckManager m = manager();
        final List<String> ids = deliver(m, 100L, 1L, 5);
        ack(m, ids.get(0));
        ack(m, ids.get(1));
        ack(m, ids.get(2));
        ack(m, ids.get(4));

        m.updateAckLevel();

        final AckManagerState state = m.getState();
        assertEquals(3L, state.ackLevelSeq());
        assertEquals(5L, state.readLevelSeq());
        assertEquals(102L, state.ackLevelOffset());
        assertEquals(1L, state.numAckedMsgs());
        assertEquals(1L, state.numUnackedMsgs());

        final SetAckOffsetRequest req = store.last();
        assertEquals(ConsumerGroupExtentStatus.OPEN, req.status());
        assertEquals(3L, req.ackLevelSeq());
        assertEquals(102L, req.ackLevelAddress());
        assertEquals(5L, req.readLevelSeq());
        assertEquals(104L, req.readLevelAddress());
        assertEquals("oh-1", req.outputHostId());
        assertEquals("store-1", req.connectedStoreId());
        assertEquals(3.0, gauge(MicrometerAckMetrics.LEVEL_UPDATE));
        assertEquals(2.0, gauge(MicrometerAckMetrics.LEDGER_SIZE));

        ack(m, ids.get(3));
        m.updateAckLevel();
        assertEquals(5L, m.getState().ackLevelSeq());
        assertEquals(5L, store.last().ackLevelSeq());
    }

    @Test
    void ackLevelNeverDecreasesNorPassesReadLevel() {
        final AckManager m = manager();
        final List<String> ids = deliver(m, 0L, 1L, 12);
        final int[] order = {4, 0, 11, 2, 1, 7, 3, 9, 5, 10, 6, 8};

        long previous = m.getState().ackLevelSeq();
        for (final int i : order) {
            ack(m, ids.get(i));
            m.updateAckLevel();
            final AckManagerState s = m.getState();
            assertTrue(s.ackLevelSeq() >= previous, "ack level went backwards");
            assertTrue(s.ackLevelSeq() <= s.readLevelSeq(), "ack level passed read level");
            previous = s.ackLevelSeq();
        }
        assertEquals(12L, previous);
    }

    @Test
    void sealedAndFullyAckedExtentIsPersistedAsConsumedWithZeroRates() {
        final AckManager m = manager();
        deliver(m, 100L, 1L, 3).forEach(id -> ack(m, id));
        m.notifySealed();
        clock.advance(Duration.ofSeconds(10));

        m.updateAckLevel();

        final SetAckOffsetRequest req = store.last();
        assertEquals(ConsumerGroupExtentStatus.CONSUMED, req.status());
        assertEquals(0.0, req.ackLevelSeqRate());
        assertEquals(0.0, req.readLevelSeqRate());
        assertEquals(Boolean.TRUE, consumed.poll());
        assertEquals(1.0, counter(MicrometerAckMetrics.CONSUMED));
        assertTrue(m.getState().sealed());
    }

    @Test
    void sealedExtentWithOutstandingAcksStaysOpen() {
        final AckManager m = manager();
        final List<String> ids = deliver(m, 100L, 1L, 2);
        ack(m, ids.get(0));
        m.notifySealed();

        m.updateAckLevel();

        assertEquals(ConsumerGroupExtentStatus.OPEN, store.last().status());
        assertNull(consumed.poll());
    }

    @Test
    void consumedNotificationNeverBlocksOnFullQueue() {
        final AckManager m = manager();
        assertTrue(consumed.offer(Boolean.TRUE));
        ack(m, m.getNextAckId(1L, 1L));
        m.notifySealed();
        m.notifySealed();

        assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
            m.updateAckLevel();
            m.updateAckLevel();
        });

        final List<SetAckOffsetRequest> reqs = store.requests();
        assertEquals(2, reqs.size());
        reqs.forEach(r -> assertEquals(ConsumerGroupExtentStatus.CONSUMED, r.status()));
        assertEquals(1, consumed.size());
    }

    @Test
    void resetMsgRollsBackTheLastDelivery() {
        final AckManager m = manager();
        deliver(m, 100L, 1L, 2);

        m.resetMsg(101L);

        assertEquals(new AckManager.ReadLevel(100L, 1L), m.getCurrentReadLevel());
        assertEquals(1.0, counter(MicrometerAckMetrics.RESET_MSG));
        assertEquals(0L, m.getState().numAckedMsgs());
        assertEquals(1L, m.getState().numUnackedMsgs());

        final AckId redelivered = AckId.decode(m.getNextAckId(101L, 2L));
        assertEquals(2L, redelivered.seqNum());
    }

    @Test
    void resetMsgWithMismatchedAddressIsFatal() {
        final AckManager m = manager();
        m.getNextAckId(100L, 1L);

        assertThrows(LedgerCorruptionError.class, () -> m.resetMsg(999L));
        assertEquals(1.0, counter(MicrometerAckMetrics.RESET_MSG_ERROR));
        assertEquals(1L, m.getCurrentReadLevel().seq());
    }

    @Test
    void resetMsgWithNothingDeliveredIsFatal() {
        final AckManager m = manager();
        assertThrows(LedgerCorruptionError.class, () -> m.resetMsg(0L));
    }

    @Test
    void duplicateAckIsIdempotent() {
        final AckManager m = manager();
        final List<String> ids = deliver(m, 100L, 1L, 2);

        ack(m, ids.get(1));
        final AckManagerState first = m.getState();
        ack(m, ids.get(1));
        final AckManagerState second = m.getState();

        assertEquals(first, second);
        assertEquals(2L, second.lastAckedSeq());
        assertEquals(1L, second.numAckedMsgs());

        ack(m, ids.get(0));
        assertEquals(2L, m.getState().lastAckedSeq());
    }

    @Test
    void ackForUnknownSequenceIsCountedAndDropped() {
        final AckManager m = manager();
        m.getNextAckId(100L, 1L);

        m.acknowledgeMessage(new AckId(9, 3, 42L, 100L), false);

        assertEquals(1.0, counter(MicrometerAckMetrics.SEQ_NOT_FOUND));
        assertTrue(acks.isEmpty());
        assertEquals(0L, m.getState().numAckedMsgs());
    }

    @Test
    void ackWithWrongAddressIsRejectedAndNotForwarded() {
        final AckManager m = manager();
        final AckId id = AckId.decode(m.getNextAckId(100L, 1L));

        final AckAddressMismatchException e = assertThrows(AckAddressMismatchException.class,
                () -> m.acknowledgeMessage(new AckId(id.sessionId(), id.ackMgrId(), id.seqNum(), 555L), false));

        assertEquals(100L, e.expectedAddress());
        assertEquals(555L, e.address());
        assertTrue(acks.isEmpty());
        assertEquals(0L, m.getState().numAckedMsgs());
    }

    @Test
    void nackIsForwardedButDoesNotMoveTheAckLevel() {
        final AckManager m = manager();
        final String id = m.getNextAckId(100L, 1L);

        m.acknowledgeMessage(AckId.decode(id), true);
        m.updateAckLevel();

        assertEquals(1, nacks.size());
        assertTrue(acks.isEmpty());
        assertTrue(store.requests().isEmpty());
        assertEquals(0L, m.getState().ackLevelSeq());
    }

    @Test
    void acksAreForwardedWithReceiveTimestamp() {
        final AckManager m = manager();
        final String id = m.getNextAckId(100L, 1L);
        clock.advance(Duration.ofMillis(250));

        ack(m, id);

        final TimestampedAckId forwarded = acks.poll();
        assertNotNull(forwarded);
        assertEquals(AckId.decode(id), forwarded.ackId());
        assertEquals(T0.plusMillis(250), forwarded.receivedAt());
    }

    @Test
    void ratesArePerSecondDeltaSincePreviousCycle() {
        final ExtentCheckpoint cp = new ExtentCheckpoint(10L, 500L, 10L, 500L, ConsumerGroupExtentStatus.OPEN);
        final AckManager m = manager(cp, Duration.ofHours(1), Duration.ofSeconds(5));

        deliver(m, 501L, 11L, 20).forEach(id -> ack(m, id));
        clock.advance(Duration.ofSeconds(10));
        m.updateAckLevel();

        SetAckOffsetRequest req = store.last();
        assertEquals(30L, req.ackLevelSeq());
        assertEquals(2.0, req.ackLevelSeqRate(), 1e-9);
        assertEquals(2.0, req.readLevelSeqRate(), 1e-9);

        final List<String> more = deliver(m, 521L, 31L, 10);
        more.subList(0, 5).forEach(id -> ack(m, id));
        clock.advance(Duration.ofSeconds(5));
        m.updateAckLevel();

        req = store.last();
        assertEquals(35L, req.ackLevelSeq());
        assertEquals(1.0, req.ackLevelSeqRate(), 1e-9);
        assertEquals(2.0, req.readLevelSeqRate(), 1e-9);
    }

    @Test
    void seededManagerContinuesFromPersistedAckLevel() {
        final ExtentCheckpoint cp = new ExtentCheckpoint(41L, 9000L, 45L, 9400L, ConsumerGroupExtentStatus.OPEN);
        final AckManager m = manager(cp, Duration.ofHours(1), Duration.ofSeconds(5));

        final AckManagerState seeded = m.getState();
        assertEquals(41L, seeded.ackLevelSeq());
        assertEquals(41L, seeded.readLevelSeq());
        assertEquals(9000L, seeded.ackLevelOffset());
        assertEquals(9400L, seeded.readLevelOffset());
        assertNull(seeded.lastAckLevelUpdateTime());

        assertEquals(42L, AckId.decode(m.getNextAckId(9100L, 42L)).seqNum());
        assertEquals(0L, meters.find(MicrometerAckMetrics.SKIPPED_MESSAGES).gauge().value());
    }

    @Test
    void nothingIsPersistedWhenLevelsDidNotMove() {
        final AckManager m = manager();
        m.updateAckLevel();
        deliver(m, 100L, 1L, 3);
        m.updateAckLevel();

        assertTrue(store.requests().isEmpty());
    }

    @Test
    void persistenceFailureKeepsLevelAndRetriesNextCycle() {
        final AckManager m = manager();
        deliver(m, 100L, 1L, 2).forEach(id -> ack(m, id));
        store.failing(true);

        m.updateAckLevel();

        assertTrue(store.requests().isEmpty());
        assertEquals(2L, m.getState().ackLevelSeq());
        assertEquals(0.0, gauge(MicrometerAckMetrics.LEVEL_UPDATE));

        store.failing(false);
        m.updateAckLevel();

        assertEquals(1, store.requests().size());
        assertEquals(2L, store.last().ackLevelSeq());
        assertEquals(101L, store.last().ackLevelAddress());
    }

    @Test
    void slowMetadataStoreTimesOutAndIsRetried() {
        final AckManager m = manager(ExtentCheckpoint.initial(), Duration.ofHours(1), Duration.ofMillis(100));
        ack(m, m.getNextAckId(100L, 1L));
        final CountDownLatch release = new CountDownLatch(1);
        store.stallUntil(release);

        assertTimeoutPreemptively(Duration.ofSeconds(5), m::updateAckLevel);
        assertTrue(store.requests().isEmpty());
        assertEquals(1L, m.getState().ackLevelSeq());

        store.stallUntil(null);
        release.countDown();
        m.updateAckLevel();
        assertEquals(1L, store.last().ackLevelSeq());
    }

    @Test
    void upstreamSequenceIsCheckedAgainstTheEntryAlreadyAtTheNewLevel() {
        final AckManager m = manager();
        m.getNextAckId(100L, 1L);
        m.getNextAckId(101L, 2L);
        m.getNextAckId(102L, 7L);
        m.getNextAckId(103L, 3L);

        assertEquals(0.0, gauge(MicrometerAckMetrics.SKIPPED_MESSAGES));
        assertEquals(new AckManager.ReadLevel(103L, 4L), m.getCurrentReadLevel());
    }

    @Test
    void checkpointBeyondTheAckIdSequenceRangeIsRejected() {
        final ExtentCheckpoint cp = new ExtentCheckpoint(AckId.MAX_SEQ_NUM, 1L, AckId.MAX_SEQ_NUM, 1L, ConsumerGroupExtentStatus.OPEN);

        assertThrows(IllegalArgumentException.class, () -> manager(cp, Duration.ofHours(1), Duration.ofSeconds(5)));
    }

    @Test
    void stopUnregistersTheManagersGauges() {
        final AckManager m = manager();
        deliver(m, 100L, 1L, 2);

        m.stop();

        assertNull(meters.find(MicrometerAckMetrics.LEDGER_SIZE).gauge());
        assertNotNull(meters.find(MicrometerAckMetrics.CONSUMED).counter());
    }

    @Test
    void zeroUpstreamSequenceDisablesDiscontinuityChecks() {
        final AckManager m = manager();
        m.getNextAckId(100L, 0L);
        m.getNextAckId(250L, 0L);
        m.getNextAckId(900L, 0L);

        assertEquals(0.0, gauge(MicrometerAckMetrics.SKIPPED_MESSAGES));
        assertEquals(3L, m.getCurrentReadLevel().seq());
    }

    @Test
    void stopRunsOneFinalPass() {
        final AckManager m = manager();
        m.start();
        ack(m, m.getNextAckId(100L, 1L));

        m.stop();
        m.stop();

        assertEquals(1, store.requests().size());
        assertEquals(1L, store.last().ackLevelSeq());
        assertThrows(IllegalStateException.class, m::start);
    }

    @Test
    void scheduledTaskPersistsAdvancedAckLevel() throws InterruptedException {
        final AckManager m = manager(ExtentCheckpoint.initial(), Duration.ofMillis(20), Duration.ofSeconds(5));
        m.start();
        deliver(m, 100L, 1L, 3).forEach(id -> ack(m, id));

        final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while ((store.last() == null || store.last().ackLevelSeq() < 3L) && System.nanoTime() < deadline) {
            Thread.sleep(10L);
        }

        assertNotNull(store.last(), "scheduled task never persisted");
        assertEquals(3L, store.last().ackLevelSeq());
    }

    @Test
    void concurrentAcksForDisjointSequencesKeepLedgerConsistent() throws Exception {
        final AckManager m = manager();
        final int messages = 10_000;
        final int threads = 8;
        final List<String> ids = deliver(m, 1_000L, 1L, messages);

        final ExecutorService exec = Executors.newFixedThreadPool(threads + 1);
        final CountDownLatch start = new CountDownLatch(1);
        final AtomicBoolean acking = new AtomicBoolean(true);

        final Future<Boolean> monotonic = exec.submit(() -> {
            start.await();
            long last = 0L;
            while (acking.get()) {
                m.updateAckLevel();
                final AckManagerState s = m.getState();
                if (s.ackLevelSeq() < last || s.ackLevelSeq() > s.readLevelSeq()) return false;
                last = s.ackLevelSeq();
            }
            return true;
        });

        final List<Future<?>> ackers = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            final int lane = t;
            ackers.add(exec.submit(() -> {
                start.await();
                for (int i = lane; i < messages; i += threads) {
                    ack(m, ids.get(i));
                }
                return null;
            }));
        }

        start.countDown();
        for (final Future<?> f : ackers) {
            f.get(30, TimeUnit.SECONDS);
        }
        acking.set(false);
        assertTrue(monotonic.get(30, TimeUnit.SECONDS), "ack level went backwards or passed read level");
        exec.shutdown();

        m.updateAckLevel();
        final AckManagerState s = m.getState();
        assertEquals(messages, s.ackLevelSeq());
        assertEquals(messages, s.lastAckedSeq());
        assertEquals(0L, s.numAckedMsgs());
        assertEquals(0L, s.numUnackedMsgs());
        assertEquals(messages, acks.size());
    }
}
