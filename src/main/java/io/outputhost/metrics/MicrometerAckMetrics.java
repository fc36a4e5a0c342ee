package io.outputhost.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link AckMetrics} on a Micrometer registry, tagged with the consumer group and extent.
 * One-off occurrences are counters; per-cycle values are gauges holding the last report.
 * <p>
 * Gauges follow the most recently created instance for a consumer group and extent, so a
 * reopened manager replaces the gauges of the one it succeeds. {@link #close()} unregisters
 * the gauges this instance still owns.
 * </p>
 */
public final class MicrometerAckMetrics implements AckMetrics {
    public static final String SKIPPED_MESSAGES = "outputhost.cg.skipped.messages";
    public static final String RESET_MSG = "outputhost.cg.ackmgr.reset.msg";
    public static final String RESET_MSG_ERROR = "outputhost.cg.ackmgr.reset.msg.error";
    public static final String SEQ_NOT_FOUND = "outputhost.cg.ackmgr.seq.not.found";
    public static final String LEVEL_UPDATE = "outputhost.cg.ackmgr.level.update";
    public static final String LEDGER_SIZE = "outputhost.cg.ackmgr.size";
    public static final String CONSUMED = "outputhost.cg.ackmgr.consumed";

    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong levelUpdate = new AtomicLong();
    private final AtomicLong ledgerSize = new AtomicLong();

    private final MeterRegistry registry;
    private final List<Gauge> gauges = new ArrayList<>(3);

    private final Counter resetMsg;
    private final Counter resetMsgError;
    private final Counter seqNotFound;
    private final Counter consumed;

    public MicrometerAckMetrics(final MeterRegistry registry,
                                final String consumerGroupId,
                                final String extentId) {
        this.registry = registry;
        final Tags tags = Tags.of("consumerGroup", consumerGroupId, "extent", extentId);

        gauges.add(replaceGauge(SKIPPED_MESSAGES, tags, skipped));
        gauges.add(replaceGauge(LEVEL_UPDATE, tags, levelUpdate));
        gauges.add(replaceGauge(LEDGER_SIZE, tags, ledgerSize));

        this.resetMsg = registry.counter(RESET_MSG, tags);
        this.resetMsgError = registry.counter(RESET_MSG_ERROR, tags);
        this.seqNotFound = registry.counter(SEQ_NOT_FOUND, tags);
        this.consumed = registry.counter(CONSUMED, tags);
    }

    @Override
    public void skippedMessages(final long count) {
        skipped.set(count);
    }

    @Override
    public void resetMsg() {
        resetMsg.increment();
    }

    @Override
    public void resetMsgError() {
        resetMsgError.increment();
    }

    @Override
    public void seqNotFound() {
        seqNotFound.increment();
    }

    @Override
    public void levelUpdate(final long count) {
        levelUpdate.set(count);
    }

    @Override
    public void ledgerSize(final long size) {
        ledgerSize.set(size);
    }

    @Override
    public void consumed() {
        consumed.increment();
    }

    @Override
    public void close() {
        for (final Gauge g : gauges) {
            final Gauge current = registry.find(g.getId().getName()).tags(g.getId().getTags()).gauge();
            if (current == g) {
                registry.remove(g);
            }
        }
        gauges.clear();
    }

    // A registry hands back the existing gauge for a known id, which would stay bound to the old holder.
    private Gauge replaceGauge(final String name, final Tags tags, final AtomicLong holder) {
        final Gauge existing = registry.find(name).tags(tags).gauge();
        if (existing != null) {
            registry.remove(existing);
        }
        return Gauge.builder(name, holder, AtomicLong::get).tags(tags).register(registry);
    }
}
