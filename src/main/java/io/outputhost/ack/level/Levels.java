package io.outputhost.ack.level;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Instant;

/**
 * Snapshot of the read and ack watermarks of one consumer-group extent.
 * <p>
 * {@code readLevel} and {@code ackLevel} are local sequence numbers. The matching
 * {@code *Seq} fields carry the upstream sequence of the message at that level and the
 * {@code *Address} fields its store address; -1 means nothing has been read or acked.
 * </p>
 */
@Getter
@Setter
@ToString
public final class Levels {
    private Instant asOf;
    private long readLevel;
    private long ackLevel;
    private long readLevelSeq;
    private long ackLevelSeq;
    private long readLevelAddress;
    private long ackLevelAddress;
    private double ackRate;
    private double readRate;

    /**
     * Seeds a snapshot from a persisted ack level. Local sequence numbers restart at the
     * upstream ack level, so read and ack levels (and their upstream sequences) coincide.
     */
    public Levels(final Instant asOf,
                  final long ackLevel,
                  final long ackLevelAddress,
                  final long readLevelAddress) {
        this.asOf = asOf;
        this.readLevel = ackLevel;
        this.ackLevel = ackLevel;
        this.ackLevelSeq = ackLevel;
        this.readLevelSeq = ackLevel;
        this.ackLevelAddress = ackLevelAddress;
        this.readLevelAddress = readLevelAddress;
    }

    private Levels(final Levels other) {
        this.asOf = other.asOf;
        this.readLevel = other.readLevel;
        this.ackLevel = other.ackLevel;
        this.readLevelSeq = other.readLevelSeq;
        this.ackLevelSeq = other.ackLevelSeq;
        this.readLevelAddress = other.readLevelAddress;
        this.ackLevelAddress = other.ackLevelAddress;
        this.ackRate = other.ackRate;
        this.readRate = other.readRate;
    }

    public Levels copy() {
        return new Levels(this);
    }
}
