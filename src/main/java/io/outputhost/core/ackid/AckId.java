package io.outputhost.core.ackid;

import java.nio.ByteBuffer;
import java.util.Base64;

/**
 * Opaque acknowledgment identifier handed to consumers.
 * <p>
 * Wire layout (16 bytes, URL-safe base64, no padding):
 * [session:16 bits][ackMgr:16 bits][seq:32 bits][address:64 bits]
 * </p>
 * The session and manager ids make identifiers from different managers on
 * the same host distinct even when their local sequence numbers collide.
 */
public record AckId(int sessionId, int ackMgrId, long seqNum, long address) {
    private static final int SHORT_MASK = (1 << 16) - 1;
    private static final long SEQ_MASK = (1L << 32) - 1;
    /** Largest local sequence an ack id can carry. */
    public static final long MAX_SEQ_NUM = SEQ_MASK;
    private static final int ENCODED_BYTES = Long.BYTES * 2;

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    public AckId {
        if ((sessionId & SHORT_MASK) != sessionId) {
            throw new IllegalArgumentException("sessionId out of range (must fit 16 bits): " + sessionId);
        }
        if ((ackMgrId & SHORT_MASK) != ackMgrId) {
            throw new IllegalArgumentException("ackMgrId out of range (must fit 16 bits): " + ackMgrId);
        }
        if ((seqNum & SEQ_MASK) != seqNum) {
            throw new IllegalArgumentException("seqNum out of range (must fit 32 bits): " + seqNum);
        }
    }

    public static String construct(final int sessionId, final int ackMgrId, final long seqNum, final long address) {
        return new AckId(sessionId, ackMgrId, seqNum, address).encode();
    }

    public String encode() {
        final long head = ((long) sessionId << 48) | ((long) ackMgrId << 32) | seqNum;
        final ByteBuffer buf = ByteBuffer.allocate(ENCODED_BYTES);
        buf.putLong(head).putLong(address);
        return ENCODER.encodeToString(buf.array());
    }

    public static AckId decode(final String encoded) {
        if (encoded == null || encoded.isEmpty()) {
            throw new IllegalArgumentException("ack id must not be empty");
        }

        final byte[] raw;
        try {
            raw = DECODER.decode(encoded);
        } catch (final IllegalArgumentException e) {
            throw new IllegalArgumentException("ack id is not valid base64: " + encoded, e);
        }
        if (raw.length != ENCODED_BYTES) {
            throw new IllegalArgumentException("ack id must decode to " + ENCODED_BYTES + " bytes, got " + raw.length);
        }

        final ByteBuffer buf = ByteBuffer.wrap(raw);
        final long head = buf.getLong();
        final long address = buf.getLong();
        return new AckId(
                (int) ((head >>> 48) & SHORT_MASK),
                (int) ((head >>> 32) & SHORT_MASK),
                head & SEQ_MASK,
                address);
    }
}
