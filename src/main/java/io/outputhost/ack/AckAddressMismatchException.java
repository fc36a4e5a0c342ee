package io.outputhost.ack;

/**
 * Thrown when an ack carries a store address different from the one recorded at delivery.
 * The ack is dropped and not forwarded to the message-state tracker.
 */
public final class AckAddressMismatchException extends RuntimeException {
    private final long seqNum;
    private final long address;
    private final long expectedAddress;

    public AckAddressMismatchException(final long seqNum, final long address, final long expectedAddress) {
        super("Address of the ack id doesn't match the ack manager: seq=" + seqNum
                + " address=" + address + " expected=" + expectedAddress);
        this.seqNum = seqNum;
        this.address = address;
        this.expectedAddress = expectedAddress;
    }

    public long seqNum() {
        return seqNum;
    }

    public long address() {
        return address;
    }

    public long expectedAddress() {
        return expectedAddress;
    }
}
