package io.outputhost.metadata;

public enum ConsumerGroupExtentStatus {
    OPEN,
    CONSUMED
}
