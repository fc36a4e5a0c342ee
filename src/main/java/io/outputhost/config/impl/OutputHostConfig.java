package io.outputhost.config.impl;

import lombok.Getter;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

/**
 * Immutable config holder loaded from outputhost.yaml
 */
@Getter
public final class OutputHostConfig {

    private String hostId;
    private int sessionId;
    private String metadataPath;
    private Duration ackLevelInterval;
    private Duration metadataTimeout;
    private int forwardQueueCapacity;
    private boolean traceAcks;

    public static OutputHostConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            final Map<String, Object> m = new Yaml().load(in);
            if (m == null) {
                throw new IllegalArgumentException("Empty output host config: " + path);
            }
            return fromMap(m);
        }
    }

    public static OutputHostConfig fromMap(final Map<String, Object> m) {
        final OutputHostConfig cfg = new OutputHostConfig();

        cfg.hostId       = (String) m.get("hostId");
        cfg.sessionId    = (Integer) m.getOrDefault("sessionId", -1);
        cfg.metadataPath = (String) m.get("metadataPath");

        cfg.ackLevelInterval = Duration.ofMillis(
                ((Number) m.getOrDefault("ackLevelIntervalMillis", 5_000)).longValue());
        cfg.metadataTimeout = Duration.ofMillis(
                ((Number) m.getOrDefault("metadataTimeoutMillis", 10_000)).longValue());
        cfg.forwardQueueCapacity = (Integer) m.getOrDefault("forwardQueueCapacity", 1024);
        cfg.traceAcks = (Boolean) m.getOrDefault("traceAcks", false);

        if (cfg.hostId == null || cfg.hostId.isBlank()) {
            throw new IllegalArgumentException("hostId is required");
        }
        if (cfg.metadataPath == null || cfg.metadataPath.isBlank()) {
            throw new IllegalArgumentException("metadataPath is required");
        }
        if (cfg.sessionId < 0 || cfg.sessionId > 0xFFFF) {
            throw new IllegalArgumentException("sessionId must fit 16 bits: " + cfg.sessionId);
        }
        if (cfg.ackLevelInterval.isZero() || cfg.ackLevelInterval.isNegative()) {
            throw new IllegalArgumentException("ackLevelIntervalMillis must be > 0");
        }
        if (cfg.forwardQueueCapacity <= 0) {
            throw new IllegalArgumentException("forwardQueueCapacity must be > 0");
        }
        return cfg;
    }
}
