package io.outputhost.config.type;

import io.outputhost.config.impl.OutputHostConfig;

import java.io.IOException;

public final class ConfigLoader {

    private ConfigLoader() {
    }

    /**
     * Loads output host configuration from a YAML file by delegating to {@link OutputHostConfig#load(String)}.
     * <p>
     * Expected structure:
     * <pre>
     * hostId: outputhost-1
     * sessionId: 7
     * metadataPath: /var/lib/outputhost/metadata
     * ackLevelIntervalMillis: 5000   # optional
     * metadataTimeoutMillis: 10000   # optional
     * forwardQueueCapacity: 1024     # optional
     * traceAcks: false               # optional
     * </pre>
     *
     * @param path the path to the YAML configuration file
     * @return a populated {@link OutputHostConfig} instance
     * @throws IOException if the file cannot be read
     */
    public static OutputHostConfig load(final String path) throws IOException {
        return OutputHostConfig.load(path);
    }
}
