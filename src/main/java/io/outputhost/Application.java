package io.outputhost;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.outputhost.ack.AckManagerRegistry;
import io.outputhost.config.impl.OutputHostConfig;
import io.outputhost.config.type.ConfigLoader;
import io.outputhost.core.ackid.TimestampedAckId;
import io.outputhost.metadata.JournaledExtentMetadataStore;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;

/**
 * Main class to start the output host ack tracking service.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 1) {
            System.err.println("Usage: java -jar outputhost.jar <outputhost-config.yaml>");
            System.exit(1);
        }

        final OutputHostConfig cfg = ConfigLoader.load(args[0]);

        final Path metadataDir = Paths.get(cfg.getMetadataPath()).toAbsolutePath();
        final JournaledExtentMetadataStore store = new JournaledExtentMetadataStore(metadataDir);
        final SimpleMeterRegistry meters = new SimpleMeterRegistry();

        /* Acks and nacks are handed to the message cache through these queues */
        final BlockingQueue<TimestampedAckId> acks = new ArrayBlockingQueue<>(cfg.getForwardQueueCapacity());
        final BlockingQueue<TimestampedAckId> nacks = new ArrayBlockingQueue<>(cfg.getForwardQueueCapacity());

        final AckManagerRegistry registry = new AckManagerRegistry(cfg, store, meters, acks, nacks);

        final CountDownLatch terminated = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down output host {}...", cfg.getHostId());
                registry.close();
                meters.close();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            } finally {
                terminated.countDown();
            }
        }));

        log.info("Output host {} started (session {}), metadata at {}", cfg.getHostId(), cfg.getSessionId(), metadataDir);

        /* Ack manager threads are daemons; keep the JVM up until shutdown */
        terminated.await();
    }
}
