package io.outputhost.metadata;

import lombok.extern.slf4j.Slf4j;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.regex.Pattern;

/**
 * Durable extent metadata store keeping one small file per consumer-group extent.
 * Each write goes to a temp file that is atomically moved over the previous one.
 * Once an extent is recorded as consumed it is never moved back to open.
 */
@Slf4j
public final class JournaledExtentMetadataStore implements ExtentMetadataStore {
    private static final String FILE_PREFIX = "cgext-";
    private static final String FILE_SUFFIX = ".meta";
    private static final int FORMAT_VERSION = 1;
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    // Must not match SAFE_ID so that no two id pairs share a file.
    private static final String KEY_SEPARATOR = "+";

    private final Path dir;
    private final Map<String, ExtentState> byExtent = new ConcurrentHashMap<>();

    public JournaledExtentMetadataStore(final Path dir) throws IOException {
        this.dir = dir;
        Files.createDirectories(dir);
    }

    @Override
    public void setAckOffset(final SetAckOffsetRequest request) throws IOException {
        final String key = keyFor(request.consumerGroupId(), request.extentId());
        final ExtentState st = loadOrCreate(key);
        st.lock.writeLock().lock();
        try {
            if (st.last != null && st.last.status() == ConsumerGroupExtentStatus.CONSUMED
                    && request.status() != ConsumerGroupExtentStatus.CONSUMED) {
                log.warn("Ignoring {} update for consumed extent {} of consumer group {}",
                        request.status(), request.extentId(), request.consumerGroupId());
                return;
            }
            persist(key, request);
            st.last = request;
        } finally {
            st.lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<ExtentCheckpoint> checkpoint(final String consumerGroupId, final String extentId) {
        final ExtentState st = loadOrCreate(keyFor(consumerGroupId, extentId));
        st.lock.readLock().lock();
        try {
            return Optional.ofNullable(st.last).map(SetAckOffsetRequest::toCheckpoint);
        } finally {
            st.lock.readLock().unlock();
        }
    }

    /**
     * Last request recorded for the extent, including host, store and rates.
     */
    public Optional<SetAckOffsetRequest> lastRequest(final String consumerGroupId, final String extentId) {
        final ExtentState st = loadOrCreate(keyFor(consumerGroupId, extentId));
        st.lock.readLock().lock();
        try {
            return Optional.ofNullable(st.last);
        } finally {
            st.lock.readLock().unlock();
        }
    }

    private ExtentState loadOrCreate(final String key) {
        return byExtent.computeIfAbsent(key, k -> {
            final ExtentState es = new ExtentState();
            try {
                es.last = readFromDisk(k);
            } catch (final IOException ioe) {
                log.warn("Failed to load extent metadata {}: {}", k, ioe.toString());
            }
            return es;
        });
    }

    private static String keyFor(final String consumerGroupId, final String extentId) {
        if (consumerGroupId == null || !SAFE_ID.matcher(consumerGroupId).matches()) {
            throw new IllegalArgumentException("Illegal consumer group id: " + consumerGroupId);
        }
        if (extentId == null || !SAFE_ID.matcher(extentId).matches()) {
            throw new IllegalArgumentException("Illegal extent id: " + extentId);
        }
        return consumerGroupId + KEY_SEPARATOR + extentId;
    }

    private Path fileFor(final String key) {
        return dir.resolve(FILE_PREFIX + key + FILE_SUFFIX);
    }

    private SetAckOffsetRequest readFromDisk(final String key) throws IOException {
        final Path f = fileFor(key);
        if (!Files.exists(f)) return null;

        try (final DataInputStream in = new DataInputStream(Files.newInputStream(f))) {
            final int version = in.readInt();
            if (version != FORMAT_VERSION) {
                throw new IOException("Unsupported extent metadata format " + version + " in " + f);
            }
            final String outputHostId = in.readUTF();
            final String consumerGroupId = in.readUTF();
            final String extentId = in.readUTF();
            final String connectedStoreId = in.readUTF();
            final long ackLevelAddress = in.readLong();
            final long ackLevelSeq = in.readLong();
            final long readLevelAddress = in.readLong();
            final long readLevelSeq = in.readLong();
            final ConsumerGroupExtentStatus status = ConsumerGroupExtentStatus.values()[in.readByte()];
            final double ackRate = in.readDouble();
            final double readRate = in.readDouble();
            return new SetAckOffsetRequest(outputHostId, consumerGroupId, extentId, connectedStoreId,
                    ackLevelAddress, ackLevelSeq, readLevelAddress, readLevelSeq, status, ackRate, readRate);
        }
    }

    private void persist(final String key, final SetAckOffsetRequest req) throws IOException {
        final Path target = fileFor(key);
        final Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");
        try (final DataOutputStream out = new DataOutputStream(Files.newOutputStream(tmp))) {
            out.writeInt(FORMAT_VERSION);
            out.writeUTF(nullToEmpty(req.outputHostId()));
            out.writeUTF(req.consumerGroupId());
            out.writeUTF(req.extentId());
            out.writeUTF(nullToEmpty(req.connectedStoreId()));
            out.writeLong(req.ackLevelAddress());
            out.writeLong(req.ackLevelSeq());
            out.writeLong(req.readLevelAddress());
            out.writeLong(req.readLevelSeq());
            out.writeByte(req.status().ordinal());
            out.writeDouble(req.ackLevelSeqRate());
            out.writeDouble(req.readLevelSeqRate());
            out.flush();
        }
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }

    private static String nullToEmpty(final String s) {
        return s == null ? "" : s;
    }

    private static final class ExtentState {
        final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        SetAckOffsetRequest last;
    }
}
