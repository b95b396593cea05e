package com.polytrade.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.polytrade.metrics.MetricSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.StampedLock;

/**
 * Append-only store of {@link MetricSnapshot} records, one JSON document per line.
 *
 * Each record is written with a single append followed by an fsync, and a record only
 * counts once its terminating newline is on disk. A trailing partial record left by a
 * crash is discarded on reload and truncated away when the store is opened, so the last
 * fully-written record wins.
 */
public final class SnapshotStore {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotStore.class);
    private static final byte NEWLINE = '\n';

    private final Path path;
    private final ObjectMapper mapper;
    private final StampedLock lock = new StampedLock();

    public SnapshotStore(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            truncatePartialRecord();
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to open snapshot store " + path, e);
        }
        logger.info("Snapshot store initialized: {}", path.toAbsolutePath());
    }

    /**
     * Append one snapshot durably.
     */
    public void append(MetricSnapshot snapshot) {
        byte[] line;
        try {
            line = (mapper.writeValueAsString(snapshot) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new SnapshotPersistenceException("Failed to serialize snapshot", e);
        }

        long stamp = lock.writeLock();
        try (FileChannel channel = FileChannel.open(path,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND)) {
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
            logger.debug("Snapshot persisted at {}", snapshot.timestamp());
        } catch (IOException e) {
            logger.error("Failed to persist snapshot to {}", path, e);
            throw new SnapshotPersistenceException("Snapshot write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * All complete records in write order. A trailing record without its newline,
     * or a line that does not parse, is skipped with a warning.
     */
    public List<MetricSnapshot> loadAll() {
        String content;
        long stamp = lock.readLock();
        try {
            if (!Files.exists(path)) {
                return List.of();
            }
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SnapshotPersistenceException("Failed to read snapshot store " + path, e);
        } finally {
            lock.unlockRead(stamp);
        }

        String[] lines = content.split("\n", -1);
        List<MetricSnapshot> snapshots = new ArrayList<>(lines.length);
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            boolean last = i == lines.length - 1;
            if (line.isBlank()) {
                continue;
            }
            if (last) {
                logger.warn("Discarding truncated trailing snapshot record ({} bytes)", line.length());
                continue;
            }
            try {
                snapshots.add(mapper.readValue(line, MetricSnapshot.class));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable snapshot record at line {}: {}", i + 1, e.getOriginalMessage());
            }
        }
        return snapshots;
    }

    public Optional<MetricSnapshot> latest() {
        List<MetricSnapshot> all = loadAll();
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    public Path getPath() {
        return path;
    }

    /**
     * Cut the file back to just after its last newline so new appends never
     * concatenate onto a half-written record.
     */
    private void truncatePartialRecord() throws IOException {
        if (!Files.exists(path)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE)) {
            long size = channel.size();
            if (size == 0) {
                return;
            }
            long keep = 0;
            ByteBuffer block = ByteBuffer.allocate(4096);
            long end = size;
            search:
            while (end > 0) {
                long start = Math.max(0, end - block.capacity());
                block.clear();
                block.limit((int) (end - start));
                while (block.hasRemaining()) {
                    if (channel.read(block, start + block.position()) < 0) {
                        break;
                    }
                }
                for (int i = block.position() - 1; i >= 0; i--) {
                    if (block.get(i) == NEWLINE) {
                        keep = start + i + 1;
                        break search;
                    }
                }
                end = start;
            }
            if (keep < size) {
                logger.warn("Truncating {} bytes of partial snapshot record from {}", size - keep, path);
                channel.truncate(keep);
                channel.force(true);
            }
        }
    }
}
