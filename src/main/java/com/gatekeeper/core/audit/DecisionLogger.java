package com.gatekeeper.core.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gatekeeper.core.model.GateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail, one file per {@link GateType}.
 * <p>
 * Appends are serialised twice: the instance monitor orders writers inside this
 * JVM, and an exclusive {@link FileLock} orders hook processes that share the same
 * directory. Each record is written with a single {@code write} call in append mode.
 * <p>
 * Write failures are logged and otherwise ignored: losing an audit line must never
 * change the decision already made. Files are never rotated here.
 */
public class DecisionLogger implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(DecisionLogger.class);

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<GateType, FileChannel> channels = new EnumMap<>(GateType.class);

    public DecisionLogger(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public Path directory() {
        return directory;
    }

    public Path fileFor(GateType gate) {
        return directory.resolve(gate.logFileName());
    }

    /**
     * Appends one entry. Never throws.
     *
     * @return {@code true} if the line was written
     */
    public synchronized boolean append(GateType gate, DecisionLogEntry entry) {
        byte[] line;
        try {
            line = (objectMapper.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialise decision log entry for {}", gate.logName(), e);
            return false;
        }
        try {
            FileChannel channel = channel(gate);
            try (FileLock ignored = channel.lock()) {
                ByteBuffer buffer = ByteBuffer.wrap(line);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
            }
            return true;
        } catch (IOException | OverlappingFileLockException e) {
            log.error("Failed to append to decision log {}", fileFor(gate), e);
            closeQuietly(gate);
            return false;
        }
    }

    /** Forces appended entries to the storage device. */
    public synchronized void flush() {
        for (var e : channels.entrySet()) {
            try {
                e.getValue().force(false);
            } catch (IOException ex) {
                log.error("Failed to flush decision log {}", fileFor(e.getKey()), ex);
            }
        }
    }

    /**
     * Reads the most recent entries of one gate's log, oldest first.
     * Lines that do not parse are skipped.
     */
    public List<DecisionLogEntry> readRecent(GateType gate, int limit) throws IOException {
        Path file = fileFor(gate);
        if (!Files.exists(file) || limit <= 0) {
            return List.of();
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        var entries = new ArrayList<DecisionLogEntry>();
        for (int i = Math.max(0, lines.size() - limit); i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                entries.add(objectMapper.readValue(line, DecisionLogEntry.class));
            } catch (JsonProcessingException e) {
                log.warn("Skipping unreadable line {} of {}: {}", i + 1, file, e.getOriginalMessage());
            }
        }
        return entries;
    }

    @Override
    public synchronized void close() {
        flush();
        for (GateType gate : new ArrayList<>(channels.keySet())) {
            closeQuietly(gate);
        }
    }

    private FileChannel channel(GateType gate) throws IOException {
        FileChannel channel = channels.get(gate);
        if (channel == null || !channel.isOpen()) {
            Files.createDirectories(directory);
            channel = FileChannel.open(fileFor(gate),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
            channels.put(gate, channel);
            log.debug("Opened decision log {}", fileFor(gate));
        }
        return channel;
    }

    private void closeQuietly(GateType gate) {
        FileChannel channel = channels.remove(gate);
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.warn("Failed to close decision log {}: {}", fileFor(gate), e.getMessage());
        }
    }
}
