package com.uptimesentinel.service.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uptimesentinel.core.model.Check;
import com.uptimesentinel.core.util.JsonUtils;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Append-only check history, one JSON document per line. The latest check and a bounded tail of
 * recent checks per monitor are kept in memory and rebuilt from the file when the log is opened,
 * so history reads never touch the file or wait on appends.
 *
 * <p>Lines that cannot be decoded on open (typically a line torn by a crash mid-append) are
 * logged and skipped.
 */
public class JsonlCheckLog implements CheckLog {
    public static final int DEFAULT_TAIL_SIZE = 1_000;

    private static final Logger LOGGER = Logger.getLogger(JsonlCheckLog.class.getName());
    private static final ObjectMapper MAPPER = JsonUtils.objectMapper();

    private final Path file;
    private final int tailSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Long, Check> latest = new ConcurrentHashMap<>();
    private final Map<Long, Deque<Check>> tails = new ConcurrentHashMap<>();
    private boolean needsLineBreak;

    public JsonlCheckLog(Path file) {
        this(file, DEFAULT_TAIL_SIZE);
    }

    JsonlCheckLog(Path file, int tailSize) {
        if (tailSize <= 0) {
            throw new IllegalArgumentException("tailSize must be positive");
        }
        this.file = file;
        this.tailSize = tailSize;
        load();
    }

    @Override
    public void append(Check check) {
        String line = JsonUtils.toJson(check);
        lock.lock();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(
                    file,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
            )) {
                if (needsLineBreak) {
                    writer.newLine();
                }
                writer.write(line);
                writer.newLine();
            }
            needsLineBreak = false;
            remember(check);
        } catch (IOException e) {
            throw new IllegalStateException("Failed appending check for monitor " + check.monitorId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Check> latest(long monitorId) {
        return Optional.ofNullable(latest.get(monitorId));
    }

    /**
     * Served from memory; at most the last {@link #DEFAULT_TAIL_SIZE} checks per monitor are
     * available.
     */
    @Override
    public List<Check> recent(long monitorId, int limit) {
        Deque<Check> tail = tails.get(monitorId);
        if (limit <= 0 || tail == null) {
            return List.of();
        }
        List<Check> snapshot;
        synchronized (tail) {
            snapshot = new ArrayList<>(tail);
        }
        if (snapshot.size() <= limit) {
            return snapshot;
        }
        return List.copyOf(snapshot.subList(snapshot.size() - limit, snapshot.size()));
    }

    private void remember(Check check) {
        latest.merge(check.monitorId(), check,
                (current, candidate) -> candidate.checkedAt().isBefore(current.checkedAt()) ? current : candidate);
        Deque<Check> tail = tails.computeIfAbsent(check.monitorId(), ignored -> new ArrayDeque<>());
        synchronized (tail) {
            tail.addLast(check);
            while (tail.size() > tailSize) {
                tail.removeFirst();
            }
        }
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            needsLineBreak = !endsWithLineBreak(file);
        } catch (IOException e) {
            throw new IllegalStateException("Failed reading check log " + file, e);
        }
        int loaded = 0;
        int skipped = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                remember(MAPPER.readValue(line, Check.class));
                loaded++;
            } catch (IOException | RuntimeException decodeError) {
                skipped++;
                boolean lastLine = i == lines.size() - 1;
                LOGGER.warning("Skipping " + (lastLine ? "truncated" : "invalid") + " check record at " + file
                        + " line " + (i + 1) + ": " + decodeError.getMessage());
            }
        }
        if (loaded > 0 || skipped > 0) {
            LOGGER.info("Loaded " + loaded + " checks for " + latest.size() + " monitors from " + file
                    + (skipped > 0 ? " (" + skipped + " skipped)" : ""));
        }
    }

    private static boolean endsWithLineBreak(Path path) throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(path.toFile(), "r")) {
            long length = raf.length();
            if (length == 0) {
                return true;
            }
            raf.seek(length - 1);
            return raf.read() == '\n';
        }
    }
}
