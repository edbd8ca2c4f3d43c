/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.kbstore.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Best-effort, append-only diagnostic trail of record mutations.
 * <p>
 * <b>Format:</b> one JSON object per line:
 * <pre>
 * {"timestamp":1767225600.123,"operation":"update","file_path":"/kb/history/bugs/_index.json"}
 * </pre>
 * {@code timestamp} is epoch seconds with a fractional part; {@code data} is
 * omitted when there is no payload.
 * <p>
 * <b>Failure policy:</b> {@link #record} never throws. A log that cannot be written
 * must not block the operation being logged, so failures are logged and dropped.
 * <p>
 * <b>Ordering:</b> the log file has its own lock, independent of the record file's
 * lock, so under contention log order need not match the order in which the
 * mutations hit their files. There is no replay.
 */
public final class OperationLog {

    private static final Logger LOG = LoggerFactory.getLogger(OperationLog.class);

    /** Default number of entries returned by {@link #recent()} */
    public static final int DEFAULT_RECENT_COUNT = 10;

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);

    private final Path logFile;
    private final FileLocks locks;
    private final Duration timeout;
    private final ObjectMapper mapper;
    private final Clock clock;

    /**
     * Creates a log at {@code logFile} with default lock settings.
     */
    public OperationLog(Path logFile) {
        this(logFile, new FileLocks(), DEFAULT_TIMEOUT, new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param logFile the log file; its parent directory is created if missing
     * @param locks   lock acquirer for the log file
     * @param timeout lock timeout for appends and reads
     * @param mapper  JSON mapper
     * @param clock   source of entry timestamps
     */
    public OperationLog(Path logFile, FileLocks locks, Duration timeout, ObjectMapper mapper, Clock clock) {
        this.logFile = logFile.toAbsolutePath().normalize();
        this.locks = locks;
        this.timeout = timeout;
        this.mapper = mapper;
        this.clock = clock;
        try {
            Path parent = this.logFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            LOG.warn("Could not create operation log directory for {}: {}", this.logFile, e.getMessage());
        }
    }

    /** The log file. */
    public Path logFile() {
        return logFile;
    }

    /**
     * Appends one entry. Never throws; failures are logged.
     *
     * @param operation what was done
     * @param filePath  the record file it was done to
     * @param data      optional payload, may be null
     */
    public void record(OperationKind operation, String filePath, JsonNode data) {
        ObjectNode entry = mapper.createObjectNode();
        entry.put("timestamp", toEpochSeconds(clock.instant()));
        entry.put("operation", operation.wireName());
        entry.put("file_path", filePath);
        if (data != null) {
            entry.set("data", data);
        }

        try (LockedFile file = locks.withLock(logFile, LockMode.APPEND, timeout)) {
            file.append(mapper.writeValueAsString(entry) + "\n");
            LOG.trace("Logged {} {}", operation.wireName(), filePath);
        } catch (LockTimeoutException e) {
            LOG.warn("Operation log busy, dropped {} entry for {}: {}", operation.wireName(), filePath, e.getMessage());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Failed to write operation log entry for {}: {}", filePath, e.getMessage());
        }
    }

    /**
     * Returns the last {@value #DEFAULT_RECENT_COUNT} entries.
     */
    public List<OperationLogEntry> recent() {
        return recent(DEFAULT_RECENT_COUNT);
    }

    /**
     * Returns up to {@code count} most recent entries, oldest first.
     * <p>
     * Returns an empty list when the log does not exist or is locked past the
     * timeout. Lines that cannot be parsed are skipped.
     */
    public List<OperationLogEntry> recent(int count) {
        if (count <= 0 || !Files.exists(logFile)) {
            return Collections.emptyList();
        }

        String content;
        try (LockedFile file = locks.withLock(logFile, LockMode.READ, timeout)) {
            content = file.readString();
        } catch (RecordNotFoundException e) {
            return Collections.emptyList();
        } catch (IOException | KbStoreException e) {
            LOG.warn("Could not read operation log {}: {}", logFile, e.getMessage());
            return Collections.emptyList();
        }

        List<String> lines = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (!line.isBlank()) {
                lines.add(line);
            }
        }

        List<OperationLogEntry> entries = new ArrayList<>();
        for (String line : lines.subList(Math.max(0, lines.size() - count), lines.size())) {
            try {
                entries.add(parse(line));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                LOG.warn("Skipping malformed operation log line in {}: {}", logFile, e.getMessage());
            }
        }
        return entries;
    }

    private OperationLogEntry parse(String line) throws JsonProcessingException {
        JsonNode node = mapper.readTree(line);
        for (String field : new String[] {"timestamp", "operation", "file_path"}) {
            if (!node.hasNonNull(field)) {
                throw new IllegalArgumentException("missing field '" + field + "'");
            }
        }
        JsonNode data = node.get("data");
        return new OperationLogEntry(
                fromEpochSeconds(node.get("timestamp").asDouble()),
                OperationKind.fromWireName(node.get("operation").asText()),
                node.get("file_path").asText(),
                data == null || data.isNull() ? null : data);
    }

    static double toEpochSeconds(Instant instant) {
        return instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
    }

    /**
     * Inverse of {@link #toEpochSeconds}, exact to the microsecond. A double near the
     * current epoch carries about seven fractional digits, so finer digits are noise.
     */
    static Instant fromEpochSeconds(double seconds) {
        long whole = (long) Math.floor(seconds);
        long micros = Math.round((seconds - whole) * 1_000_000L);
        return Instant.ofEpochSecond(whole, micros * 1_000L);
    }
}
