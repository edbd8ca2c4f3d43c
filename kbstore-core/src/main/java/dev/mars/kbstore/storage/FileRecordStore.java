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
import com.fasterxml.jackson.databind.node.NullNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

/**
 * File-based implementation of {@link RecordStore}.
 * <p>
 * Each record is one UTF-8 JSON file, written pretty-printed with a two-space indent.
 * <p>
 * <b>Thread Safety:</b>
 * Instances hold no mutable state besides atomic counters and may be shared between
 * threads. Mutual exclusion per file comes from {@link FileLocks}, which covers both
 * threads of this JVM and other processes that use the same locking protocol.
 * <p>
 * <b>Durability:</b>
 * Writes truncate and rewrite the file in place, without fsync or rename. A crash
 * mid-write can leave a partial file; the next read then falls back to its default.
 * <p>
 * <b>Operation log:</b>
 * When enabled, every successful write or update appends a {@code create} or
 * {@code update} entry to the {@link OperationLog}, after the record's lock has
 * been released.
 *
 * @see RecordStore
 */
public final class FileRecordStore implements RecordStore {

    private static final Logger LOG = LoggerFactory.getLogger(FileRecordStore.class);

    private final KbStoreConfig config;
    private final FileLocks locks;
    private final ObjectMapper mapper;
    private final OperationLog operationLog;
    private final AtomicLong corruptFallbacks = new AtomicLong();

    /**
     * Creates a store with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @see KbStoreConfig
     */
    public FileRecordStore() {
        this(KbStoreConfig.load());
    }

    /**
     * Creates a store with the specified configuration.
     */
    public FileRecordStore(KbStoreConfig config) {
        this(config, new ObjectMapper());
    }

    /**
     * Creates a store with the specified configuration and JSON mapper.
     */
    public FileRecordStore(KbStoreConfig config, ObjectMapper mapper) {
        this.config = config;
        this.mapper = mapper;
        this.locks = new FileLocks(config.lockPollInterval());
        this.operationLog = config.operationLogEnabled()
                ? new OperationLog(config.operationLogFile(), locks, config.readTimeout(), mapper, Clock.systemUTC())
                : null;

        LOG.info("FileRecordStore initialized: baseDir={}, lockTimeout={}s, readTimeout={}s, operationLog={}",
                config.baseDir(), config.lockTimeout().toSeconds(), config.readTimeout().toSeconds(),
                operationLog != null ? operationLog.logFile() : "disabled");
    }

    /** The configuration used by this store. */
    public KbStoreConfig config() {
        return config;
    }

    /** The operation log, if enabled. */
    public Optional<OperationLog> operationLog() {
        return Optional.ofNullable(operationLog);
    }

    /**
     * Number of updates that found unparseable content and continued from the
     * default document instead.
     */
    public long corruptFallbacks() {
        return corruptFallbacks.get();
    }

    @Override
    public LockedFile withLock(Path path, LockMode mode, Duration timeout) {
        return locks.withLock(path, mode, timeout);
    }

    @Override
    public JsonNode safeRead(Path path, JsonNode defaultValue) {
        Path target = normalize(path);
        try (LockedFile file = locks.withLock(target, LockMode.READ, config.readTimeout())) {
            return parse(target, file.readString());
        } catch (RecordNotFoundException e) {
            LOG.debug("No record at {}, using default", target);
        } catch (LockTimeoutException e) {
            LOG.warn("Read of {} timed out waiting for lock, using default", target);
        } catch (MalformedContentException e) {
            LOG.warn("{}; using default", e.getMessage());
        } catch (IOException | KbStoreException e) {
            LOG.warn("Failed to read {}: {}; using default", target, e.getMessage());
        }
        return defaultValue;
    }

    @Override
    public boolean safeWrite(Path path, JsonNode document) {
        Path target = normalize(path);
        boolean created;
        try (LockedFile file = locks.withLock(target, LockMode.WRITE, config.readTimeout())) {
            created = file.created();
            file.overwrite(render(document));
        } catch (LockTimeoutException e) {
            LOG.error("Failed to write {}: {}", target, e.getMessage());
            return false;
        } catch (IOException | KbStoreException e) {
            LOG.error("Failed to write {}: {}", target, e.getMessage(), e);
            return false;
        }
        LOG.debug("Wrote {}", target);
        logOperation(created ? OperationKind.CREATE : OperationKind.UPDATE, target);
        return true;
    }

    @Override
    public boolean safeUpdate(Path path, UnaryOperator<JsonNode> updateFn, JsonNode defaultValue) {
        return safeUpdate(path, updateFn, defaultValue, config.lockTimeout());
    }

    @Override
    public boolean safeUpdate(Path path, UnaryOperator<JsonNode> updateFn, JsonNode defaultValue, Duration timeout) {
        Path target = normalize(path);
        JsonNode base = defaultValue != null ? defaultValue : mapper.createObjectNode();
        boolean created;

        // The file is materialized under the lock so that a concurrent updater can
        // never have its result replaced by the default
        try (LockedFile file = locks.withLock(target, LockMode.READ_WRITE, timeout)) {
            created = file.created();
            String content = file.readString();
            JsonNode current;
            if (created) {
                file.overwrite(render(base));
                current = base.deepCopy();
            } else {
                try {
                    current = parse(target, content);
                } catch (MalformedContentException e) {
                    corruptFallbacks.incrementAndGet();
                    LOG.warn("{}; existing content discarded, updating from default", e.getMessage());
                    current = base.deepCopy();
                }
            }

            JsonNode updated = updateFn.apply(current);
            file.overwrite(render(updated != null ? updated : NullNode.getInstance()));
        } catch (LockTimeoutException e) {
            LOG.error("Failed to update {}: {}", target, e.getMessage());
            return false;
        } catch (IOException | KbStoreException e) {
            LOG.error("Failed to update {}: {}", target, e.getMessage(), e);
            return false;
        } catch (RuntimeException e) {
            LOG.error("Update function failed for {}: {}", target, e.getMessage(), e);
            return false;
        }

        LOG.debug("Updated {}", target);
        logOperation(created ? OperationKind.CREATE : OperationKind.UPDATE, target);
        return true;
    }

    private JsonNode parse(Path target, String content) {
        try {
            JsonNode node = mapper.readTree(content);
            if (node == null || node.isMissingNode()) {
                throw new MalformedContentException(target, "empty document");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new MalformedContentException(target, e);
        }
    }

    private String render(JsonNode document) throws JsonProcessingException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document);
    }

    private void logOperation(OperationKind kind, Path target) {
        if (operationLog != null) {
            operationLog.record(kind, target.toString(), null);
        }
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
