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

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.time.Duration;
import java.util.function.UnaryOperator;

/**
 * Lock-protected access to JSON record files.
 * <p>
 * Collaborators that record bugs, requirements, decisions or checksums depend
 * on this interface rather than on a concrete implementation.
 * <p>
 * <b>Failure policy:</b> the read and write operations fail open. Reads return the
 * caller's default on a missing file, a lock timeout or malformed JSON; writes
 * report failure as {@code false}. Every swallowed failure is logged. Only
 * {@link #withLock} throws.
 * <p>
 * <b>Concurrency:</b> every operation holds one exclusive per-path lock for its whole
 * scope, so concurrent {@link #safeUpdate} calls on the same file, from threads or
 * processes, never lose an update.
 *
 * @see FileRecordStore
 */
public interface RecordStore {

    /**
     * Opens a file under an exclusive lock. Close the handle to release it.
     *
     * @throws RecordNotFoundException if {@code mode} is {@link LockMode#READ} and the file is missing
     * @throws LockTimeoutException    if the lock is not acquired within {@code timeout}
     */
    LockedFile withLock(Path path, LockMode mode, Duration timeout);

    /**
     * Reads and parses a record file.
     *
     * @param path         the record file
     * A write-protected file is still read.
     *
     * @param defaultValue returned on missing file, lock timeout or malformed JSON
     * @return the parsed document, or {@code defaultValue}
     */
    JsonNode safeRead(Path path, JsonNode defaultValue);

    /**
     * Replaces a record file's content.
     *
     * @return true if written, false on lock timeout or I/O failure
     */
    boolean safeWrite(Path path, JsonNode document);

    /**
     * Atomic read-modify-write of a record file.
     * <p>
     * A missing file is materialized with {@code defaultValue} first. Then, under one
     * lock acquisition, the current content is parsed, passed to {@code updateFn}, and
     * the result replaces the file. Unparseable content is replaced by
     * {@code defaultValue} as the base for {@code updateFn}, with a warning.
     *
     * @param path         the record file
     * @param updateFn     receives the current document (which it may mutate) and returns the new one
     * @param defaultValue base document when the file is missing or corrupt; null means an empty object
     * @param timeout      lock timeout
     * @return true if the new document was written
     */
    boolean safeUpdate(Path path, UnaryOperator<JsonNode> updateFn, JsonNode defaultValue, Duration timeout);

    /**
     * {@link #safeUpdate(Path, UnaryOperator, JsonNode, Duration)} with the store's
     * default update timeout.
     */
    boolean safeUpdate(Path path, UnaryOperator<JsonNode> updateFn, JsonNode defaultValue);
}
