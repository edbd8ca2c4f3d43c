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

import java.nio.file.OpenOption;
import java.nio.file.StandardOpenOption;
import java.util.Set;

/**
 * Access intent for a {@link LockedFile}.
 * <p>
 * The lock taken is exclusive in every mode; there is no shared reader lock.
 * The channel is opened for writing because an exclusive
 * {@link java.nio.channels.FileLock} requires a writable channel. The one exception
 * is {@link #READ} on a write-protected file: it gets a read-only channel and a
 * shared OS lock, which still excludes writers since none can open the file.
 */
public enum LockMode {

    /** File must already exist. */
    READ(false, false),

    /** File is created if missing and truncated once the lock is held. */
    WRITE(true, true),

    /** File is created if missing; content is preserved. */
    READ_WRITE(true, false),

    /** File is created if missing; writes go to the end. */
    APPEND(true, false);

    private final boolean createIfMissing;
    private final boolean truncateOnAcquire;

    LockMode(boolean createIfMissing, boolean truncateOnAcquire) {
        this.createIfMissing = createIfMissing;
        this.truncateOnAcquire = truncateOnAcquire;
    }

    /** Whether opening a missing file fails with {@link RecordNotFoundException}. */
    public boolean requiresExisting() {
        return !createIfMissing;
    }

    /** Whether existing content is discarded after the lock is acquired. */
    public boolean truncateOnAcquire() {
        return truncateOnAcquire;
    }

    /** Options that create the file and fail if it already exists. */
    Set<OpenOption> createNewOptions() {
        return Set.of(StandardOpenOption.CREATE_NEW, StandardOpenOption.READ, StandardOpenOption.WRITE);
    }

    Set<OpenOption> openOptions() {
        return createIfMissing
                ? Set.of(StandardOpenOption.CREATE, StandardOpenOption.READ, StandardOpenOption.WRITE)
                : Set.of(StandardOpenOption.READ, StandardOpenOption.WRITE);
    }
}
