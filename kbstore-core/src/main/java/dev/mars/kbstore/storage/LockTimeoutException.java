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

import java.nio.file.Path;
import java.time.Duration;

/**
 * Thrown when the exclusive lock on a record file could not be acquired
 * before the configured timeout elapsed.
 */
public class LockTimeoutException extends KbStoreException {

    private final Path path;
    private final Duration timeout;

    public LockTimeoutException(Path path, Duration timeout) {
        super("Cannot acquire file lock: " + path + " (timed out after " + timeout.toMillis() +
                " ms). Another process may be accessing this file.");
        this.path = path;
        this.timeout = timeout;
    }

    public Path path() {
        return path;
    }

    public Duration timeout() {
        return timeout;
    }
}
