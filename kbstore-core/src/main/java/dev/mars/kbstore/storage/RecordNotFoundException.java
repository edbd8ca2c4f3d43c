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

/**
 * Thrown when a strict read-only access targets a file that does not exist.
 */
public class RecordNotFoundException extends KbStoreException {

    private final Path path;

    public RecordNotFoundException(Path path) {
        super("File does not exist: " + path);
        this.path = path;
    }

    public RecordNotFoundException(Path path, Throwable cause) {
        super("File does not exist: " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
