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
 * Thrown when a record file does not contain parseable JSON.
 * <p>
 * The fail-open operations of {@link RecordStore} absorb this into the
 * caller-supplied default instead of propagating it.
 */
public class MalformedContentException extends KbStoreException {

    private final Path path;

    public MalformedContentException(Path path, Throwable cause) {
        super("Malformed JSON in " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public MalformedContentException(Path path, String reason) {
        super("Malformed JSON in " + path + ": " + reason);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
