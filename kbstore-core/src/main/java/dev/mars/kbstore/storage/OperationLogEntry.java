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

import java.time.Instant;
import java.util.Optional;

/**
 * One line of the operation log.
 *
 * @param timestamp when the operation completed
 * @param operation what was done
 * @param filePath  the record file it was done to
 * @param data      optional payload, null when absent
 */
public record OperationLogEntry(Instant timestamp, OperationKind operation, String filePath, JsonNode data) {

    public Optional<JsonNode> payload() {
        return Optional.ofNullable(data);
    }
}
