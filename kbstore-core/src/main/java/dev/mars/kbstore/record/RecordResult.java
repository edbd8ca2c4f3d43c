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
package dev.mars.kbstore.record;

/**
 * Outcome of recording a history entry.
 *
 * @param id      the generated record id
 * @param written whether the record file was written
 * @param message why it was not written, null on success
 */
public record RecordResult(String id, boolean written, String message) {

    static RecordResult written(String id) {
        return new RecordResult(id, true, null);
    }

    static RecordResult rejected(String id, String message) {
        return new RecordResult(id, false, message);
    }
}
