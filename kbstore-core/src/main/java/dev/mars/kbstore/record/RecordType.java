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
 * Kinds of history record, with their id prefix, storage directory and schema.
 */
public enum RecordType {

    BUG("BUG", "history/bugs", RecordSchema.builder()
            .required("id", "title", "description", "severity")
            .property("id", FieldRule.string().matching("^BUG-\\d{14}-[a-f0-9]{4}$"))
            .property("title", FieldRule.string().minLength(1).maxLength(200))
            .property("description", FieldRule.string().minLength(1))
            .property("severity", FieldRule.string().oneOf("low", "medium", "high", "critical"))
            .property("status", FieldRule.string().oneOf("open", "in-progress", "resolved", "closed"))
            .property("tags", FieldRule.array())
            .property("timestamp", FieldRule.string())
            .property("file_path", FieldRule.string())
            .property("line_number", FieldRule.integer().minimum(1))
            .build()),

    REQUIREMENT("REQ", "history/requirements", RecordSchema.builder()
            .required("id", "title", "description", "priority")
            .property("id", FieldRule.string().matching("^REQ-\\d{14}-[a-f0-9]{4}$"))
            .property("title", FieldRule.string().minLength(1).maxLength(200))
            .property("description", FieldRule.string().minLength(1))
            .property("priority", FieldRule.string().oneOf("low", "medium", "high", "critical"))
            .property("status", FieldRule.string().oneOf("planned", "in-progress", "completed", "cancelled"))
            .property("tags", FieldRule.array())
            .property("timestamp", FieldRule.string())
            .build()),

    DECISION("DEC", "history/decisions", RecordSchema.builder()
            .required("id", "title", "context", "decision")
            .property("id", FieldRule.string().matching("^DEC-\\d{14}-[a-f0-9]{4}$"))
            .property("title", FieldRule.string().minLength(1).maxLength(200))
            .property("context", FieldRule.string().minLength(1))
            .property("decision", FieldRule.string().minLength(1))
            .property("rationale", FieldRule.string())
            .property("consequences", FieldRule.string())
            .property("alternatives", FieldRule.array())
            .property("status", FieldRule.string().oneOf("proposed", "accepted", "rejected", "deprecated"))
            .property("timestamp", FieldRule.string())
            .build());

    private final String idPrefix;
    private final String directory;
    private final RecordSchema schema;

    RecordType(String idPrefix, String directory, RecordSchema schema) {
        this.idPrefix = idPrefix;
        this.directory = directory;
        this.schema = schema;
    }

    /** Prefix of generated ids, e.g. {@code BUG}. */
    public String idPrefix() {
        return idPrefix;
    }

    /** Directory under the knowledge-base root holding one file per record. */
    public String directory() {
        return directory;
    }

    public RecordSchema schema() {
        return schema;
    }
}
