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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.kbstore.storage.RecordNotFoundException;
import dev.mars.kbstore.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Records bugs, requirements and decisions, and maintains the indexed documents,
 * all through {@link RecordStore} so concurrent updaters never lose each other's writes.
 * <p>
 * Layout under the knowledge-base root:
 * <pre>
 * history/bugs/BUG-20260101120000-a1b2.json
 * history/bugs/_index.json             // {"bugs": [...], "tags": {tag: [ids]}}
 * history/requirements/REQ-....json
 * history/decisions/DEC-....json
 * indexed/modules.json                 // {module: {..., last_updated}}
 * indexed/architecture.json
 * </pre>
 */
public final class KnowledgeUpdater {

    private static final Logger LOG = LoggerFactory.getLogger(KnowledgeUpdater.class);

    private static final DateTimeFormatter ID_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");

    static final String BUG_INDEX = "_index.json";

    private final Path baseDir;
    private final RecordStore store;
    private final ObjectMapper mapper;
    private final Clock clock;

    public KnowledgeUpdater(Path baseDir, RecordStore store) {
        this(baseDir, store, new ObjectMapper(), Clock.systemDefaultZone());
    }

    /**
     * @throws RecordNotFoundException if {@code baseDir} does not exist
     */
    public KnowledgeUpdater(Path baseDir, RecordStore store, ObjectMapper mapper, Clock clock) {
        if (!Files.isDirectory(baseDir)) {
            throw new RecordNotFoundException(baseDir);
        }
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.store = store;
        this.mapper = mapper;
        this.clock = clock;
    }

    // ========================================================================
    // History records
    // ========================================================================

    /**
     * Records a bug and adds it to the bug index.
     *
     * @param fields title, description, root_cause, solution, files_changed, tags, severity
     */
    public RecordResult recordBug(JsonNode fields) {
        String id = nextId(RecordType.BUG);
        ObjectNode bug = mapper.createObjectNode();
        bug.put("id", id);
        bug.put("recorded_at", now());
        bug.put("title", text(fields, "title", "Untitled Bug"));
        bug.put("description", text(fields, "description", ""));
        bug.put("root_cause", text(fields, "root_cause", ""));
        bug.put("solution", text(fields, "solution", ""));
        bug.set("files_changed", array(fields, "files_changed"));
        bug.set("tags", array(fields, "tags"));
        bug.put("severity", text(fields, "severity", "medium"));
        bug.put("status", "resolved");

        RecordResult result = write(RecordType.BUG, bug);
        if (result.written()) {
            updateBugIndex(bug);
        }
        return result;
    }

    /**
     * Records a requirement.
     *
     * @param fields title, description, status, priority, related_modules, acceptance_criteria, tags
     */
    public RecordResult recordRequirement(JsonNode fields) {
        String id = nextId(RecordType.REQUIREMENT);
        ObjectNode requirement = mapper.createObjectNode();
        requirement.put("id", id);
        requirement.put("recorded_at", now());
        requirement.put("title", text(fields, "title", "Untitled Requirement"));
        requirement.put("description", text(fields, "description", ""));
        requirement.put("status", text(fields, "status", "planned"));
        requirement.put("priority", text(fields, "priority", "medium"));
        requirement.set("related_modules", array(fields, "related_modules"));
        requirement.set("acceptance_criteria", array(fields, "acceptance_criteria"));
        requirement.set("tags", array(fields, "tags"));
        return write(RecordType.REQUIREMENT, requirement);
    }

    /**
     * Records an architecture decision.
     *
     * @param fields title, context, decision, rationale, consequences, alternatives, tags
     */
    public RecordResult recordDecision(JsonNode fields) {
        String id = nextId(RecordType.DECISION);
        ObjectNode decision = mapper.createObjectNode();
        decision.put("id", id);
        decision.put("recorded_at", now());
        decision.put("title", text(fields, "title", "Untitled Decision"));
        decision.put("context", text(fields, "context", ""));
        decision.put("decision", text(fields, "decision", ""));
        decision.put("rationale", text(fields, "rationale", ""));
        decision.put("consequences", text(fields, "consequences", ""));
        decision.set("alternatives", array(fields, "alternatives"));
        decision.set("tags", array(fields, "tags"));
        return write(RecordType.DECISION, decision);
    }

    private RecordResult write(RecordType type, ObjectNode record) {
        String id = record.get("id").asText();
        ValidationResult validation = RecordValidator.validate(record, type);
        if (!validation.valid()) {
            LOG.warn("Rejected {} {}: {}", type, id, validation.message());
            return RecordResult.rejected(id, validation.message());
        }

        Path file = recordFile(type, id);
        if (!store.safeWrite(file, record)) {
            return RecordResult.rejected(id, "Failed to write " + file);
        }
        LOG.info("{} recorded: {} - {}", type, id, record.get("title").asText());
        return RecordResult.written(id);
    }

    private void updateBugIndex(ObjectNode bug) {
        Path indexFile = baseDir.resolve(RecordType.BUG.directory()).resolve(BUG_INDEX);
        ObjectNode empty = mapper.createObjectNode();
        empty.putArray("bugs");
        empty.putObject("tags");

        boolean updated = store.safeUpdate(indexFile, current -> {
            ObjectNode index = current.isObject() ? (ObjectNode) current : empty.deepCopy();
            ArrayNode bugs = index.get("bugs") instanceof ArrayNode ? (ArrayNode) index.get("bugs") : index.putArray("bugs");
            ObjectNode tags = index.get("tags") instanceof ObjectNode ? (ObjectNode) index.get("tags") : index.putObject("tags");

            ObjectNode summary = bugs.addObject();
            summary.set("id", bug.get("id"));
            summary.set("title", bug.get("title"));
            summary.set("tags", bug.get("tags").deepCopy());
            summary.set("recorded_at", bug.get("recorded_at"));

            for (JsonNode tag : bug.get("tags")) {
                JsonNode ids = tags.get(tag.asText());
                ArrayNode tagIds = ids instanceof ArrayNode ? (ArrayNode) ids : tags.putArray(tag.asText());
                tagIds.add(bug.get("id").asText());
            }
            return index;
        }, empty);

        if (!updated) {
            LOG.warn("Bug {} recorded but the bug index was not updated", bug.get("id").asText());
        }
    }

    // ========================================================================
    // Indexed documents
    // ========================================================================

    /**
     * Merges {@code info} into the entry for {@code moduleName} in {@code indexed/modules.json}.
     *
     * @return true if the document was updated
     */
    public boolean updateModuleInfo(String moduleName, JsonNode info) {
        Path modulesFile = baseDir.resolve("indexed").resolve("modules.json");
        String stamp = now();
        boolean updated = store.safeUpdate(modulesFile, current -> {
            ObjectNode modules = current.isObject() ? (ObjectNode) current : mapper.createObjectNode();
            JsonNode existing = modules.get(moduleName);
            ObjectNode module = existing instanceof ObjectNode ? (ObjectNode) existing : mapper.createObjectNode();
            merge(module, info);
            module.put("last_updated", stamp);
            modules.set(moduleName, module);
            return modules;
        }, mapper.createObjectNode());
        if (updated) {
            LOG.info("Module info updated: {}", moduleName);
        }
        return updated;
    }

    /**
     * Merges {@code fields} into {@code indexed/architecture.json}.
     *
     * @return true if the document was updated
     */
    public boolean updateArchitecture(JsonNode fields) {
        Path architectureFile = baseDir.resolve("indexed").resolve("architecture.json");
        String stamp = now();
        boolean updated = store.safeUpdate(architectureFile, current -> {
            ObjectNode architecture = current.isObject() ? (ObjectNode) current : mapper.createObjectNode();
            merge(architecture, fields);
            architecture.put("last_updated", stamp);
            return architecture;
        }, mapper.createObjectNode());
        if (updated) {
            LOG.info("Architecture info updated");
        }
        return updated;
    }

    /** File holding the record with {@code id}. */
    public Path recordFile(RecordType type, String id) {
        return baseDir.resolve(type.directory()).resolve(id + ".json");
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static void merge(ObjectNode target, JsonNode fields) {
        if (fields == null || !fields.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> field = it.next();
            target.set(field.getKey(), field.getValue().deepCopy());
        }
    }

    private String nextId(RecordType type) {
        return type.idPrefix() + "-" + LocalDateTime.now(clock).format(ID_TIMESTAMP) + "-" +
                String.format("%04x", ThreadLocalRandom.current().nextInt(0x10000));
    }

    private String now() {
        return LocalDateTime.now(clock).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
    }

    private static String text(JsonNode fields, String name, String defaultValue) {
        JsonNode value = fields == null ? null : fields.get(name);
        return value == null || value.isNull() ? defaultValue : value.asText();
    }

    private ArrayNode array(JsonNode fields, String name) {
        JsonNode value = fields == null ? null : fields.get(name);
        return value instanceof ArrayNode ? ((ArrayNode) value).deepCopy() : mapper.createArrayNode();
    }
}
