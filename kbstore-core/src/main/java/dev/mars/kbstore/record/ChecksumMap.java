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
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.kbstore.storage.ContentFingerprint;
import dev.mars.kbstore.storage.RecordStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Map of project-relative file path to content fingerprint, stored as one JSON object
 * (by default {@code indexed/_checksums.json}) and used to find files that changed
 * between incremental updates.
 */
public final class ChecksumMap {

    private static final Logger LOG = LoggerFactory.getLogger(ChecksumMap.class);

    /** Location of the map relative to the knowledge-base root */
    public static final String DEFAULT_LOCATION = "indexed/_checksums.json";

    private final Path file;
    private final RecordStore store;
    private final ObjectMapper mapper;

    public ChecksumMap(Path file, RecordStore store) {
        this(file, store, new ObjectMapper());
    }

    public ChecksumMap(Path file, RecordStore store, ObjectMapper mapper) {
        this.file = file;
        this.store = store;
        this.mapper = mapper;
    }

    /** The map for the knowledge base rooted at {@code baseDir}. */
    public static ChecksumMap forKnowledgeBase(Path baseDir, RecordStore store) {
        return new ChecksumMap(baseDir.resolve(DEFAULT_LOCATION), store);
    }

    public Path file() {
        return file;
    }

    /**
     * Reads the stored map. Missing or corrupt files read as empty; non-string
     * values are skipped.
     */
    public Map<String, String> load() {
        return toMap(store.safeRead(file, mapper.createObjectNode()));
    }

    /**
     * Compares the current fingerprints of {@code relativePaths} under {@code projectRoot}
     * with the stored map, then stores the new fingerprints in one atomic update.
     * <p>
     * Stored paths absent from {@code relativePaths} are reported deleted and dropped.
     * If the update cannot be written the changes are still returned, and the next call
     * reports them again.
     */
    public ChangeSet detectChanges(Path projectRoot, Collection<String> relativePaths) {
        Map<String, String> current = new TreeMap<>();
        for (String relative : new LinkedHashSet<>(relativePaths)) {
            current.put(relative, ContentFingerprint.of(projectRoot.resolve(relative)));
        }

        AtomicReference<ChangeSet> changes = new AtomicReference<>();
        boolean saved = store.safeUpdate(file, stored -> {
            Map<String, String> previous = toMap(stored);
            changes.set(diff(previous, current));
            ObjectNode updated = mapper.createObjectNode();
            current.forEach(updated::put);
            return updated;
        }, mapper.createObjectNode());

        if (!saved) {
            LOG.warn("Could not save checksum map {}", file);
            if (changes.get() == null) {
                // The update never ran; compare against a plain read instead
                changes.set(diff(load(), current));
            }
        }

        ChangeSet result = changes.get();
        LOG.debug("Checksum changes in {}: {} added, {} modified, {} deleted", projectRoot,
                result.added().size(), result.modified().size(), result.deleted().size());
        return result;
    }

    private static ChangeSet diff(Map<String, String> previous, Map<String, String> current) {
        List<String> added = new ArrayList<>();
        List<String> modified = new ArrayList<>();
        for (Map.Entry<String, String> entry : current.entrySet()) {
            String before = previous.get(entry.getKey());
            if (before == null) {
                added.add(entry.getKey());
            } else if (!before.equals(entry.getValue())) {
                modified.add(entry.getKey());
            }
        }
        List<String> deleted = new ArrayList<>();
        Set<String> remaining = new TreeMap<>(previous).keySet();
        for (String path : remaining) {
            if (!current.containsKey(path)) {
                deleted.add(path);
            }
        }
        Collections.sort(added);
        Collections.sort(modified);
        return new ChangeSet(added, modified, deleted);
    }

    private static Map<String, String> toMap(JsonNode node) {
        Map<String, String> map = new TreeMap<>();
        if (node == null || !node.isObject()) {
            return map;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isTextual()) {
                map.put(field.getKey(), field.getValue().textValue());
            }
        }
        return map;
    }
}
