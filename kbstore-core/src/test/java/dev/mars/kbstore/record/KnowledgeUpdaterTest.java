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
import dev.mars.kbstore.storage.FileRecordStore;
import dev.mars.kbstore.storage.KbStoreConfig;
import dev.mars.kbstore.storage.RecordNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link KnowledgeUpdater}.
 */
class KnowledgeUpdaterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private FileRecordStore store;
    private KnowledgeUpdater updater;

    @BeforeEach
    void setUp() {
        store = new FileRecordStore(KbStoreConfig.builder()
                .baseDir(tempDir)
                .lockTimeoutSeconds(10)
                .lockPollMillis(5)
                .build());
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        updater = new KnowledgeUpdater(tempDir, store, mapper, clock);
    }

    private ObjectNode bugFields(String title, String... tags) {
        ObjectNode fields = mapper.createObjectNode();
        fields.put("title", title);
        fields.put("description", "Observed while testing " + title);
        fields.put("root_cause", "Missing lock");
        fields.put("solution", "Added lock");
        fields.putArray("files_changed").add("src/Store.java");
        ArrayNode tagArray = fields.putArray("tags");
        for (String tag : tags) {
            tagArray.add(tag);
        }
        return fields;
    }

    private JsonNode read(Path file) {
        return store.safeRead(file, mapper.createObjectNode());
    }

    // ========================================================================
    // Bugs
    // ========================================================================

    @Nested
    @DisplayName("Bugs")
    class Bugs {

        @Test
        @DisplayName("Bug is written with generated id and defaults")
        void recordsBug() {
            RecordResult result = updater.recordBug(bugFields("Stale cache", "cache"));

            assertTrue(result.written(), result.message());
            assertTrue(result.id().matches("BUG-20260301120000-[0-9a-f]{4}"), result.id());

            JsonNode bug = read(updater.recordFile(RecordType.BUG, result.id()));
            assertEquals(result.id(), bug.get("id").asText());
            assertEquals("2026-03-01T12:00:00", bug.get("recorded_at").asText());
            assertEquals("Stale cache", bug.get("title").asText());
            assertEquals("medium", bug.get("severity").asText());
            assertEquals("resolved", bug.get("status").asText());
            assertEquals("src/Store.java", bug.get("files_changed").get(0).asText());
            assertTrue(RecordValidator.validateBug(bug).valid());
        }

        @Test
        @DisplayName("Bug index lists bugs and groups ids by tag")
        void maintainsBugIndex() {
            String first = updater.recordBug(bugFields("First", "cache", "core")).id();
            String second = updater.recordBug(bugFields("Second", "cache")).id();

            JsonNode index = read(tempDir.resolve("history/bugs").resolve(KnowledgeUpdater.BUG_INDEX));

            assertEquals(2, index.get("bugs").size());
            assertEquals(first, index.get("bugs").get(0).get("id").asText());
            assertEquals("First", index.get("bugs").get(0).get("title").asText());
            assertEquals(2, index.get("tags").get("cache").size());
            assertEquals(second, index.get("tags").get("cache").get(1).asText());
            assertEquals(1, index.get("tags").get("core").size());
        }

        @Test
        @DisplayName("Bug without a description is rejected and nothing is written")
        void rejectsBugWithoutDescription() throws Exception {
            ObjectNode fields = mapper.createObjectNode();
            fields.put("title", "No details");

            RecordResult result = updater.recordBug(fields);

            assertFalse(result.written());
            assertEquals("Field description must be at least 1 characters", result.message());
            assertFalse(Files.exists(updater.recordFile(RecordType.BUG, result.id())));
            assertFalse(Files.exists(tempDir.resolve("history/bugs").resolve(KnowledgeUpdater.BUG_INDEX)));
        }

        @Test
        @DisplayName("Invalid severity is rejected")
        void rejectsInvalidSeverity() {
            ObjectNode fields = bugFields("Bad severity");
            fields.put("severity", "catastrophic");

            RecordResult result = updater.recordBug(fields);

            assertFalse(result.written());
            assertTrue(result.message().startsWith("Field severity must be one of"));
        }

        @Test
        @DisplayName("Concurrent recorders all reach the bug index")
        void concurrentIndexUpdates() throws Exception {
            int numThreads = 4;
            int bugsPerThread = 5;
            ExecutorService executor = Executors.newFixedThreadPool(numThreads);
            CyclicBarrier barrier = new CyclicBarrier(numThreads);

            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < numThreads; t++) {
                final int threadId = t;
                futures.add(executor.submit(() -> {
                    barrier.await();
                    for (int i = 0; i < bugsPerThread; i++) {
                        assertTrue(updater.recordBug(bugFields("Bug " + threadId + "-" + i, "load")).written());
                    }
                    return null;
                }));
            }
            for (Future<?> f : futures) {
                f.get(60, TimeUnit.SECONDS);
            }
            executor.shutdown();

            JsonNode index = read(tempDir.resolve("history/bugs").resolve(KnowledgeUpdater.BUG_INDEX));
            assertEquals(numThreads * bugsPerThread, index.get("bugs").size());
            assertEquals(numThreads * bugsPerThread, index.get("tags").get("load").size());
        }
    }

    // ========================================================================
    // Requirements and Decisions
    // ========================================================================

    @Nested
    @DisplayName("Requirements and Decisions")
    class RequirementsAndDecisions {

        @Test
        @DisplayName("Requirement gets planned status and medium priority by default")
        void recordsRequirement() {
            ObjectNode fields = mapper.createObjectNode();
            fields.put("title", "Export");
            fields.put("description", "Export records as JSON");
            fields.putArray("acceptance_criteria").add("All record types exported");

            RecordResult result = updater.recordRequirement(fields);

            assertTrue(result.written(), result.message());
            assertTrue(result.id().startsWith("REQ-20260301120000-"));
            JsonNode requirement = read(updater.recordFile(RecordType.REQUIREMENT, result.id()));
            assertEquals("planned", requirement.get("status").asText());
            assertEquals("medium", requirement.get("priority").asText());
            assertEquals(1, requirement.get("acceptance_criteria").size());
            assertTrue(requirement.get("related_modules").isArray());
        }

        @Test
        @DisplayName("Decision is written with consequences as text")
        void recordsDecision() {
            ObjectNode fields = mapper.createObjectNode();
            fields.put("title", "Use file locks");
            fields.put("context", "Several writers");
            fields.put("decision", "Lock every write");
            fields.put("consequences", "Writers may wait");
            fields.putArray("alternatives").add("Single writer");

            RecordResult result = updater.recordDecision(fields);

            assertTrue(result.written(), result.message());
            JsonNode decision = read(updater.recordFile(RecordType.DECISION, result.id()));
            assertEquals("Writers may wait", decision.get("consequences").asText());
            assertEquals("Single writer", decision.get("alternatives").get(0).asText());
            assertTrue(Files.exists(tempDir.resolve("history/decisions").resolve(result.id() + ".json")));
        }

        @Test
        @DisplayName("Decision without context is rejected")
        void rejectsDecisionWithoutContext() {
            ObjectNode fields = mapper.createObjectNode();
            fields.put("title", "Incomplete");
            fields.put("decision", "Something");

            RecordResult result = updater.recordDecision(fields);

            assertFalse(result.written());
            assertEquals("Field context must be at least 1 characters", result.message());
        }
    }

    // ========================================================================
    // Indexed Documents
    // ========================================================================

    @Nested
    @DisplayName("Indexed Documents")
    class IndexedDocuments {

        @Test
        @DisplayName("Module info is merged and stamped")
        void mergesModuleInfo() {
            ObjectNode first = mapper.createObjectNode();
            first.put("owner", "team-a");
            first.put("path", "src/auth");
            ObjectNode second = mapper.createObjectNode();
            second.put("owner", "team-b");

            assertTrue(updater.updateModuleInfo("auth", first));
            assertTrue(updater.updateModuleInfo("auth", second));
            assertTrue(updater.updateModuleInfo("ui", mapper.createObjectNode()));

            JsonNode modules = read(tempDir.resolve("indexed/modules.json"));
            assertEquals("team-b", modules.get("auth").get("owner").asText());
            assertEquals("src/auth", modules.get("auth").get("path").asText());
            assertEquals("2026-03-01T12:00:00", modules.get("auth").get("last_updated").asText());
            assertTrue(modules.has("ui"));
        }

        @Test
        @DisplayName("Architecture fields are merged")
        void mergesArchitecture() {
            ObjectNode style = mapper.createObjectNode();
            style.put("style", "layered");
            ObjectNode storage = mapper.createObjectNode();
            storage.put("storage", "json files");

            assertTrue(updater.updateArchitecture(style));
            assertTrue(updater.updateArchitecture(storage));

            JsonNode architecture = read(tempDir.resolve("indexed/architecture.json"));
            assertEquals("layered", architecture.get("style").asText());
            assertEquals("json files", architecture.get("storage").asText());
            assertTrue(architecture.has("last_updated"));
        }
    }

    @Test
    @DisplayName("Missing knowledge-base directory is rejected")
    void missingBaseDirRejected() {
        assertThrows(RecordNotFoundException.class,
                () -> new KnowledgeUpdater(tempDir.resolve("absent"), store));
    }
}
