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
package dev.mars.kbstore.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link IntelligentCache}: content validation, TTL expiry,
 * adaptive TTL, LRU eviction and counters.
 */
class IntelligentCacheTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private MutableClock clock;
    private IntelligentCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        cache = newCache(10);
    }

    private IntelligentCache newCache(int maxSize) {
        return new IntelligentCache(maxSize, Map.of(), mapper, clock);
    }

    private Path writeJson(String name, String json) throws Exception {
        Path file = tempDir.resolve(name);
        Files.createDirectories(file.getParent());
        Files.writeString(file, json);
        return file;
    }

    // ========================================================================
    // Validation
    // ========================================================================

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Unchanged file is served from cache")
        void unchangedFileHits() throws Exception {
            Path file = writeJson("core/profile.json", "{\"name\": \"kb\"}");

            JsonNode first = cache.loadWithCache(file, CacheCategory.CORE);
            JsonNode second = cache.loadWithCache(file, CacheCategory.CORE);

            assertEquals("kb", second.get("name").asText());
            assertEquals(first, second);
            assertEquals(1, cache.stats().hits());
            assertEquals(1, cache.stats().misses());
        }

        @Test
        @DisplayName("Changed content invalidates the entry and is reloaded")
        void changedContentInvalidates() throws Exception {
            Path file = writeJson("core/profile.json", "{\"version\": 1}");
            cache.loadWithCache(file, CacheCategory.CORE);

            Files.writeString(file, "{\"version\": 2}");

            assertEquals(2, cache.loadWithCache(file, CacheCategory.CORE).get("version").asInt());
            assertEquals(1, cache.stats().invalidations());
            assertEquals(1, cache.changeCount(file));
            assertEquals(0, cache.stats().hits());
        }

        @Test
        @DisplayName("Deleted file invalidates the entry")
        void deletedFileInvalidates() throws Exception {
            Path file = writeJson("core/profile.json", "{\"name\": \"kb\"}");
            cache.loadWithCache(file, CacheCategory.CORE);

            Files.delete(file);

            assertTrue(cache.get(file, CacheCategory.CORE).isEmpty());
            assertFalse(cache.contains(file));
            assertEquals(1, cache.stats().invalidations());
            assertTrue(cache.loadWithCache(file, CacheCategory.CORE).isEmpty());
        }

        @Test
        @DisplayName("Entry older than the TTL expires")
        void ttlExpiry() throws Exception {
            Path file = writeJson("core/profile.json", "{\"name\": \"kb\"}");
            cache.loadWithCache(file, CacheCategory.CORE);

            clock.advance(Duration.ofMinutes(59));
            assertTrue(cache.get(file, CacheCategory.CORE).isPresent());

            clock.advance(Duration.ofMinutes(2));
            assertTrue(cache.get(file, CacheCategory.CORE).isEmpty());
            assertEquals(1, cache.stats().invalidations());
            assertEquals(0, cache.changeCount(file), "Expiry is not a content change");
        }

        @Test
        @DisplayName("Unknown key is a plain miss")
        void unknownKeyMiss() {
            assertEquals(Optional.empty(), cache.get(tempDir.resolve("nothing.json"), CacheCategory.CORE));
            assertEquals(1, cache.stats().misses());
            assertEquals(0, cache.stats().invalidations());
        }
    }

    // ========================================================================
    // Population
    // ========================================================================

    @Nested
    @DisplayName("Population")
    class Population {

        @Test
        @DisplayName("Zero-TTL category is never cached by loadWithCache")
        void historyNeverCached() throws Exception {
            Path file = writeJson("history/bugs/BUG-1.json", "{\"id\": \"BUG-1\"}");

            assertEquals("BUG-1", cache.loadWithCache(file, CacheCategory.HISTORY).get("id").asText());
            assertEquals("BUG-1", cache.loadWithCache(file, CacheCategory.HISTORY).get("id").asText());

            assertEquals(0, cache.size());
            assertEquals(0, cache.stats().hits());
            assertEquals(2, cache.stats().misses());
        }

        @Test
        @DisplayName("Missing file loads as an empty object")
        void missingFileEmptyObject() {
            JsonNode result = cache.loadWithCache(tempDir.resolve("core/absent.json"), CacheCategory.CORE);

            assertTrue(result.isObject());
            assertTrue(result.isEmpty());
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("Corrupt file loads as an empty object and is not cached")
        void corruptFileNotCached() throws Exception {
            Path file = writeJson("core/profile.json", "{broken");

            assertTrue(cache.loadWithCache(file, CacheCategory.CORE).isEmpty());
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("set stores under the file's current fingerprint")
        void setStoresEntry() throws Exception {
            Path file = writeJson("indexed/modules.json", "{\"auth\": {}}");
            JsonNode data = mapper.readTree(file.toFile());

            cache.set(file, data, CacheCategory.INDEXED);

            assertTrue(cache.contains(file));
            assertEquals(data, cache.get(file, CacheCategory.INDEXED).orElseThrow());
        }

        @Test
        @DisplayName("Editing a returned document does not change the cached copy")
        void returnedDocumentIsIsolated() throws Exception {
            Path file = writeJson("core/profile.json", "{\"name\": \"disk\"}");
            cache.loadWithCache(file, CacheCategory.CORE);

            ObjectNode hit = (ObjectNode) cache.loadWithCache(file, CacheCategory.CORE);
            hit.put("name", "edited");

            assertEquals("disk", cache.loadWithCache(file, CacheCategory.CORE).get("name").asText());
            assertEquals(2, cache.stats().hits());
        }

        @Test
        @DisplayName("Editing a stored document after set does not change the cached copy")
        void storedDocumentIsIsolated() throws Exception {
            Path file = writeJson("indexed/modules.json", "{\"auth\": {}}");
            ObjectNode data = (ObjectNode) mapper.readTree(file.toFile());
            cache.set(file, data, CacheCategory.INDEXED);

            data.put("extra", true);

            assertFalse(cache.get(file, CacheCategory.INDEXED).orElseThrow().has("extra"));
        }

        @Test
        @DisplayName("Editing the document returned by a miss does not change the cached copy")
        void loadedDocumentIsIsolated() throws Exception {
            Path file = writeJson("core/profile.json", "{\"name\": \"disk\"}");

            ((ObjectNode) cache.loadWithCache(file, CacheCategory.CORE)).put("name", "edited");

            assertEquals("disk", cache.get(file, CacheCategory.CORE).orElseThrow().get("name").asText());
        }

        @Test
        @DisplayName("Paths are normalized into one key")
        void pathsNormalized() throws Exception {
            Path file = writeJson("core/profile.json", "{}");
            cache.loadWithCache(file, CacheCategory.CORE);

            assertTrue(cache.contains(tempDir.resolve("core/../core/profile.json")));
        }
    }

    // ========================================================================
    // LRU Eviction
    // ========================================================================

    @Nested
    @DisplayName("LRU Eviction")
    class LruEviction {

        @Test
        @DisplayName("Oldest untouched entry is evicted first")
        void evictsOldestUntouched() throws Exception {
            IntelligentCache small = newCache(2);
            Path a = writeJson("a.json", "{\"n\": \"a\"}");
            Path b = writeJson("b.json", "{\"n\": \"b\"}");
            Path c = writeJson("c.json", "{\"n\": \"c\"}");

            small.set(a, mapper.readTree(a.toFile()), CacheCategory.CORE);
            small.set(b, mapper.readTree(b.toFile()), CacheCategory.CORE);
            small.set(c, mapper.readTree(c.toFile()), CacheCategory.CORE);

            assertTrue(small.get(a, CacheCategory.CORE).isEmpty());
            assertTrue(small.get(b, CacheCategory.CORE).isPresent());
            assertTrue(small.get(c, CacheCategory.CORE).isPresent());
        }

        @Test
        @DisplayName("Least recently used entry is evicted when full")
        void evictsLeastRecentlyUsed() throws Exception {
            IntelligentCache small = newCache(2);
            Path a = writeJson("a.json", "{\"n\": \"a\"}");
            Path b = writeJson("b.json", "{\"n\": \"b\"}");
            Path c = writeJson("c.json", "{\"n\": \"c\"}");

            small.loadWithCache(a, CacheCategory.CORE);
            small.loadWithCache(b, CacheCategory.CORE);
            small.get(a, CacheCategory.CORE); // a becomes most recently used
            small.loadWithCache(c, CacheCategory.CORE);

            assertTrue(small.contains(a));
            assertFalse(small.contains(b));
            assertTrue(small.contains(c));
            assertEquals(2, small.size());
            assertEquals(1, small.stats().evictions());
        }

        @Test
        @DisplayName("Replacing an existing key evicts nothing")
        void replaceDoesNotEvict() throws Exception {
            IntelligentCache small = newCache(2);
            Path a = writeJson("a.json", "{\"n\": \"a\"}");
            Path b = writeJson("b.json", "{\"n\": \"b\"}");
            small.loadWithCache(a, CacheCategory.CORE);
            small.loadWithCache(b, CacheCategory.CORE);

            small.set(a, mapper.readTree("{\"n\": \"a2\"}"), CacheCategory.CORE);

            assertEquals(2, small.size());
            assertEquals(0, small.stats().evictions());
            assertTrue(small.contains(b));
        }

        @Test
        @DisplayName("Size never exceeds the capacity")
        void sizeBounded() throws Exception {
            IntelligentCache small = newCache(3);
            for (int i = 0; i < 10; i++) {
                small.loadWithCache(writeJson("f" + i + ".json", "{\"i\": " + i + "}"), CacheCategory.INDEXED);
                assertTrue(small.size() <= 3);
            }
            assertEquals(7, small.stats().evictions());
        }

        @Test
        @DisplayName("Non-positive capacity is rejected")
        void rejectsNonPositiveCapacity() {
            assertThrows(IllegalArgumentException.class, () -> new IntelligentCache(0));
        }
    }

    // ========================================================================
    // Adaptive TTL
    // ========================================================================

    @Nested
    @DisplayName("Adaptive TTL")
    class AdaptiveTtl {

        private Path file;
        private int version;

        @BeforeEach
        void createFile() throws Exception {
            file = writeJson("core/conventions.json", "{\"v\": 0}");
            cache.loadWithCache(file, CacheCategory.CORE);
        }

        private void changeAfter(Duration interval) throws Exception {
            clock.advance(interval);
            Files.writeString(file, "{\"v\": " + (++version) + "}");
            cache.loadWithCache(file, CacheCategory.CORE);
        }

        @Test
        @DisplayName("Fewer than two changes keeps the base TTL")
        void baseTtlWithoutHistory() throws Exception {
            assertEquals(Duration.ofHours(1), cache.adaptiveTtl(file, CacheCategory.CORE));

            changeAfter(Duration.ofMinutes(1));
            assertEquals(Duration.ofHours(1), cache.adaptiveTtl(file, CacheCategory.CORE));
        }

        @Test
        @DisplayName("TTL is half the mean change interval")
        void halfMeanInterval() throws Exception {
            changeAfter(Duration.ofMinutes(10));
            changeAfter(Duration.ofMinutes(10));
            changeAfter(Duration.ofMinutes(20));

            // Intervals 10m and 20m, mean 15m
            assertEquals(Duration.ofSeconds(450), cache.adaptiveTtl(file, CacheCategory.CORE));
        }

        @Test
        @DisplayName("Adaptive TTL is floored at one minute")
        void flooredAtMinimum() throws Exception {
            changeAfter(Duration.ofSeconds(10));
            changeAfter(Duration.ofSeconds(10));

            assertEquals(IntelligentCache.MIN_ADAPTIVE_TTL, cache.adaptiveTtl(file, CacheCategory.CORE));
        }

        @Test
        @DisplayName("Adaptive TTL is capped at the base TTL")
        void cappedAtBase() throws Exception {
            changeAfter(Duration.ofHours(4));
            changeAfter(Duration.ofHours(4));

            assertEquals(Duration.ofHours(1), cache.adaptiveTtl(file, CacheCategory.CORE));
        }

        @Test
        @DisplayName("Change history keeps only the most recent entries")
        void historyBounded() throws Exception {
            for (int i = 0; i < IntelligentCache.CHANGE_HISTORY_LIMIT + 5; i++) {
                changeAfter(Duration.ofMinutes(5));
            }
            assertEquals(IntelligentCache.CHANGE_HISTORY_LIMIT, cache.changeCount(file));
        }

        @Test
        @DisplayName("Frequently changing file expires sooner")
        void frequentChangesExpireSooner() throws Exception {
            changeAfter(Duration.ofMinutes(4));
            changeAfter(Duration.ofMinutes(4));
            // Adaptive TTL is now 2 minutes

            clock.advance(Duration.ofMinutes(3));
            assertTrue(cache.get(file, CacheCategory.CORE).isEmpty());
        }
    }

    // ========================================================================
    // Invalidation and Stats
    // ========================================================================

    @Nested
    @DisplayName("Invalidation and Stats")
    class InvalidationAndStats {

        @Test
        @DisplayName("Pattern invalidation removes matching keys only")
        void patternInvalidation() throws Exception {
            Path profile = writeJson("core/profile.json", "{}");
            Path modules = writeJson("indexed/modules.json", "{}");
            Path architecture = writeJson("indexed/architecture.json", "{}");
            cache.loadWithCache(profile, CacheCategory.CORE);
            cache.loadWithCache(modules, CacheCategory.INDEXED);
            cache.loadWithCache(architecture, CacheCategory.INDEXED);

            assertEquals(2, cache.invalidate("indexed"));
            assertTrue(cache.contains(profile));
            assertFalse(cache.contains(modules));
            assertEquals(0, cache.invalidate("no-such-fragment"));
            assertEquals(2, cache.stats().invalidations());
        }

        @Test
        @DisplayName("Wildcard invalidation clears everything")
        void wildcardInvalidation() throws Exception {
            cache.loadWithCache(writeJson("a.json", "{}"), CacheCategory.CORE);
            cache.loadWithCache(writeJson("b.json", "{}"), CacheCategory.CORE);

            assertEquals(2, cache.invalidate("*"));
            assertEquals(0, cache.size());
        }

        @Test
        @DisplayName("Hit rate is reported in percent")
        void hitRate() throws Exception {
            Path file = writeJson("a.json", "{}");
            cache.loadWithCache(file, CacheCategory.CORE);
            cache.loadWithCache(file, CacheCategory.CORE);
            cache.loadWithCache(file, CacheCategory.CORE);
            cache.loadWithCache(file, CacheCategory.CORE);

            CacheStats stats = cache.stats();
            assertEquals(3, stats.hits());
            assertEquals(1, stats.misses());
            assertEquals(4, stats.totalRequests());
            assertEquals(75.0, stats.hitRate(), 1e-9);
            assertEquals(1, stats.size());
            assertEquals(10, stats.maxSize());
            assertTrue(stats.toString().contains("hitRate=75.0%"));
        }

        @Test
        @DisplayName("Hit rate is zero before any request")
        void hitRateWithoutRequests() {
            assertEquals(0.0, cache.stats().hitRate());
        }
    }
}
