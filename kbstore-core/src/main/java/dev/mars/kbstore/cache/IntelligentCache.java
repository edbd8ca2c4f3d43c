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
import dev.mars.kbstore.storage.ContentFingerprint;
import dev.mars.kbstore.storage.KbStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Bounded, in-memory read-through cache of parsed JSON documents, keyed by file path.
 * <p>
 * <b>Validation:</b> a lookup of a present key runs these checks in order and stops at
 * the first failure. A failure removes the entry and counts as both an invalidation
 * and a miss.
 * <ol>
 *   <li>the file still exists</li>
 *   <li>its content fingerprint matches the one stored with the entry (a mismatch is
 *       also recorded in the key's change history)</li>
 *   <li>the entry is younger than the category's adaptive TTL, when that TTL is non-zero</li>
 * </ol>
 * A lookup that passes moves the entry to the most-recently-used position.
 * <p>
 * <b>Isolation:</b> documents are copied on the way in and on the way out, so a
 * caller editing a document it stored or received never changes the cached copy.
 * <p>
 * <b>Adaptive TTL:</b> with fewer than two recorded changes the category's base TTL
 * applies. Otherwise the TTL is half the mean interval between recorded changes,
 * capped at the base TTL and floored at {@link #MIN_ADAPTIVE_TTL}. A zero base TTL
 * means the category is never populated by {@link #loadWithCache}.
 * <p>
 * <b>Capacity:</b> never more than {@code maxSize} entries; storing a new key into a
 * full cache evicts the least-recently-used entry first.
 * <p>
 * <b>Thread Safety:</b> none. An instance belongs to one thread or must be guarded
 * externally. Cross-process consistency comes from content validation, not locking.
 */
public final class IntelligentCache {

    private static final Logger LOG = LoggerFactory.getLogger(IntelligentCache.class);

    /** Default capacity */
    public static final int DEFAULT_MAX_SIZE = 100;

    /** Change timestamps kept per key */
    static final int CHANGE_HISTORY_LIMIT = 10;

    /** Lower bound for a TTL derived from change history */
    public static final Duration MIN_ADAPTIVE_TTL = Duration.ofSeconds(60);

    private final int maxSize;
    private final Map<CacheCategory, Duration> baseTtls;
    private final ObjectMapper mapper;
    private final Clock clock;

    /** Access-ordered: iteration starts at the least recently used entry */
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>(16, 0.75f, true);
    private final Map<String, Deque<Instant>> changeHistory = new HashMap<>();

    private long hits;
    private long misses;
    private long invalidations;
    private long evictions;

    /**
     * Creates a cache with the default category TTLs.
     */
    public IntelligentCache(int maxSize) {
        this(maxSize, Collections.emptyMap(), new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * Creates a cache sized and tuned from {@code config}.
     */
    public IntelligentCache(KbStoreConfig config) {
        this(config.cacheMaxSize(), ttlsFrom(config), new ObjectMapper(), Clock.systemUTC());
    }

    /**
     * @param maxSize  capacity, must be positive
     * @param baseTtls base TTL per category; categories not present use {@link CacheCategory#defaultTtl()}
     * @param mapper   JSON mapper used by {@link #loadWithCache}
     * @param clock    time source for insertion, expiry and change history
     */
    public IntelligentCache(int maxSize, Map<CacheCategory, Duration> baseTtls, ObjectMapper mapper, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.baseTtls = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            Duration ttl = baseTtls.getOrDefault(category, category.defaultTtl());
            if (ttl.isNegative()) {
                throw new IllegalArgumentException("TTL for " + category + " must not be negative: " + ttl);
            }
            this.baseTtls.put(category, ttl);
        }
        this.mapper = mapper;
        this.clock = clock;
        LOG.info("IntelligentCache initialized: maxSize={}, baseTtls={}", maxSize, this.baseTtls);
    }

    private static Map<CacheCategory, Duration> ttlsFrom(KbStoreConfig config) {
        Map<CacheCategory, Duration> ttls = new EnumMap<>(CacheCategory.class);
        for (CacheCategory category : CacheCategory.values()) {
            ttls.put(category, category.ttl(config));
        }
        return ttls;
    }

    // ========================================================================
    // Lookup
    // ========================================================================

    /**
     * Returns the cached document for {@code file} if it is still valid.
     *
     * @param file     the document's file
     * @param category the category whose TTL applies
     * @return the cached document, or empty on a miss
     */
    public Optional<JsonNode> get(Path file, CacheCategory category) {
        String key = key(file);
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses++;
            LOG.trace("Cache miss: {}", key);
            return Optional.empty();
        }

        if (!Files.exists(file)) {
            invalidateEntry(key, "file removed");
            return Optional.empty();
        }

        if (!ContentFingerprint.of(file).equals(entry.fingerprint())) {
            invalidateEntry(key, "content changed");
            recordChange(key);
            return Optional.empty();
        }

        Duration ttl = adaptiveTtl(key, category);
        if (!ttl.isZero() && Duration.between(entry.insertedAt(), clock.instant()).compareTo(ttl) > 0) {
            invalidateEntry(key, "expired after " + ttl.toSeconds() + "s");
            return Optional.empty();
        }

        entries.put(key, entry.touched());
        hits++;
        LOG.trace("Cache hit: {} (accessCount={})", key, entry.accessCount() + 1);
        return Optional.of(entry.data().deepCopy());
    }

    private void invalidateEntry(String key, String reason) {
        entries.remove(key);
        invalidations++;
        misses++;
        LOG.debug("Cache entry invalidated: {} ({})", key, reason);
    }

    // ========================================================================
    // Population
    // ========================================================================

    /**
     * Stores {@code data} for {@code file}, fingerprinting the file's current content.
     *
     * @param file     the document's file
     * @param data     the parsed document
     * @param category the document's category
     */
    public void set(Path file, JsonNode data, CacheCategory category) {
        store(key(file), data, ContentFingerprint.of(file));
    }

    private void store(String key, JsonNode data, String fingerprint) {
        // Replacing an existing key needs no room
        if (entries.remove(key) == null && entries.size() >= maxSize) {
            evictLeastRecentlyUsed();
        }
        entries.put(key, new CacheEntry(data.deepCopy(), clock.instant(), fingerprint, 1));
        LOG.trace("Cached: {} ({} / {})", key, entries.size(), maxSize);
    }

    private void evictLeastRecentlyUsed() {
        Iterator<String> it = entries.keySet().iterator();
        if (it.hasNext()) {
            String evicted = it.next();
            it.remove();
            evictions++;
            LOG.debug("Cache full, evicted least recently used: {}", evicted);
        }
    }

    /**
     * Loads a JSON document through the cache.
     * <p>
     * A valid cached copy is returned as is. Otherwise the file is read and parsed
     * directly, without a lock, and cached if the category's base TTL is non-zero.
     * A missing or unparseable file yields an empty object; parse failures are logged.
     */
    public JsonNode loadWithCache(Path file, CacheCategory category) {
        Optional<JsonNode> cached = get(file, category);
        if (cached.isPresent()) {
            return cached.get();
        }

        if (!Files.exists(file)) {
            return mapper.createObjectNode();
        }

        try {
            // Parse and fingerprint the same bytes so a concurrent rewrite cannot
            // pair old data with a new fingerprint
            byte[] content = Files.readAllBytes(file);
            JsonNode data = mapper.readTree(content);
            if (data == null || data.isMissingNode()) {
                LOG.warn("Error loading {}: empty document", file);
                return mapper.createObjectNode();
            }
            if (!baseTtl(category).isZero()) {
                store(key(file), data, ContentFingerprint.of(content));
            }
            return data;
        } catch (IOException e) {
            LOG.warn("Error loading {}: {}", file, e.getMessage());
            return mapper.createObjectNode();
        }
    }

    // ========================================================================
    // Invalidation
    // ========================================================================

    /**
     * Removes entries by pattern: {@code "*"} removes everything, anything else removes
     * every key containing it as a substring.
     *
     * @return number of entries removed
     */
    public int invalidate(String pattern) {
        int removed;
        if ("*".equals(pattern)) {
            removed = entries.size();
            entries.clear();
        } else {
            removed = 0;
            Iterator<String> it = entries.keySet().iterator();
            while (it.hasNext()) {
                if (it.next().contains(pattern)) {
                    it.remove();
                    removed++;
                }
            }
        }
        invalidations += removed;
        LOG.debug("Invalidated {} cache entries matching '{}'", removed, pattern);
        return removed;
    }

    // ========================================================================
    // TTL
    // ========================================================================

    /** Configured base TTL of a category. */
    public Duration baseTtl(CacheCategory category) {
        return baseTtls.get(category);
    }

    /**
     * Effective TTL for {@code file} in {@code category}, derived from its change history.
     */
    public Duration adaptiveTtl(Path file, CacheCategory category) {
        return adaptiveTtl(key(file), category);
    }

    private Duration adaptiveTtl(String key, CacheCategory category) {
        Duration base = baseTtl(category);
        if (base.isZero()) {
            return Duration.ZERO;
        }

        Deque<Instant> changes = changeHistory.get(key);
        if (changes == null || changes.size() < 2) {
            return base;
        }

        // Mean of consecutive intervals telescopes to (last - first) / (n - 1)
        Duration meanInterval = Duration.between(changes.peekFirst(), changes.peekLast())
                .dividedBy(changes.size() - 1);
        Duration ttl = meanInterval.dividedBy(2);
        if (ttl.compareTo(base) > 0) {
            ttl = base;
        }
        return ttl.compareTo(MIN_ADAPTIVE_TTL) < 0 ? MIN_ADAPTIVE_TTL : ttl;
    }

    private void recordChange(String key) {
        Deque<Instant> changes = changeHistory.computeIfAbsent(key, k -> new ArrayDeque<>());
        changes.addLast(clock.instant());
        while (changes.size() > CHANGE_HISTORY_LIMIT) {
            changes.removeFirst();
        }
    }

    /** Number of content changes currently remembered for {@code file}. */
    public int changeCount(Path file) {
        Deque<Instant> changes = changeHistory.get(key(file));
        return changes == null ? 0 : changes.size();
    }

    // ========================================================================
    // Introspection
    // ========================================================================

    /** Number of cached entries. */
    public int size() {
        return entries.size();
    }

    /** Capacity. */
    public int maxSize() {
        return maxSize;
    }

    /**
     * Whether {@code file} has an entry, without validating it or changing its recency.
     */
    public boolean contains(Path file) {
        return entries.containsKey(key(file));
    }

    /** Snapshot of the counters. */
    public CacheStats stats() {
        return new CacheStats(entries.size(), maxSize, hits, misses, invalidations, evictions);
    }

    private static String key(Path file) {
        return file.toAbsolutePath().normalize().toString();
    }
}
