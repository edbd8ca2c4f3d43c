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
import dev.mars.kbstore.storage.KbStoreConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Loads knowledge-base documents for read-mostly consumers, through an
 * {@link IntelligentCache} when one is supplied.
 * <p>
 * The cache is an explicit instance owned by the caller. Nothing is loaded until
 * {@link #warm()} is called.
 * <p>
 * Reads here take no file lock. Writers go through
 * {@link dev.mars.kbstore.storage.RecordStore} and never touch the cache; a stale
 * entry is dropped on its next lookup because the file's fingerprint no longer matches.
 */
public final class ContextLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ContextLoader.class);

    /** Documents under {@code core/} preloaded by {@link #warm()} */
    public static final List<String> CORE_FILES = List.of("profile.json", "tech-stack.json", "conventions.json");

    private final Path baseDir;
    private final IntelligentCache cache;
    private final ObjectMapper mapper;

    /**
     * Creates a loader with a cache configured from {@code config}.
     */
    public ContextLoader(KbStoreConfig config) {
        this(config.baseDir(), new IntelligentCache(config));
    }

    /**
     * @param baseDir knowledge-base root
     * @param cache   cache to read through, or null to always read from disk
     */
    public ContextLoader(Path baseDir, IntelligentCache cache) {
        this(baseDir, cache, new ObjectMapper());
    }

    public ContextLoader(Path baseDir, IntelligentCache cache, ObjectMapper mapper) {
        this.baseDir = baseDir.toAbsolutePath().normalize();
        this.cache = cache;
        this.mapper = mapper;
    }

    public Path baseDir() {
        return baseDir;
    }

    /** The cache, if this loader has one. */
    public Optional<IntelligentCache> cache() {
        return Optional.ofNullable(cache);
    }

    /**
     * Loads a document by path relative to the knowledge-base root.
     * <p>
     * A missing or unparseable document yields an empty object.
     */
    public JsonNode load(String relativePath, CacheCategory category) {
        return load(baseDir.resolve(relativePath), category);
    }

    private JsonNode load(Path file, CacheCategory category) {
        if (cache != null) {
            return cache.loadWithCache(file, category);
        }
        if (!Files.exists(file)) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode data = mapper.readTree(file.toFile());
            return data == null || data.isMissingNode() ? mapper.createObjectNode() : data;
        } catch (IOException e) {
            LOG.warn("Error loading {}: {}", file, e.getMessage());
            return mapper.createObjectNode();
        }
    }

    /**
     * Preloads the core documents that exist.
     *
     * @return number of cached entries afterwards, zero without a cache
     */
    public int warm() {
        if (cache == null) {
            return 0;
        }
        LOG.info("Warming cache from {}", baseDir);
        for (String name : CORE_FILES) {
            Path file = baseDir.resolve("core").resolve(name);
            if (Files.exists(file)) {
                cache.loadWithCache(file, CacheCategory.CORE);
            }
        }
        LOG.info("Cache warmed with {} files", cache.size());
        return cache.size();
    }

    /**
     * Loads the three core documents as one object with fields
     * {@code profile}, {@code tech_stack} and {@code conventions}.
     */
    public ObjectNode loadMinimal() {
        ObjectNode context = mapper.createObjectNode();
        context.set("profile", load("core/profile.json", CacheCategory.CORE));
        context.set("tech_stack", load("core/tech-stack.json", CacheCategory.CORE));
        context.set("conventions", load("core/conventions.json", CacheCategory.CORE));
        return context;
    }

    /**
     * Loads the bug records tagged with {@code module} or touching a file whose path
     * contains it. Bug records are history and are read from disk every time.
     */
    public List<JsonNode> loadModuleBugs(String module) {
        Path bugsDir = baseDir.resolve("history").resolve("bugs");
        List<JsonNode> bugs = new ArrayList<>();
        if (!Files.isDirectory(bugsDir)) {
            return bugs;
        }

        String needle = module.toLowerCase(Locale.ROOT);
        try (DirectoryStream<Path> files = Files.newDirectoryStream(bugsDir, "*.json")) {
            for (Path file : files) {
                if (file.getFileName().toString().startsWith("_")) {
                    continue;
                }
                JsonNode bug = load(file, CacheCategory.HISTORY);
                if (bug.size() > 0 && relatesTo(bug, module, needle)) {
                    bugs.add(bug);
                }
            }
        } catch (IOException e) {
            LOG.warn("Could not list bug records in {}: {}", bugsDir, e.getMessage());
        }
        return bugs;
    }

    private static boolean relatesTo(JsonNode bug, String module, String needle) {
        for (JsonNode tag : bug.path("tags")) {
            if (module.equals(tag.asText())) {
                return true;
            }
        }
        for (JsonNode changed : bug.path("files_changed")) {
            if (changed.asText().toLowerCase(Locale.ROOT).contains(needle)) {
                return true;
            }
        }
        return false;
    }

    /** Cache counters, if this loader has a cache. */
    public Optional<CacheStats> stats() {
        return cache == null ? Optional.empty() : Optional.of(cache.stats());
    }

    /**
     * Invalidates cache entries matching {@code pattern} ({@code "*"} for all).
     *
     * @return number of entries removed
     */
    public int clear(String pattern) {
        return cache == null ? 0 : cache.invalidate(pattern);
    }
}
