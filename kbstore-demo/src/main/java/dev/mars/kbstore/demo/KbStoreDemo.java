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
package dev.mars.kbstore.demo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.mars.kbstore.cache.CacheStats;
import dev.mars.kbstore.cache.ContextLoader;
import dev.mars.kbstore.record.KnowledgeUpdater;
import dev.mars.kbstore.record.RecordResult;
import dev.mars.kbstore.storage.FileRecordStore;
import dev.mars.kbstore.storage.KbStoreConfig;
import dev.mars.kbstore.storage.OperationLogEntry;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

/**
 * Demo and maintenance entry point for the knowledge-base store.
 * <p>
 * Without a flag it records a sample bug, shows the recent operation log and
 * prints cache statistics after warming. Flags run a single operation:
 * <ul>
 *   <li>{@code --warm} - preload the core documents and report the cache size</li>
 *   <li>{@code --stats} - print cache statistics</li>
 *   <li>{@code --clear} - drop every cache entry</li>
 *   <li>{@code --update} - record a sample bug</li>
 * </ul>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link KbStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (base directory only)</li>
 *   <li>System properties: {@code -Dkbstore.baseDir=/path -Dkbstore.cacheMaxSize=200 ...}</li>
 *   <li>Environment variables: {@code KBSTORE_BASE_DIR, KBSTORE_CACHE_MAX_SIZE, ...}</li>
 *   <li>Properties file: {@code kbstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * # Build the demo JAR
 * mvn package -pl kbstore-demo -am
 *
 * # Run against ./.project-ai
 * java -jar kbstore-demo/target/kbstore-demo-1.0-SNAPSHOT.jar
 *
 * # Warm the cache of another knowledge base
 * java -jar kbstore-demo/target/kbstore-demo-1.0-SNAPSHOT.jar /path/to/project/.project-ai --warm
 * </pre>
 */
public class KbStoreDemo {

    public static void main(String[] args) {
        List<String> flags = Arrays.stream(args).filter(a -> a.startsWith("--")).toList();
        List<String> positional = Arrays.stream(args).filter(a -> !a.startsWith("--")).toList();

        KbStoreConfig config = !positional.isEmpty() && !positional.get(0).isBlank()
                ? KbStoreConfig.builder().baseDir(positional.get(0)).build()
                : KbStoreConfig.load();

        System.out.println("+---------------------------------------+");
        System.out.println("|        Knowledge Base Store Demo      |");
        System.out.println("+---------------------------------------+");
        System.out.println();
        System.out.println("Configuration: " + config);
        System.out.println();

        ContextLoader loader = new ContextLoader(config);

        if (flags.contains("--warm")) {
            int size = loader.warm();
            System.out.println("[OK] Cache warmed with " + size + " files");
        } else if (flags.contains("--stats")) {
            loader.stats().ifPresent(KbStoreDemo::printStats);
        } else if (flags.contains("--clear")) {
            int removed = loader.clear("*");
            System.out.println("[OK] Cache cleared (" + removed + " entries)");
        } else if (flags.contains("--update")) {
            recordSampleBug(config);
        } else if (!flags.isEmpty()) {
            System.err.println("Unknown option(s): " + flags);
            System.err.println("Usage: KbStoreDemo [baseDir] [--warm|--stats|--clear|--update]");
            System.exit(1);
        } else {
            FileRecordStore store = recordSampleBug(config);

            List<OperationLogEntry> recent = store.operationLog()
                    .map(log -> log.recent(5))
                    .orElse(List.of());
            System.out.println("\n  Recent operations:");
            for (OperationLogEntry entry : recent) {
                System.out.printf("    %s %-6s %s%n", entry.timestamp(), entry.operation().wireName(), entry.filePath());
            }

            loader.warm();
            loader.loadMinimal();
            loader.loadMinimal();
            loader.stats().ifPresent(KbStoreDemo::printStats);

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see the log grow.       |");
            System.out.println("+---------------------------------------+");
        }
    }

    private static FileRecordStore recordSampleBug(KbStoreConfig config) {
        FileRecordStore store = new FileRecordStore(config);
        try {
            Files.createDirectories(config.baseDir());
        } catch (IOException e) {
            System.err.println("Cannot create " + config.baseDir() + ": " + e.getMessage());
            System.exit(1);
        }

        ObjectNode bug = new ObjectMapper().createObjectNode();
        bug.put("title", "Cache served stale profile");
        bug.put("description", "Profile edits were not visible until restart");
        bug.put("severity", "high");
        bug.putArray("tags").add("cache").add("core");

        RecordResult result = new KnowledgeUpdater(config.baseDir(), store).recordBug(bug);
        System.out.println(result.written()
                ? "[OK] Recorded " + result.id()
                : "[FAILED] " + result.id() + ": " + result.message());
        return store;
    }

    private static void printStats(CacheStats stats) {
        System.out.println("\n  Cache statistics:");
        System.out.printf("    Size:           %d/%d%n", stats.size(), stats.maxSize());
        System.out.printf("    Hit rate:       %.1f%%%n", stats.hitRate());
        System.out.printf("    Hits:           %d%n", stats.hits());
        System.out.printf("    Misses:         %d%n", stats.misses());
        System.out.printf("    Invalidations:  %d%n", stats.invalidations());
        System.out.printf("    Evictions:      %d%n", stats.evictions());
        System.out.printf("    Total requests: %d%n", stats.totalRequests());
    }
}
