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

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

/**
 * Configuration for the knowledge-base record store and its cache.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dkbstore.baseDir=/path})</li>
 *   <li>Environment variables (e.g., {@code KBSTORE_BASE_DIR})</li>
 *   <li>Properties file ({@code kbstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>baseDir</td><td>kbstore.baseDir</td><td>KBSTORE_BASE_DIR</td><td>.project-ai</td></tr>
 *   <tr><td>lockTimeoutSeconds</td><td>kbstore.lockTimeoutSeconds</td><td>KBSTORE_LOCK_TIMEOUT_SECONDS</td><td>10</td></tr>
 *   <tr><td>readTimeoutSeconds</td><td>kbstore.readTimeoutSeconds</td><td>KBSTORE_READ_TIMEOUT_SECONDS</td><td>5</td></tr>
 *   <tr><td>lockPollMillis</td><td>kbstore.lockPollMillis</td><td>KBSTORE_LOCK_POLL_MILLIS</td><td>100</td></tr>
 *   <tr><td>operationLogEnabled</td><td>kbstore.operationLogEnabled</td><td>KBSTORE_OPERATION_LOG_ENABLED</td><td>true</td></tr>
 *   <tr><td>operationLogFile</td><td>kbstore.operationLogFile</td><td>KBSTORE_OPERATION_LOG_FILE</td><td>transaction.log</td></tr>
 *   <tr><td>cacheMaxSize</td><td>kbstore.cacheMaxSize</td><td>KBSTORE_CACHE_MAX_SIZE</td><td>100</td></tr>
 *   <tr><td>coreTtlSeconds</td><td>kbstore.coreTtlSeconds</td><td>KBSTORE_CORE_TTL_SECONDS</td><td>3600</td></tr>
 *   <tr><td>indexedTtlSeconds</td><td>kbstore.indexedTtlSeconds</td><td>KBSTORE_INDEXED_TTL_SECONDS</td><td>1800</td></tr>
 *   <tr><td>historyTtlSeconds</td><td>kbstore.historyTtlSeconds</td><td>KBSTORE_HISTORY_TTL_SECONDS</td><td>0</td></tr>
 * </table>
 * A relative {@code operationLogFile} is resolved against {@code baseDir}.
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # kbstore.properties
 * kbstore.baseDir=/work/my-project/.project-ai
 * kbstore.lockTimeoutSeconds=10
 * kbstore.cacheMaxSize=200
 * kbstore.indexedTtlSeconds=900
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * KbStoreConfig config = KbStoreConfig.builder()
 *     .baseDir(Path.of("/work/my-project/.project-ai"))
 *     .operationLogEnabled(false)
 *     .build();
 *
 * RecordStore store = new FileRecordStore(config);
 * </pre>
 */
public final class KbStoreConfig {

    private static final String PROPERTIES_FILE = "kbstore.properties";

    // Property keys
    private static final String PROP_BASE_DIR = "kbstore.baseDir";
    private static final String PROP_LOCK_TIMEOUT = "kbstore.lockTimeoutSeconds";
    private static final String PROP_READ_TIMEOUT = "kbstore.readTimeoutSeconds";
    private static final String PROP_LOCK_POLL = "kbstore.lockPollMillis";
    private static final String PROP_OPLOG_ENABLED = "kbstore.operationLogEnabled";
    private static final String PROP_OPLOG_FILE = "kbstore.operationLogFile";
    private static final String PROP_CACHE_MAX_SIZE = "kbstore.cacheMaxSize";
    private static final String PROP_CORE_TTL = "kbstore.coreTtlSeconds";
    private static final String PROP_INDEXED_TTL = "kbstore.indexedTtlSeconds";
    private static final String PROP_HISTORY_TTL = "kbstore.historyTtlSeconds";

    // Environment variable keys
    private static final String ENV_BASE_DIR = "KBSTORE_BASE_DIR";
    private static final String ENV_LOCK_TIMEOUT = "KBSTORE_LOCK_TIMEOUT_SECONDS";
    private static final String ENV_READ_TIMEOUT = "KBSTORE_READ_TIMEOUT_SECONDS";
    private static final String ENV_LOCK_POLL = "KBSTORE_LOCK_POLL_MILLIS";
    private static final String ENV_OPLOG_ENABLED = "KBSTORE_OPERATION_LOG_ENABLED";
    private static final String ENV_OPLOG_FILE = "KBSTORE_OPERATION_LOG_FILE";
    private static final String ENV_CACHE_MAX_SIZE = "KBSTORE_CACHE_MAX_SIZE";
    private static final String ENV_CORE_TTL = "KBSTORE_CORE_TTL_SECONDS";
    private static final String ENV_INDEXED_TTL = "KBSTORE_INDEXED_TTL_SECONDS";
    private static final String ENV_HISTORY_TTL = "KBSTORE_HISTORY_TTL_SECONDS";

    // Defaults
    private static final Path DEFAULT_BASE_DIR = Path.of(".project-ai");
    private static final int DEFAULT_LOCK_TIMEOUT_SECONDS = 10;
    private static final int DEFAULT_READ_TIMEOUT_SECONDS = 5;
    private static final int DEFAULT_LOCK_POLL_MILLIS = 100;
    private static final boolean DEFAULT_OPLOG_ENABLED = true;
    private static final Path DEFAULT_OPLOG_FILE = Path.of("transaction.log");
    private static final int DEFAULT_CACHE_MAX_SIZE = 100;
    private static final int DEFAULT_CORE_TTL_SECONDS = 3600;
    private static final int DEFAULT_INDEXED_TTL_SECONDS = 1800;
    private static final int DEFAULT_HISTORY_TTL_SECONDS = 0;

    private final Path baseDir;
    private final int lockTimeoutSeconds;
    private final int readTimeoutSeconds;
    private final int lockPollMillis;
    private final boolean operationLogEnabled;
    private final Path operationLogFile;
    private final int cacheMaxSize;
    private final int coreTtlSeconds;
    private final int indexedTtlSeconds;
    private final int historyTtlSeconds;

    private KbStoreConfig(Builder builder) {
        this.baseDir = builder.baseDir;
        this.lockTimeoutSeconds = builder.lockTimeoutSeconds;
        this.readTimeoutSeconds = builder.readTimeoutSeconds;
        this.lockPollMillis = builder.lockPollMillis;
        this.operationLogEnabled = builder.operationLogEnabled;
        this.operationLogFile = builder.operationLogFile;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.coreTtlSeconds = builder.coreTtlSeconds;
        this.indexedTtlSeconds = builder.indexedTtlSeconds;
        this.historyTtlSeconds = builder.historyTtlSeconds;
    }

    /** Knowledge-base root directory. */
    public Path baseDir() {
        return baseDir;
    }

    /** Lock timeout for read-modify-write updates. */
    public Duration lockTimeout() {
        return Duration.ofSeconds(lockTimeoutSeconds);
    }

    /** Lock timeout for plain reads and writes. */
    public Duration readTimeout() {
        return Duration.ofSeconds(readTimeoutSeconds);
    }

    /** Sleep between lock attempts. */
    public Duration lockPollInterval() {
        return Duration.ofMillis(lockPollMillis);
    }

    /** Whether completed operations are appended to the operation log. */
    public boolean operationLogEnabled() {
        return operationLogEnabled;
    }

    /** Operation log location, resolved against {@link #baseDir()} when relative. */
    public Path operationLogFile() {
        return operationLogFile.isAbsolute() ? operationLogFile : baseDir.resolve(operationLogFile);
    }

    /** Maximum number of cached documents. */
    public int cacheMaxSize() {
        return cacheMaxSize;
    }

    /** Base TTL for the core category. */
    public Duration coreTtl() {
        return Duration.ofSeconds(coreTtlSeconds);
    }

    /** Base TTL for the indexed category. */
    public Duration indexedTtl() {
        return Duration.ofSeconds(indexedTtlSeconds);
    }

    /** Base TTL for the history category (zero disables caching). */
    public Duration historyTtl() {
        return Duration.ofSeconds(historyTtlSeconds);
    }

    @Override
    public String toString() {
        return "KbStoreConfig{" +
                "baseDir=" + baseDir +
                ", lockTimeoutSeconds=" + lockTimeoutSeconds +
                ", readTimeoutSeconds=" + readTimeoutSeconds +
                ", lockPollMillis=" + lockPollMillis +
                ", operationLogEnabled=" + operationLogEnabled +
                ", operationLogFile=" + operationLogFile +
                ", cacheMaxSize=" + cacheMaxSize +
                ", coreTtlSeconds=" + coreTtlSeconds +
                ", indexedTtlSeconds=" + indexedTtlSeconds +
                ", historyTtlSeconds=" + historyTtlSeconds +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code KbStoreConfig.builder().build()}.
     */
    public static KbStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link KbStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path baseDir;
        private Integer lockTimeoutSeconds;
        private Integer readTimeoutSeconds;
        private Integer lockPollMillis;
        private Boolean operationLogEnabled;
        private Path operationLogFile;
        private Integer cacheMaxSize;
        private Integer coreTtlSeconds;
        private Integer indexedTtlSeconds;
        private Integer historyTtlSeconds;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the knowledge-base root directory. */
        public Builder baseDir(Path baseDir) {
            this.baseDir = baseDir;
            return this;
        }

        /** Sets the knowledge-base root directory from a string path. */
        public Builder baseDir(String baseDir) {
            this.baseDir = Path.of(baseDir);
            return this;
        }

        /** Sets the update lock timeout in seconds (default: 10). */
        public Builder lockTimeoutSeconds(int lockTimeoutSeconds) {
            this.lockTimeoutSeconds = lockTimeoutSeconds;
            return this;
        }

        /** Sets the read/write lock timeout in seconds (default: 5). */
        public Builder readTimeoutSeconds(int readTimeoutSeconds) {
            this.readTimeoutSeconds = readTimeoutSeconds;
            return this;
        }

        /** Sets the lock poll interval in milliseconds (default: 100). */
        public Builder lockPollMillis(int lockPollMillis) {
            this.lockPollMillis = lockPollMillis;
            return this;
        }

        /** Enables or disables the operation log (default: true). */
        public Builder operationLogEnabled(boolean operationLogEnabled) {
            this.operationLogEnabled = operationLogEnabled;
            return this;
        }

        /** Sets the operation log file (default: transaction.log under baseDir). */
        public Builder operationLogFile(Path operationLogFile) {
            this.operationLogFile = operationLogFile;
            return this;
        }

        /** Sets the maximum number of cached documents (default: 100). */
        public Builder cacheMaxSize(int cacheMaxSize) {
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        /** Sets the core category base TTL in seconds (default: 3600). */
        public Builder coreTtlSeconds(int coreTtlSeconds) {
            this.coreTtlSeconds = coreTtlSeconds;
            return this;
        }

        /** Sets the indexed category base TTL in seconds (default: 1800). */
        public Builder indexedTtlSeconds(int indexedTtlSeconds) {
            this.indexedTtlSeconds = indexedTtlSeconds;
            return this;
        }

        /** Sets the history category base TTL in seconds (default: 0, never cached). */
        public Builder historyTtlSeconds(int historyTtlSeconds) {
            this.historyTtlSeconds = historyTtlSeconds;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a resolved value is out of range
         */
        public KbStoreConfig build() {
            if (baseDir == null) {
                baseDir = resolvePath(PROP_BASE_DIR, ENV_BASE_DIR, DEFAULT_BASE_DIR);
            }
            if (lockTimeoutSeconds == null) {
                lockTimeoutSeconds = resolveInt(PROP_LOCK_TIMEOUT, ENV_LOCK_TIMEOUT, DEFAULT_LOCK_TIMEOUT_SECONDS);
            }
            if (readTimeoutSeconds == null) {
                readTimeoutSeconds = resolveInt(PROP_READ_TIMEOUT, ENV_READ_TIMEOUT, DEFAULT_READ_TIMEOUT_SECONDS);
            }
            if (lockPollMillis == null) {
                lockPollMillis = resolveInt(PROP_LOCK_POLL, ENV_LOCK_POLL, DEFAULT_LOCK_POLL_MILLIS);
            }
            if (operationLogEnabled == null) {
                operationLogEnabled = resolveBoolean(PROP_OPLOG_ENABLED, ENV_OPLOG_ENABLED, DEFAULT_OPLOG_ENABLED);
            }
            if (operationLogFile == null) {
                operationLogFile = resolvePath(PROP_OPLOG_FILE, ENV_OPLOG_FILE, DEFAULT_OPLOG_FILE);
            }
            if (cacheMaxSize == null) {
                cacheMaxSize = resolveInt(PROP_CACHE_MAX_SIZE, ENV_CACHE_MAX_SIZE, DEFAULT_CACHE_MAX_SIZE);
            }
            if (coreTtlSeconds == null) {
                coreTtlSeconds = resolveInt(PROP_CORE_TTL, ENV_CORE_TTL, DEFAULT_CORE_TTL_SECONDS);
            }
            if (indexedTtlSeconds == null) {
                indexedTtlSeconds = resolveInt(PROP_INDEXED_TTL, ENV_INDEXED_TTL, DEFAULT_INDEXED_TTL_SECONDS);
            }
            if (historyTtlSeconds == null) {
                historyTtlSeconds = resolveInt(PROP_HISTORY_TTL, ENV_HISTORY_TTL, DEFAULT_HISTORY_TTL_SECONDS);
            }

            requireNonNegative("lockTimeoutSeconds", lockTimeoutSeconds);
            requireNonNegative("readTimeoutSeconds", readTimeoutSeconds);
            requireNonNegative("coreTtlSeconds", coreTtlSeconds);
            requireNonNegative("indexedTtlSeconds", indexedTtlSeconds);
            requireNonNegative("historyTtlSeconds", historyTtlSeconds);
            if (lockPollMillis <= 0) {
                throw new IllegalArgumentException("lockPollMillis must be positive: " + lockPollMillis);
            }
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be positive: " + cacheMaxSize);
            }

            return new KbStoreConfig(this);
        }

        private static void requireNonNegative(String name, int value) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must not be negative: " + value);
            }
        }

        /** First non-blank value from system property, environment, then properties file. */
        private String lookup(String sysProp, String envVar) {
            String value = System.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            value = System.getenv(envVar);
            if (value != null && !value.isBlank()) {
                return value;
            }
            value = fileProperties.getProperty(sysProp);
            if (value != null && !value.isBlank()) {
                return value;
            }
            return null;
        }

        private Path resolvePath(String sysProp, String envVar, Path defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Path.of(value.trim()) : defaultValue;
        }

        private boolean resolveBoolean(String sysProp, String envVar, boolean defaultValue) {
            String value = lookup(sysProp, envVar);
            return value != null ? Boolean.parseBoolean(value.trim()) : defaultValue;
        }

        private int resolveInt(String sysProp, String envVar, int defaultValue) {
            // Each source is tried in turn so a malformed value falls through to the next one
            for (String value : new String[] {
                    System.getProperty(sysProp), System.getenv(envVar), fileProperties.getProperty(sysProp)}) {
                if (value != null && !value.isBlank()) {
                    try {
                        return Integer.parseInt(value.trim());
                    } catch (NumberFormatException ignored) {}
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = KbStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException ignored) {}

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException ignored) {}
            }

            return props;
        }
    }
}
