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

import dev.mars.kbstore.storage.KbStoreConfig;

import java.time.Duration;

/**
 * Named partition of the cache with its own base TTL.
 */
public enum CacheCategory {

    /** Rarely changing project facts: profile, tech stack, conventions. */
    CORE(Duration.ofHours(1)),

    /** Occasionally changing indexes: modules, architecture. */
    INDEXED(Duration.ofMinutes(30)),

    /** Real-time records; never cached. */
    HISTORY(Duration.ZERO);

    private final Duration defaultTtl;

    CacheCategory(Duration defaultTtl) {
        this.defaultTtl = defaultTtl;
    }

    /** Base TTL used when no configuration overrides it. */
    public Duration defaultTtl() {
        return defaultTtl;
    }

    /** Base TTL for this category from {@code config}. */
    public Duration ttl(KbStoreConfig config) {
        switch (this) {
            case CORE:
                return config.coreTtl();
            case INDEXED:
                return config.indexedTtl();
            default:
                return config.historyTtl();
        }
    }
}
