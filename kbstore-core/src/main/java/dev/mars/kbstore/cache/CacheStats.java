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

import java.util.Locale;

/**
 * Snapshot of cache counters. Counters grow monotonically for the life of the cache.
 *
 * @param size          entries currently held
 * @param maxSize       capacity
 * @param hits          validated lookups served from the cache
 * @param misses        lookups not served, including failed validations
 * @param invalidations entries removed by validation failure or {@code invalidate}
 * @param evictions     entries removed to make room
 */
public record CacheStats(int size, int maxSize, long hits, long misses, long invalidations, long evictions) {

    public long totalRequests() {
        return hits + misses;
    }

    /** Hit rate in percent; zero before the first request. */
    public double hitRate() {
        long total = totalRequests();
        return total > 0 ? hits * 100.0 / total : 0.0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "CacheStats{size=%d/%d, hitRate=%.1f%%, hits=%d, misses=%d, invalidations=%d, evictions=%d, totalRequests=%d}",
                size, maxSize, hitRate(), hits, misses, invalidations, evictions, totalRequests());
    }
}
