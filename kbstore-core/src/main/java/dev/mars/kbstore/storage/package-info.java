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
/**
 * Record storage layer: lock-protected JSON files.
 * <p>
 * This package provides the persistence primitives shared by every knowledge-base writer:
 * <ul>
 *   <li>{@link dev.mars.kbstore.storage.FileLocks} - Exclusive per-path locks with bounded polling wait</li>
 *   <li>{@link dev.mars.kbstore.storage.RecordStore} - Safe read, write and read-modify-write of JSON documents</li>
 *   <li>{@link dev.mars.kbstore.storage.OperationLog} - Best-effort diagnostic trail of mutations</li>
 *   <li>{@link dev.mars.kbstore.storage.KbStoreConfig} - Layered configuration</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>One lock per logical operation:</b> parse, modify and write happen under a single exclusive lock</li>
 *   <li><b>Fail open:</b> reads fall back to defaults and writes report {@code false} rather than throwing</li>
 *   <li><b>Best effort:</b> writes are in place and not crash-safe</li>
 * </ul>
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * .project-ai/
 *  ├─ core/              // profile, tech stack, conventions
 *  ├─ indexed/           // modules, architecture, _checksums.json
 *  ├─ history/           // bugs, requirements, decisions
 *  └─ transaction.log    // operation log, one JSON object per line
 * </pre>
 *
 * @see dev.mars.kbstore.storage.RecordStore
 */
package dev.mars.kbstore.storage;
