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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ContentFingerprintTest {

    @TempDir
    Path tempDir;

    @Test
    void fingerprintIsEightLowercaseHexDigits() throws Exception {
        Path file = tempDir.resolve("a.json");
        Files.writeString(file, "{\"a\": 1}");

        assertTrue(ContentFingerprint.of(file).matches("[0-9a-f]{8}"));
    }

    @Test
    void fileAndBytesAgree() throws Exception {
        Path file = tempDir.resolve("a.json");
        String content = "{\"a\": 1}\n".repeat(5000);
        Files.writeString(file, content);

        assertEquals(ContentFingerprint.of(content.getBytes(StandardCharsets.UTF_8)), ContentFingerprint.of(file));
    }

    @Test
    void differentContentDifferentFingerprint() {
        assertNotEquals(ContentFingerprint.of("{\"a\": 1}".getBytes(StandardCharsets.UTF_8)),
                ContentFingerprint.of("{\"a\": 2}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void unreadableFileYieldsEmptyFingerprint() {
        assertEquals(ContentFingerprint.UNREADABLE, ContentFingerprint.of(tempDir.resolve("missing.json")));
    }
}
