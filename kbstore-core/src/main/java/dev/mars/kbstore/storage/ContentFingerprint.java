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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.CRC32C;

/**
 * Short content digest used to detect that a file changed.
 * <p>
 * CRC32C, rendered as 8 lowercase hex digits. This is change detection only,
 * not an integrity or security check.
 */
public final class ContentFingerprint {

    private static final Logger LOG = LoggerFactory.getLogger(ContentFingerprint.class);

    /** Returned when the file cannot be read */
    public static final String UNREADABLE = "";

    private ContentFingerprint() {
    }

    /**
     * Fingerprints the bytes of a file.
     *
     * @return the fingerprint, or {@link #UNREADABLE} if the file cannot be read
     */
    public static String of(Path file) {
        CRC32C crc = new CRC32C();
        byte[] buf = new byte[8192];
        try (InputStream in = Files.newInputStream(file)) {
            int n;
            while ((n = in.read(buf)) > 0) {
                crc.update(buf, 0, n);
            }
        } catch (IOException e) {
            LOG.debug("Cannot fingerprint {}: {}", file, e.getMessage());
            return UNREADABLE;
        }
        return format(crc.getValue());
    }

    /** Fingerprints an in-memory byte array. */
    public static String of(byte[] content) {
        CRC32C crc = new CRC32C();
        crc.update(content, 0, content.length);
        return format(crc.getValue());
    }

    private static String format(long crc) {
        return String.format("%08x", crc);
    }
}
