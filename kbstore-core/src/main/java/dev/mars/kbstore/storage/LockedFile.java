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

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/**
 * An open file holding an exclusive advisory lock, obtained from
 * {@link FileLocks#withLock(Path, LockMode, java.time.Duration)}.
 * <p>
 * Intended for try-with-resources. {@link #close()} releases the OS lock,
 * closes the channel and frees the in-process permit for the path. Release
 * and close failures are logged, never thrown.
 * <p>
 * Not thread-safe: a handle belongs to the scope that acquired it.
 */
public final class LockedFile implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(LockedFile.class);

    private final Path path;
    private final LockMode mode;
    private final FileChannel channel;
    private final FileLock lock;
    private final Runnable releasePermit;
    private final boolean created;
    private boolean closed = false;

    LockedFile(Path path, LockMode mode, FileChannel channel, FileLock lock, Runnable releasePermit, boolean created) {
        this.path = path;
        this.mode = mode;
        this.channel = channel;
        this.lock = lock;
        this.releasePermit = releasePermit;
        this.created = created;
    }

    /** The locked file. */
    public Path path() {
        return path;
    }

    /** The access intent this handle was opened with. */
    public LockMode mode() {
        return mode;
    }

    /**
     * Whether this acquisition created the file. Decided atomically by the file
     * system, so of several racing acquirers of a missing file exactly one sees true.
     */
    public boolean created() {
        return created;
    }

    /** Whether the handle is still open and the lock held. */
    public boolean isOpen() {
        return !closed && lock.isValid();
    }

    /**
     * Reads the whole file as UTF-8.
     *
     * @throws IOException if the read fails
     */
    public String readString() throws IOException {
        ensureOpen();
        ByteArrayOutputStream out = new ByteArrayOutputStream((int) Math.min(channel.size(), Integer.MAX_VALUE));
        ByteBuffer buf = ByteBuffer.allocate(8192);
        long pos = 0;
        int n;
        while ((n = channel.read(buf, pos)) > 0) {
            out.write(buf.array(), 0, n);
            pos += n;
            buf.clear();
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Replaces the file content. Truncates first, then writes from offset zero.
     * <p>
     * Not crash-safe: there is no temp-file rename and no fsync, so a crash
     * mid-write can leave a partial file.
     *
     * @throws IOException if the write fails
     */
    public void overwrite(String content) throws IOException {
        ensureOpen();
        if (mode == LockMode.READ) {
            throw new IllegalStateException("Handle opened in READ mode: " + path);
        }
        channel.truncate(0);
        writeFully(ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8)), 0);
    }

    /**
     * Appends to the end of the file.
     *
     * @throws IOException if the write fails
     */
    public void append(String content) throws IOException {
        ensureOpen();
        if (mode == LockMode.READ) {
            throw new IllegalStateException("Handle opened in READ mode: " + path);
        }
        writeFully(ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8)), channel.size());
    }

    private void writeFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            pos += channel.write(buf, pos);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Lock already released: " + path);
        }
    }

    /**
     * Releases the lock and closes the file. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock on {}: {}", path, e.getMessage());
        }
        try {
            if (channel.isOpen()) {
                channel.close();
            }
        } catch (IOException e) {
            LOG.warn("Could not close channel for {}: {}", path, e.getMessage());
        }
        releasePermit.run();
        LOG.debug("Lock released: {} ({})", path, mode);
    }
}
