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
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.NonWritableChannelException;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;

/**
 * Acquires exclusive, advisory, per-path file locks with a bounded wait.
 * <p>
 * <b>Acquisition:</b> a busy-poll loop. Each attempt is non-blocking; on contention
 * the caller sleeps for the poll interval and retries until the timeout elapses,
 * then {@link LockTimeoutException} is thrown. Waiters are not queued, so any of
 * them may win when the lock is released.
 * <p>
 * <b>Two layers:</b> OS file locks are held on behalf of the whole JVM, so two
 * threads of one process cannot exclude each other with them alone. Each
 * canonical path therefore also has a single in-process permit that must be held
 * before the OS lock is attempted. Contention on either layer is handled the same
 * way. The permit is a {@link Semaphore}, which makes the lock non-reentrant: a
 * thread that asks again for a path it already holds waits until its timeout.
 * <p>
 * <b>Release:</b> the returned {@link LockedFile} releases everything on close, and
 * every failure path inside {@link #withLock} releases what was taken so far.
 *
 * <pre>{@code
 * try (LockedFile file = locks.withLock(path, LockMode.READ_WRITE, Duration.ofSeconds(10))) {
 *     String json = file.readString();
 *     file.overwrite(modify(json));
 * }
 * }</pre>
 */
public final class FileLocks {

    private static final Logger LOG = LoggerFactory.getLogger(FileLocks.class);

    /** Default sleep between attempts */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    /**
     * In-process permits, one per canonical path, shared by every instance in the JVM.
     * An entry lives while at least one thread holds or waits for its permit and is
     * removed by the last one to leave, so the map only holds paths in use. Users are
     * counted inside {@code compute}, which serializes them per key, so a path never
     * has two live permits.
     */
    private static final Map<Path, PathPermit> PERMITS = new ConcurrentHashMap<>();

    private final Duration pollInterval;

    public FileLocks() {
        this(DEFAULT_POLL_INTERVAL);
    }

    /**
     * @param pollInterval sleep between lock attempts; must be positive
     */
    public FileLocks(Duration pollInterval) {
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + pollInterval);
        }
        this.pollInterval = pollInterval;
    }

    /** Sleep between lock attempts. */
    public Duration pollInterval() {
        return pollInterval;
    }

    /**
     * Opens {@code path} in the given mode and acquires an exclusive lock on it.
     * <p>
     * Parent directories are created if missing. Write-intent modes create the
     * file when it does not exist; {@link LockMode#READ} fails immediately with
     * {@link RecordNotFoundException} instead, without retrying.
     *
     * @param path    the file to lock
     * @param mode    access intent
     * @param timeout how long to keep retrying under contention
     * @return an open handle; close it to release the lock
     * @throws RecordNotFoundException if the mode requires an existing file and there is none
     * @throws LockTimeoutException    if the lock is still contended after {@code timeout}
     * @throws KbStoreException        on I/O failure or interruption
     */
    public LockedFile withLock(Path path, LockMode mode, Duration timeout) {
        Path target = path.toAbsolutePath().normalize();
        Path key = prepare(target, mode);
        PathPermit permit = enter(key);

        long start = System.nanoTime();
        long timeoutNanos = timeout.toNanos();
        boolean permitHeld = false;
        FileChannel channel = null;
        boolean created = false;
        int attempts = 0;

        try {
            while (true) {
                attempts++;
                if (!permitHeld) {
                    permitHeld = permit.semaphore.tryAcquire();
                }
                if (permitHeld) {
                    // Opened only while holding the permit: closing a second descriptor
                    // would drop the holder's POSIX lock on the same file
                    if (channel == null) {
                        channel = mode.requiresExisting() ? null : createNew(target, mode);
                        created = channel != null;
                        if (channel == null) {
                            channel = open(target, mode);
                        }
                    }
                    FileLock lock = tryLock(channel, target);
                    if (lock != null) {
                        if (mode.truncateOnAcquire()) {
                            channel.truncate(0);
                        }
                        LOG.debug("Lock acquired: {} ({}{}) after {} attempt(s)",
                                target, mode, created ? ", created" : "", attempts);
                        return new LockedFile(target, mode, channel, lock, () -> leave(key, permit, true), created);
                    }
                }

                if (System.nanoTime() - start > timeoutNanos) {
                    LOG.debug("Lock timeout on {} after {} attempt(s)", target, attempts);
                    throw new LockTimeoutException(target, timeout);
                }
                LOG.trace("Lock on {} is busy, retrying in {} ms", target, pollInterval.toMillis());
                Thread.sleep(pollInterval.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            release(channel, key, permit, permitHeld, target);
            throw new KbStoreException("Interrupted while waiting for lock on " + target, e);
        } catch (IOException e) {
            release(channel, key, permit, permitHeld, target);
            throw new KbStoreException("Failed to lock " + target, e);
        } catch (RuntimeException e) {
            release(channel, key, permit, permitHeld, target);
            throw e;
        }
    }

    /**
     * Creates parent directories and checks existence for modes that need it.
     *
     * @return the canonical key of the target, which need not exist yet
     */
    private static Path prepare(Path target, LockMode mode) {
        try {
            Path parent = target.getParent();
            if (parent == null) {
                return target;
            }
            Files.createDirectories(parent);
            if (mode.requiresExisting() && !Files.exists(target)) {
                throw new RecordNotFoundException(target);
            }
            return parent.toRealPath().resolve(target.getFileName());
        } catch (IOException e) {
            throw new KbStoreException("Cannot prepare " + target + " for " + mode, e);
        }
    }

    /**
     * Creates and opens the file if it does not exist yet.
     *
     * @return the channel, or null if the file already exists
     */
    private static FileChannel createNew(Path target, LockMode mode) {
        try {
            return FileChannel.open(target, mode.createNewOptions());
        } catch (FileAlreadyExistsException e) {
            return null;
        } catch (IOException e) {
            throw new KbStoreException("Failed to create " + target + " for " + mode, e);
        }
    }

    private static FileChannel open(Path target, LockMode mode) {
        try {
            return FileChannel.open(target, mode.openOptions());
        } catch (NoSuchFileException e) {
            throw new RecordNotFoundException(target, e);
        } catch (AccessDeniedException e) {
            if (mode.requiresExisting()) {
                LOG.debug("{} is write-protected, opening it read-only", target);
                return openReadOnly(target);
            }
            throw new KbStoreException("Failed to open " + target + " for " + mode, e);
        } catch (IOException e) {
            throw new KbStoreException("Failed to open " + target + " for " + mode, e);
        }
    }

    private static FileChannel openReadOnly(Path target) {
        try {
            return FileChannel.open(target, StandardOpenOption.READ);
        } catch (NoSuchFileException e) {
            throw new RecordNotFoundException(target, e);
        } catch (IOException e) {
            throw new KbStoreException("Failed to open " + target + " for reading", e);
        }
    }

    /**
     * One non-blocking attempt at the OS lock.
     *
     * @return the lock, or null if another holder has it
     */
    private static FileLock tryLock(FileChannel channel, Path target) throws IOException {
        try {
            return attemptLock(channel);
        } catch (OverlappingFileLockException e) {
            // Another channel in this JVM holds it outside the permits, e.g. one file
            // reached through links that canonicalize differently
            LOG.trace("Overlapping lock within this JVM on {}", target);
            return null;
        }
    }

    /**
     * Exclusive on a writable channel. A read-only channel, which only a write-protected
     * file in {@link LockMode#READ} gets, takes a shared lock: writers cannot open that
     * file, and the permit already excludes other threads of this JVM.
     */
    private static FileLock attemptLock(FileChannel channel) throws IOException {
        try {
            return channel.tryLock();
        } catch (NonWritableChannelException e) {
            return channel.tryLock(0L, Long.MAX_VALUE, true);
        }
    }

    private static void release(FileChannel channel, Path key, PathPermit permit, boolean permitHeld, Path target) {
        closeQuietly(channel, target);
        leave(key, permit, permitHeld);
    }

    private static PathPermit enter(Path key) {
        return PERMITS.compute(key, (k, existing) -> {
            PathPermit permit = existing != null ? existing : new PathPermit();
            permit.users++;
            return permit;
        });
    }

    private static void leave(Path key, PathPermit permit, boolean permitHeld) {
        if (permitHeld) {
            permit.semaphore.release();
        }
        PERMITS.computeIfPresent(key, (k, existing) -> --existing.users == 0 ? null : existing);
    }

    /** Number of paths currently held or waited on in this JVM */
    static int trackedPaths() {
        return PERMITS.size();
    }

    /** A single-permit semaphore plus the number of threads holding or waiting for it */
    private static final class PathPermit {
        final Semaphore semaphore = new Semaphore(1);
        /** Guarded by the map's per-key {@code compute} */
        int users;
    }

    private static void closeQuietly(FileChannel channel, Path target) {
        if (channel == null) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            LOG.warn("Could not close channel for {}: {}", target, e.getMessage());
        }
    }
}
