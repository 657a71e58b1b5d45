package com.sourcemanager.core.store;

import com.sourcemanager.core.io.DocumentIoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes read-modify-write cycles on region documents.
 * <p>
 * Two layers are held for the whole cycle: a {@link ReentrantLock} per document
 * path, shared by every store instance in this JVM, then an advisory
 * {@link FileLock} on {@code <document>.lock} for other processes. Both
 * acquisitions give up after the configured timeout.
 */
class RegionLocks {

    private static final Logger log = LoggerFactory.getLogger(RegionLocks.class);

    private static final long FILE_LOCK_POLL_MS = 25;

    @FunctionalInterface
    interface LockedCall<T> {
        T call() throws IOException;
    }

    private static final ConcurrentHashMap<Path, ReentrantLock> LOCKS = new ConcurrentHashMap<>();
    private final Duration timeout;

    RegionLocks(Duration timeout) {
        this.timeout = timeout;
    }

    <T> T withLock(String region, Path document, LockedCall<T> call) throws IOException {
        ReentrantLock lock = LOCKS.computeIfAbsent(document.toAbsolutePath().normalize(), p -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentIoException(document, "Interrupted waiting for region lock '" + region + "'", e);
        }
        if (!acquired) {
            throw new DocumentIoException(document,
                    "Timed out after " + timeout.toMillis() + "ms waiting for region lock '" + region + "'");
        }
        try {
            Path lockFile = document.resolveSibling(document.getFileName() + ".lock");
            Files.createDirectories(lockFile.toAbsolutePath().getParent());
            try (FileChannel channel = FileChannel.open(lockFile,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = acquireFileLock(channel, lockFile)) {
                return call.call();
            }
        } finally {
            lock.unlock();
        }
    }

    private FileLock acquireFileLock(FileChannel channel, Path lockFile) throws IOException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            try {
                FileLock fileLock = channel.tryLock();
                if (fileLock != null) {
                    return fileLock;
                }
            } catch (OverlappingFileLockException e) {
                log.trace("File lock {} held by another channel in this JVM", lockFile);
            }
            if (System.nanoTime() >= deadline) {
                throw new DocumentIoException(lockFile,
                        "Timed out after " + timeout.toMillis() + "ms waiting for file lock " + lockFile);
            }
            try {
                Thread.sleep(FILE_LOCK_POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new DocumentIoException(lockFile, "Interrupted waiting for file lock " + lockFile, e);
            }
        }
    }
}
