package io.github.yok.issuesync.db;

import com.google.common.base.Preconditions;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Exclusive, process-wide lock on the store, backed by a lock file in the metadata directory.
 *
 * <p>
 * Acquisition never waits: when another holder owns the lock, {@link #acquire(Path)} fails with
 * {@link IllegalStateException}. The lock is released by {@link #close()}.
 * </p>
 */
@Slf4j
public final class AccessLock implements AutoCloseable {

    @Getter
    private final Path lockFile;
    private final FileChannel channel;
    private final FileLock lock;

    private AccessLock(Path lockFile, FileChannel channel, FileLock lock) {
        this.lockFile = lockFile;
        this.channel = channel;
        this.lock = lock;
    }

    /**
     * Acquires the lock, creating the lock file and its parent directories when needed.
     *
     * @param lockFile lock file path
     * @return held lock
     * @throws IOException if the lock file cannot be opened
     * @throws IllegalStateException if the lock is already held
     */
    public static AccessLock acquire(Path lockFile) throws IOException {
        Preconditions.checkNotNull(lockFile, "lockFile must not be null");
        Path parent = lockFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE);
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            // held by this JVM
            lock = null;
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        if (lock == null) {
            channel.close();
            throw new IllegalStateException(
                    "Store is locked by another process: " + lockFile.toAbsolutePath());
        }
        log.debug("Access lock acquired: {}", lockFile);
        return new AccessLock(lockFile, channel, lock);
    }

    /**
     * Releases the lock.
     *
     * @throws IOException if the lock or its channel cannot be released
     */
    @Override
    public void close() throws IOException {
        try {
            if (lock.isValid()) {
                lock.release();
            }
        } finally {
            channel.close();
            log.debug("Access lock released: {}", lockFile);
        }
    }
}
