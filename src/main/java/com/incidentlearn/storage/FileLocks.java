package com.incidentlearn.storage;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Exclusive locks on sidecar lock files, shared by the daemon and the operator CLI.
 *
 * <p>A JVM may hold only one {@link FileLock} per file, so threads of one process queue on a per-path
 * {@link ReentrantLock} first. Nested calls on the same path from the holding thread run without re-locking.
 */
public final class FileLocks {
    private static final Map<Path, ReentrantLock> LOCAL = new ConcurrentHashMap<>();

    private FileLocks() {
    }

    @FunctionalInterface
    public interface IoSupplier<T> {
        T get() throws IOException;
    }

    public static Path lockFileFor(Path dataFile) {
        return dataFile.resolveSibling(dataFile.getFileName() + ".lock");
    }

    public static <T> T withLock(Path lockPath, IoSupplier<T> action) throws IOException {
        Path key = lockPath.toAbsolutePath().normalize();
        ReentrantLock local = LOCAL.computeIfAbsent(key, ignored -> new ReentrantLock());
        local.lock();
        try {
            if (local.getHoldCount() > 1) {
                return action.get();
            }
            if (key.getParent() != null) {
                Files.createDirectories(key.getParent());
            }
            try (FileChannel channel = FileChannel.open(key, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                    FileLock ignored = channel.lock()) {
                return action.get();
            }
        } finally {
            local.unlock();
        }
    }
}
