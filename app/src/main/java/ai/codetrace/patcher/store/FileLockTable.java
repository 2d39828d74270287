package ai.codetrace.patcher.store;

import java.nio.file.Path;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per source file. Owned by a {@link TransformationStore} instance and shared with the
 * components that write the same files, so unrelated files never contend.
 */
public final class FileLockTable {

    private final ConcurrentMap<Path, ReentrantLock> locks = new ConcurrentHashMap<>();

    public ReentrantLock lockFor(Path file) {
        return locks.computeIfAbsent(file.toAbsolutePath().normalize(), key -> new ReentrantLock());
    }

    public <T> T withLock(Path file, Supplier<T> action) {
        ReentrantLock lock = lockFor(file);
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    int size() {
        return locks.size();
    }
}
