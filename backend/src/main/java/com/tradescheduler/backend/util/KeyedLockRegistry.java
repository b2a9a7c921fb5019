package com.tradescheduler.backend.util;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion per key. Callers holding different keys never block each
 * other; a lock entry lives only while someone holds or waits for it.
 */
@Component
public class KeyedLockRegistry {

    private final ConcurrentHashMap<String, LockHolder> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String key, Supplier<T> action) {
        LockHolder holder = locks.compute(key, (k, existing) -> {
            LockHolder current = existing != null ? existing : new LockHolder();
            current.users++;
            return current;
        });
        holder.lock.lock();
        try {
            return action.get();
        } finally {
            holder.lock.unlock();
            locks.computeIfPresent(key, (k, current) -> --current.users == 0 ? null : current);
        }
    }

    public void withLock(String key, Runnable action) {
        withLock(key, () -> {
            action.run();
            return null;
        });
    }

    int activeKeys() {
        return locks.size();
    }

    private static final class LockHolder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
