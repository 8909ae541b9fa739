package com.tabledesigner.service;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * One lock per table name (case-insensitive, like SQLite identifiers). Mutations of the same table
 * run one at a time; different tables proceed in parallel.
 *
 * <p>An entry lives only while some thread holds or waits for it, so names of tables that never
 * existed do not accumulate.
 */
@Component
public class TableLockRegistry {
    private final Map<String, TableLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String tableName, Supplier<T> action) {
        String key = key(tableName);
        TableLock tableLock = acquire(key);
        tableLock.lock.lock();
        try {
            return action.get();
        } finally {
            tableLock.lock.unlock();
            release(key);
        }
    }

    public void runWithLock(String tableName, Runnable action) {
        withLock(tableName, () -> {
            action.run();
            return null;
        });
    }

    boolean isLocked(String tableName) {
        TableLock tableLock = locks.get(key(tableName));
        return tableLock != null && tableLock.lock.isLocked();
    }

    int size() {
        return locks.size();
    }

    // users is only touched inside compute, which runs atomically per key
    private TableLock acquire(String key) {
        return locks.compute(key, (k, existing) -> {
            TableLock tableLock = existing != null ? existing : new TableLock();
            tableLock.users++;
            return tableLock;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, tableLock) -> --tableLock.users == 0 ? null : tableLock);
    }

    private static String key(String tableName) {
        return tableName == null ? "" : tableName.toLowerCase(Locale.ROOT);
    }

    private static final class TableLock {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
