package com.workgraph.core.index;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-node locks. Writers lock only the ids they touch, always in ascending id order,
 * so two writers on disjoint nodes never wait for each other and overlapping writers
 * cannot deadlock.
 */
public class NodeLockTable {

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(Collection<String> ids, Supplier<T> action) {
        List<ReentrantLock> held = new ArrayList<>();
        try {
            for (String id : new TreeSet<>(ids)) {
                ReentrantLock lock = locks.computeIfAbsent(id, k -> new ReentrantLock());
                lock.lock();
                held.add(lock);
            }
            return action.get();
        } finally {
            for (int i = held.size() - 1; i >= 0; i--) {
                held.get(i).unlock();
            }
        }
    }

    public void runWithLocks(Collection<String> ids, Runnable action) {
        withLocks(ids, () -> {
            action.run();
            return null;
        });
    }

    int size() {
        return locks.size();
    }
}
