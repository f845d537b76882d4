package io.penguin.metrics.agent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The authoritative set of live collectors, keyed by {@code segment/id}. All access is under one lock.
 */
public class CollectorTable {

    private final Map<String, ManagedCollector> collectors = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @return {@code false} if the key is already taken
     */
    public boolean putIfAbsent(ManagedCollector collector) {
        lock.lock();
        try {
            if (collectors.containsKey(collector.key())) {
                return false;
            }
            collectors.put(collector.key(), collector);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ManagedCollector> remove(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(collectors.remove(key));
        } finally {
            lock.unlock();
        }
    }

    public Optional<ManagedCollector> get(String key) {
        lock.lock();
        try {
            return Optional.ofNullable(collectors.get(key));
        } finally {
            lock.unlock();
        }
    }

    public List<ManagedCollector> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(collectors.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return collectors.size();
        } finally {
            lock.unlock();
        }
    }
}
