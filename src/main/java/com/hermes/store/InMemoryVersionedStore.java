package com.hermes.store;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

public class InMemoryVersionedStore<T> implements VersionedStore<T> {

    private final ConcurrentMap<String, Versioned<T>> records = new ConcurrentHashMap<>();
    // one counter for every key, so a record deleted and created again never repeats a version
    private final AtomicLong versions = new AtomicLong();

    @Override
    public Optional<Versioned<T>> get(String key) {
        return Optional.ofNullable(records.get(key));
    }

    @Override
    public boolean putIfAbsent(String key, T value) {
        return records.putIfAbsent(key, new Versioned<>(key, value, versions.incrementAndGet())) == null;
    }

    @Override
    public boolean replace(String key, long expectedVersion, T value) {
        var current = records.get(key);
        if (current == null || current.version() != expectedVersion) return false;
        // every write takes a fresh version, so an equality-based replace() acts as a CAS on it
        return records.replace(key, current, new Versioned<>(key, value, versions.incrementAndGet()));
    }

    @Override
    public boolean delete(String key, long expectedVersion) {
        var current = records.get(key);
        if (current == null || current.version() != expectedVersion) return false;
        return records.remove(key, current);
    }

    @Override
    public List<Versioned<T>> scan() {
        return records.values().stream()
                .sorted(Comparator.comparing(Versioned::key))
                .toList();
    }
}
