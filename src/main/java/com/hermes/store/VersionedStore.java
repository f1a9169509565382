package com.hermes.store;

import java.util.List;
import java.util.Optional;

/**
 * Durable keyed records with single-record conditional writes. Every mutation is
 * either create-if-absent or compare-and-set on the version last read; there are
 * no multi-record transactions.
 * <p>
 * Versions are never reused for a key, not even after a delete and re-create, so a
 * compare-and-set against a version read before the delete always fails.
 */
public interface VersionedStore<T> {

    Optional<Versioned<T>> get(String key);

    /** Creates the record at a fresh version. Returns false if one already exists. */
    boolean putIfAbsent(String key, T value);

    /** Replaces the record only if it is still at {@code expectedVersion}. */
    boolean replace(String key, long expectedVersion, T value);

    /** Deletes the record only if it is still at {@code expectedVersion}. */
    boolean delete(String key, long expectedVersion);

    List<Versioned<T>> scan();
}
