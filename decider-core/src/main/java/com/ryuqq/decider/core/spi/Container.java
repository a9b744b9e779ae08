package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.model.ETag;

import java.util.Optional;

/**
 * Snapshot storage SPI used by the state-snapshot runtime.
 *
 * <p>Holds at most one {@link StoredValue} per {@link AggregateKey}.</p>
 *
 * <p><strong>Conditional Write Contract:</strong></p>
 * <pre>
 * compareAndSet(key, expected, next):
 *   stored = current value for key
 *   if stored is absent             → write next, return true
 *   if stored.etag == expected      → write next, return true
 *   otherwise                       → leave stored untouched, return false
 * </pre>
 *
 * <p>The check and the write must be atomic per key: of two callers that read the same etag,
 * at most one may succeed.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Per-key atomicity only: no cross-key transactions are required</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface Container {

    /**
     * Reads the current snapshot for a key.
     *
     * @param key the aggregate key
     * @return the stored value, or empty if the key has never been written
     * @throws IllegalArgumentException if key is null
     */
    Optional<StoredValue> get(AggregateKey key);

    /**
     * Writes a snapshot only if the stored etag still equals the expected one.
     *
     * <p>A key that has never been written accepts any expected etag.</p>
     *
     * @param key the aggregate key
     * @param expected the etag the caller read (or generated, for an absent key)
     * @param next the new snapshot, carrying a fresh etag
     * @return true if the value was written, false if another writer got there first
     * @throws IllegalArgumentException if any argument is null
     */
    boolean compareAndSet(AggregateKey key, ETag expected, StoredValue next);
}
