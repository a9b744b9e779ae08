package com.ryuqq.decider.adapter.inmemory.store;

import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.model.ETag;
import com.ryuqq.decider.core.spi.Container;
import com.ryuqq.decider.core.spi.StoredValue;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link Container} SPI for testing and reference purposes.
 *
 * <p>Snapshots are kept in a {@link ConcurrentHashMap}; the conditional write runs inside
 * {@link ConcurrentHashMap#compute}, so the etag check and the replacement are atomic per key.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Container container = new InMemoryContainer();
 * AggregateKey key = AggregateKey.of("bulb");
 *
 * ETag read = container.get(key).map(StoredValue::etag).orElseGet(ETag::generate);
 * boolean written = container.compareAndSet(key, read, new StoredValue("not_fitted", ETag.generate()));
 * </pre>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryContainer implements Container {

    /**
     * Snapshot storage.
     * Key: AggregateKey, Value: StoredValue (serialized state + etag)
     */
    private final ConcurrentHashMap<AggregateKey, StoredValue> values;

    /**
     * Creates a new InMemoryContainer with empty storage.
     */
    public InMemoryContainer() {
        this.values = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public Optional<StoredValue> get(AggregateKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return Optional.ofNullable(values.get(key));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Check-and-replace runs inside ConcurrentHashMap.compute (atomic per key)</li>
     *   <li>A rejected write leaves the stored value untouched</li>
     * </ul>
     */
    @Override
    public boolean compareAndSet(AggregateKey key, ETag expected, StoredValue next) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (expected == null) {
            throw new IllegalArgumentException("expected cannot be null");
        }
        if (next == null) {
            throw new IllegalArgumentException("next cannot be null");
        }

        boolean[] written = new boolean[1];
        values.compute(key, (k, current) -> {
            if (current == null || current.etag().equals(expected)) {
                written[0] = true;
                return next;
            }
            return current;
        });
        return written[0];
    }

    /**
     * Clears all stored snapshots.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        values.clear();
    }

    /**
     * Returns the number of stored snapshots.
     *
     * @return the number of keys written at least once
     */
    public int size() {
        return values.size();
    }
}
