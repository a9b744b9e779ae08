package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.exception.ConcurrencyConflictException;
import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.model.ExpectedVersion;

import java.util.List;

/**
 * Append-only event stream storage SPI used by the event-sourcing runtime.
 *
 * <p><strong>Optimistic Append:</strong></p>
 * <pre>
 * 1. loadStream(key)                           → {events, version, exists}
 * 2. caller folds events, decides new events
 * 3. appendToStream(key, expectedVersion, new) → appended, version += new.size()
 *    (fails if another writer appended in between)
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>The version check and the append are one atomic step per key</li>
 *   <li>Version is monotonically non-decreasing and tied to the persisted event count</li>
 *   <li>Appending an empty list validates the expected version but does not create a stream</li>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 * </ul>
 *
 * @param <E> event type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface EventStore<E> {

    /**
     * Loads the full stream for a key.
     *
     * @param key the aggregate key
     * @return the stream, or {@link EventStream#empty()} if none exists
     * @throws IllegalArgumentException if key is null
     */
    EventStream<E> loadStream(AggregateKey key);

    /**
     * Appends events if the stream is still at the expected version.
     *
     * @param key the aggregate key
     * @param expectedVersion the version read before deciding
     * @param events the events to append, in order
     * @throws IllegalArgumentException if any argument is null
     * @throws ConcurrencyConflictException if the persisted stream no longer matches expectedVersion
     */
    void appendToStream(AggregateKey key, ExpectedVersion expectedVersion, List<? extends E> events);
}
