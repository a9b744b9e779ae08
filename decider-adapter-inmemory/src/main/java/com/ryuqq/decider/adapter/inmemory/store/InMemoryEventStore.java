package com.ryuqq.decider.adapter.inmemory.store;

import com.ryuqq.decider.core.exception.ConcurrencyConflictException;
import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.model.ExpectedVersion;
import com.ryuqq.decider.core.spi.EventStore;
import com.ryuqq.decider.core.spi.EventStream;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link EventStore} SPI for testing and reference purposes.
 *
 * <p>Each stream is an immutable list replaced on append, so a loaded {@link EventStream}
 * is a stable snapshot that later appends do not affect.</p>
 *
 * <p><strong>Invariant:</strong> {@code version == events.size()} for every stored stream.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Version check and append run inside {@link ConcurrentHashMap#compute} (atomic per key)</li>
 *   <li>Appends to different keys do not block each other</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @param <E> event type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class InMemoryEventStore<E> implements EventStore<E> {

    /**
     * Event streams.
     * Key: AggregateKey, Value: immutable list of events in append order
     */
    private final ConcurrentHashMap<AggregateKey, List<E>> streams;

    /**
     * Creates a new InMemoryEventStore with no streams.
     */
    public InMemoryEventStore() {
        this.streams = new ConcurrentHashMap<>();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public EventStream<E> loadStream(AggregateKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        List<E> events = streams.get(key);
        return events == null ? EventStream.empty() : EventStream.of(events);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Empty event lists are version-checked but never create a stream</li>
     *   <li>A rejected append leaves the stream untouched</li>
     * </ul>
     */
    @Override
    public void appendToStream(AggregateKey key, ExpectedVersion expectedVersion, List<? extends E> events) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (expectedVersion == null) {
            throw new IllegalArgumentException("expectedVersion cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }

        List<E> toAppend = List.copyOf(events);
        streams.compute(key, (k, current) -> {
            boolean exists = current != null;
            long currentVersion = exists ? current.size() : 0;
            if (!expectedVersion.matches(exists, currentVersion)) {
                throw new ConcurrencyConflictException(key, expectedVersion,
                    exists ? "version " + currentVersion : "no stream");
            }
            if (toAppend.isEmpty()) {
                return current;
            }
            List<E> next = new ArrayList<>((int) currentVersion + toAppend.size());
            if (exists) {
                next.addAll(current);
            }
            next.addAll(toAppend);
            return List.copyOf(next);
        });
    }

    /**
     * Clears all streams.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        streams.clear();
    }

    /**
     * Returns the number of existing streams.
     *
     * @return the number of streams
     */
    public int size() {
        return streams.size();
    }
}
