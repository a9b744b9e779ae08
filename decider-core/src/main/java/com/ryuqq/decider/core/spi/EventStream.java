package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.ExpectedVersion;

import java.util.List;

/**
 * Events of one aggregate as loaded from an {@link EventStore}.
 *
 * <p>{@code version} is the number of events ever appended to the stream and is the
 * optimistic concurrency token. {@code exists} tells an absent stream apart from a stream
 * whose version happens to be zero.</p>
 *
 * @param events the events in append order (immutable copy)
 * @param version the stream version (0 or greater)
 * @param exists whether the stream has been created
 * @param <E> event type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record EventStream<E>(List<E> events, long version, boolean exists) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if events is null or version is negative
     */
    public EventStream {
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        events = List.copyOf(events);
    }

    /**
     * Stream for a key that has never been appended to.
     *
     * @param <E> event type
     * @return empty stream, version 0, not existing
     */
    public static <E> EventStream<E> empty() {
        return new EventStream<>(List.of(), 0, false);
    }

    /**
     * Existing stream whose version equals its event count.
     *
     * @param events the events in append order
     * @param <E> event type
     * @return existing stream
     */
    public static <E> EventStream<E> of(List<E> events) {
        return new EventStream<>(events, events.size(), true);
    }

    /**
     * The token to pass to {@link EventStore#appendToStream} after deciding on this stream.
     *
     * @return NO_STREAM for an absent stream, otherwise the exact version
     */
    public ExpectedVersion expectedVersion() {
        return exists ? ExpectedVersion.exactly(version) : ExpectedVersion.noStream();
    }
}
