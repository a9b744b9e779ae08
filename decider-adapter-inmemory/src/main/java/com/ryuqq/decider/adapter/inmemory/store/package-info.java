/**
 * In-memory storage adapter package.
 *
 * <p>This package provides reference implementations of the storage SPIs
 * for testing and educational purposes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.store.InMemoryContainer}:
 *       Thread-safe implementation of {@link com.ryuqq.decider.core.spi.Container}</li>
 *   <li>{@link com.ryuqq.decider.adapter.inmemory.store.InMemoryEventStore}:
 *       Thread-safe implementation of {@link com.ryuqq.decider.core.spi.EventStore}</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.decider.core.spi.Container
 * @see com.ryuqq.decider.core.spi.EventStore
 * @author Decider Team
 * @since 1.0.0
 */
package com.ryuqq.decider.adapter.inmemory.store;
