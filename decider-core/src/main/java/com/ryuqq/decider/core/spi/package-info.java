/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the collaborators the runtimes consume. Infrastructure adapters
 * provide concrete implementations; the core never assumes a specific backend.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.spi.Container} - One snapshot per key with conditional writes</li>
 *   <li>{@link com.ryuqq.decider.core.spi.EventStore} - Versioned append-only event streams</li>
 *   <li>{@link com.ryuqq.decider.core.spi.StateCodec} - State text serialization, supplied per decider</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., decider-adapter-inmemory) provide implementations of Container and
 * EventStore. Adapters can verify themselves against the abstract contract tests in
 * decider-testkit.</p>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Hexagonal Architecture:</strong> Core defines interfaces, adapters provide implementations</li>
 *   <li><strong>Optimistic Concurrency:</strong> Writes are conditional on a token read earlier, never on locks</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.spi;
