/**
 * Runtime implementations package.
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.decider.adapter.runner.InMemoryRuntime}: one live state per process</li>
 *   <li>{@link com.ryuqq.decider.adapter.runner.StateSnapshotRuntime}: snapshot + etag compare-and-set</li>
 *   <li>{@link com.ryuqq.decider.adapter.runner.EventSourcingRuntime}: stream replay + expected-version append</li>
 * </ul>
 *
 * <p>All runtimes implement {@link com.ryuqq.decider.application.runtime.DeciderRuntime}
 * and rebuild state exclusively through {@link com.ryuqq.decider.core.contract.Fold}.</p>
 *
 * @see com.ryuqq.decider.core.spi.Container
 * @see com.ryuqq.decider.core.spi.EventStore
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.adapter.runner;
