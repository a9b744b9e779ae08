package com.ryuqq.decider.application.runtime;

import com.ryuqq.decider.core.contract.Decider;

import java.util.List;

/**
 * Decider Runtime.
 *
 * <p>This interface defines how a caller drives one aggregate instance through its
 * {@link Decider}: the runtime loads the current state, asks the decider for events,
 * folds them into the new state and stores the result.</p>
 *
 * <p><strong>Decide Flow:</strong></p>
 * <pre>
 * decide(command)
 *   1. Load state (in memory | snapshot Container | EventStore replay)
 *   2. events = decider.decide(command, state)
 *   3. newState = Fold.fold(decider, state, events)
 *   4. Store (replace | compare-and-set snapshot | append under expected version)
 *   5. Return events
 * </pre>
 *
 * <p><strong>Implementations:</strong></p>
 * <ul>
 *   <li>InMemoryRuntime: one live state value per process, no persistence</li>
 *   <li>StateSnapshotRuntime: serialized snapshot + etag per key</li>
 *   <li>EventSourcingRuntime: versioned event stream per key</li>
 * </ul>
 *
 * <p><strong>Error Handling Strategy:</strong></p>
 * <ul>
 *   <li>Invalid command or event → IllegalArgumentException, nothing stored</li>
 *   <li>Concurrent writer on the same key → ConcurrencyConflictException, nothing stored</li>
 *   <li>Runtimes never retry; reload-and-retry is the caller's decision</li>
 * </ul>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>decide() is a synchronous read-compute-write sequence</li>
 *   <li>Exactly one aggregate key is touched per call</li>
 *   <li>No background work is started</li>
 * </ul>
 *
 * @param <C> command type
 * @param <E> event type
 * @param <S> state type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface DeciderRuntime<C, E, S> {

    /**
     * Executes a command against the current state of the aggregate.
     *
     * <p>Either every decided event is folded and recorded, or nothing is.</p>
     *
     * @param command the command to execute
     * @return the events decided (empty when the command does not apply to the current state)
     * @throws IllegalArgumentException if the decider does not recognize the command
     * @throws com.ryuqq.decider.core.exception.ConcurrencyConflictException if another writer changed the aggregate in between
     */
    List<E> decide(C command);

    /**
     * Returns the current state view of the aggregate.
     *
     * @return the current state
     * @throws IllegalStateException if the runtime has no state to show
     */
    S state();

    /**
     * Returns the decider this runtime drives.
     *
     * @return the decider
     */
    Decider<C, E, S> decider();
}
