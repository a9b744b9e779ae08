/**
 * Decider contract package.
 *
 * <p>This package defines the pure state machine contract every aggregate implements:</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.contract.Decider} - initialState / isTerminal / decide / evolve</li>
 *   <li>{@link com.ryuqq.decider.core.contract.Fold} - Left-to-right replay of events through evolve</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Purity:</strong> decide and evolve perform no I/O and mutate no shared state</li>
 *   <li><strong>Single reconstruction path:</strong> Every runtime rebuilds state through Fold</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.contract;
