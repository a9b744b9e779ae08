/**
 * Decider composition package.
 *
 * <p>Combines two independent deciders into one whose commands and events are tagged
 * with the owning side and whose state carries both sub-states.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.compose.Either} - Left/Right tagged union for commands and events</li>
 *   <li>{@link com.ryuqq.decider.core.compose.ComposedState} - CombinedInitial or Pair of sub-states</li>
 *   <li>{@link com.ryuqq.decider.core.compose.ComposedDecider} - The routing decider</li>
 *   <li>{@link com.ryuqq.decider.core.compose.Deciders} - Factory ({@code compose(x, y)})</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Disjointness by construction:</strong> The tag selects the side, so overlapping types cannot be misrouted</li>
 *   <li><strong>History preservation:</strong> Events fold into the current sub-state, never a re-initialized one</li>
 *   <li><strong>Nesting:</strong> A composed decider is itself a decider and can be composed again</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.compose;
