/**
 * Core value objects.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.decider.core.model.AggregateKey} - Identifies one aggregate instance in a Container or EventStore</li>
 *   <li>{@link com.ryuqq.decider.core.model.ETag} - Opaque snapshot version token</li>
 *   <li>{@link com.ryuqq.decider.core.model.ExpectedVersion} - Optimistic append token (NO_STREAM or exact version)</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are immutable (final fields)</li>
 *   <li><strong>Validation:</strong> Constructor validation ensures data integrity</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.model;
