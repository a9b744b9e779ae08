/**
 * Caller-side conflict retry package.
 *
 * <p>Runtimes report optimistic concurrency conflicts and never retry on their own.
 * {@link com.ryuqq.decider.adapter.runner.retry.ConflictRetrier} is an opt-in helper that
 * re-runs a decide call after a doubling, jittered delay computed by
 * {@link com.ryuqq.decider.adapter.runner.retry.ConflictRetryConfig}.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.adapter.runner.retry;
