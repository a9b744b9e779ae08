/**
 * Error types shared by runtimes and storage adapters.
 *
 * <p>{@link com.ryuqq.decider.core.exception.ConcurrencyConflictException} is the only
 * recoverable failure of a decide call. Invalid input is reported with
 * {@link java.lang.IllegalArgumentException} and is never retried.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.core.exception;
