/**
 * Runtime port package.
 *
 * <p>{@link com.ryuqq.decider.application.runtime.DeciderRuntime} is the single entry point
 * callers use to execute commands against an aggregate, independent of how its state is stored.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.application.runtime;
