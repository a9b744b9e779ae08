/**
 * Contract Tests for storage SPI implementations.
 *
 * <p>Abstract JUnit 5 test classes that any {@link com.ryuqq.decider.core.spi.Container} or
 * {@link com.ryuqq.decider.core.spi.EventStore} adapter extends to prove it honours the
 * conditional-write contracts the runtimes rely on.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.testkit.contract;
