/**
 * Demo deciders used as test fixtures.
 *
 * <p>Bulb (fit / switch on / switch off, blows after its last use) and Cat (awake / asleep),
 * with text codecs for the state-snapshot runtime.</p>
 *
 * @since 1.0.0
 * @author Decider Team
 */
package com.ryuqq.decider.testkit.fixture;
