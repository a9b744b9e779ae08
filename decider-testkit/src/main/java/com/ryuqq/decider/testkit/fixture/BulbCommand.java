package com.ryuqq.decider.testkit.fixture;

/**
 * 전구 Command.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface BulbCommand permits BulbCommand.Fit, BulbCommand.SwitchOn, BulbCommand.SwitchOff {

    /**
     * 전구 장착.
     *
     * @param maxUses 전구가 끊어지기 전까지 켤 수 있는 횟수 (0 이상)
     */
    record Fit(int maxUses) implements BulbCommand {

        public Fit {
            if (maxUses < 0) {
                throw new IllegalArgumentException("maxUses must be non-negative (current: " + maxUses + ")");
            }
        }
    }

    /**
     * 전구 켜기.
     */
    record SwitchOn() implements BulbCommand {
    }

    /**
     * 전구 끄기.
     */
    record SwitchOff() implements BulbCommand {
    }
}
