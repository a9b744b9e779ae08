package com.ryuqq.decider.testkit.fixture;

/**
 * 전구 Event.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface BulbEvent permits BulbEvent.Fitted, BulbEvent.SwitchedOn, BulbEvent.SwitchedOff, BulbEvent.Blew {

    /**
     * 전구가 장착됨.
     *
     * @param maxUses 남은 사용 횟수
     */
    record Fitted(int maxUses) implements BulbEvent {
    }

    record SwitchedOn() implements BulbEvent {
    }

    record SwitchedOff() implements BulbEvent {
    }

    /**
     * 전구가 끊어짐.
     */
    record Blew() implements BulbEvent {
    }
}
