package com.ryuqq.decider.testkit.fixture;

/**
 * 전구 State.
 *
 * <pre>
 * NotFitted
 *    │ Fitted(n)
 *    ▼
 * Working(OFF, n) ◄──► Working(ON, n-1)
 *    │ Blew (n == 0 에서 켜기)
 *    ▼
 * Blown (종료 상태)
 * </pre>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface BulbState permits BulbState.NotFitted, BulbState.Working, BulbState.Blown {

    /**
     * 전구 스위치 상태.
     */
    enum Status {
        ON,
        OFF
    }

    record NotFitted() implements BulbState {
    }

    /**
     * 사용 가능한 전구.
     *
     * @param status 스위치 상태
     * @param remainingUses 남은 사용 횟수
     */
    record Working(Status status, int remainingUses) implements BulbState {

        public Working {
            if (status == null) {
                throw new IllegalArgumentException("status cannot be null");
            }
        }
    }

    record Blown() implements BulbState {
    }
}
