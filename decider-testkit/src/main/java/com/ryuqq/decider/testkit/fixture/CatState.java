package com.ryuqq.decider.testkit.fixture;

/**
 * 고양이 State. 초기 상태는 Awake이며 종료 상태는 없습니다.
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface CatState permits CatState.Awake, CatState.Asleep {

    record Awake() implements CatState {
    }

    record Asleep() implements CatState {
    }
}
