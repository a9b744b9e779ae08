package com.ryuqq.decider.testkit.fixture;

import com.ryuqq.decider.core.spi.StateCodec;

/**
 * 고양이 상태 텍스트 코덱. 형식: {@code awake} | {@code asleep}
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class CatStateCodec implements StateCodec<CatState> {

    @Override
    public String serialize(CatState state) {
        if (state instanceof CatState.Awake) {
            return "awake";
        }
        if (state instanceof CatState.Asleep) {
            return "asleep";
        }
        throw new IllegalArgumentException("Unknown state: " + state);
    }

    @Override
    public CatState deserialize(String text) {
        if ("awake".equals(text)) {
            return new CatState.Awake();
        }
        if ("asleep".equals(text)) {
            return new CatState.Asleep();
        }
        throw new IllegalArgumentException("Unknown state: " + text);
    }
}
