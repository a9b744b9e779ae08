package com.ryuqq.decider.core.contract;

import java.util.function.BiFunction;

/**
 * 이벤트 시퀀스를 상태로 접는 (fold) 유틸리티.
 *
 * <p>시작 상태에서 출발하여 이벤트를 왼쪽에서 오른쪽 순서로 하나씩 evolve에 적용합니다.
 * 모든 Runtime의 상태 재구성은 이 클래스를 통해서만 이루어집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>이벤트를 건너뛰지 않음</li>
 *   <li>순서 보존 (순서가 바뀌면 결과도 바뀔 수 있음)</li>
 *   <li>동일 입력 → 동일 결과</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class Fold {

    // Utility class - prevent instantiation
    private Fold() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * evolve 함수로 이벤트를 순서대로 접음.
     *
     * @param evolve 상태 전이 함수
     * @param initial 시작 상태
     * @param events 적용할 이벤트 (순서대로)
     * @param <S> State 타입
     * @param <E> Event 타입
     * @return 모든 이벤트가 적용된 상태 (이벤트가 없으면 initial 그대로)
     * @throws IllegalArgumentException evolve 또는 events가 null인 경우
     */
    public static <S, E> S fold(BiFunction<S, ? super E, S> evolve, S initial, Iterable<? extends E> events) {
        if (evolve == null) {
            throw new IllegalArgumentException("evolve cannot be null");
        }
        if (events == null) {
            throw new IllegalArgumentException("events cannot be null");
        }

        S state = initial;
        for (E event : events) {
            state = evolve.apply(state, event);
        }
        return state;
    }

    /**
     * Decider의 evolve로 이벤트를 순서대로 접음.
     *
     * @param decider 상태 전이를 제공하는 Decider
     * @param initial 시작 상태
     * @param events 적용할 이벤트 (순서대로)
     * @param <E> Event 타입
     * @param <S> State 타입
     * @return 모든 이벤트가 적용된 상태
     * @throws IllegalArgumentException decider 또는 events가 null인 경우
     */
    public static <E, S> S fold(Decider<?, E, S> decider, S initial, Iterable<? extends E> events) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        return fold(decider::evolve, initial, events);
    }
}
