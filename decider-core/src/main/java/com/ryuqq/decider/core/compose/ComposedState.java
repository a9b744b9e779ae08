package com.ryuqq.decider.core.compose;

/**
 * 합성된 Decider의 결합 상태.
 *
 * <p>두 가지 형태 중 하나입니다:</p>
 * <ul>
 *   <li>{@link CombinedInitial}: 아직 어떤 이벤트도 라우팅되지 않은 상태 (양쪽 초기 상태 보관)</li>
 *   <li>{@link Pair}: 이벤트가 한 번 이상 라우팅된 이후의 (StateX, StateY) 쌍</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> 어느 형태든 양쪽 하위 상태를 모두 보관하므로,
 * 들어오는 Command/Event가 어느 쪽 상태에 적용되어야 하는지 항상 결정할 수 있습니다.</p>
 *
 * @param <SX> X 측 State 타입
 * @param <SY> Y 측 State 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface ComposedState<SX, SY> permits ComposedState.CombinedInitial, ComposedState.Pair {

    /**
     * X 측 하위 상태.
     *
     * @return X 측 상태
     */
    SX stateX();

    /**
     * Y 측 하위 상태.
     *
     * @return Y 측 상태
     */
    SY stateY();

    /**
     * X 측 상태만 교체한 Pair 생성 (Y 측은 그대로 유지).
     *
     * @param nextX 새 X 측 상태
     * @return 새 Pair
     */
    default Pair<SX, SY> withStateX(SX nextX) {
        return new Pair<>(nextX, stateY());
    }

    /**
     * Y 측 상태만 교체한 Pair 생성 (X 측은 그대로 유지).
     *
     * @param nextY 새 Y 측 상태
     * @return 새 Pair
     */
    default Pair<SX, SY> withStateY(SY nextY) {
        return new Pair<>(stateX(), nextY);
    }

    /**
     * 이벤트가 라우팅되기 전의 결합 초기 상태.
     *
     * @param stateX X 측 초기 상태
     * @param stateY Y 측 초기 상태
     * @param <SX> X 측 State 타입
     * @param <SY> Y 측 State 타입
     */
    record CombinedInitial<SX, SY>(SX stateX, SY stateY) implements ComposedState<SX, SY> {

        public CombinedInitial {
            if (stateX == null) {
                throw new IllegalArgumentException("stateX cannot be null");
            }
            if (stateY == null) {
                throw new IllegalArgumentException("stateY cannot be null");
            }
        }
    }

    /**
     * 이벤트가 한 번 이상 라우팅된 이후의 상태 쌍.
     *
     * @param stateX X 측 상태
     * @param stateY Y 측 상태
     * @param <SX> X 측 State 타입
     * @param <SY> Y 측 State 타입
     */
    record Pair<SX, SY>(SX stateX, SY stateY) implements ComposedState<SX, SY> {

        public Pair {
            if (stateX == null) {
                throw new IllegalArgumentException("stateX cannot be null");
            }
            if (stateY == null) {
                throw new IllegalArgumentException("stateY cannot be null");
            }
        }
    }
}
