package com.ryuqq.decider.core.compose;

import com.ryuqq.decider.core.contract.Decider;

import java.util.ArrayList;
import java.util.List;

/**
 * 서로 독립적인 두 Decider를 하나로 합성한 Decider.
 *
 * <p>Command와 Event는 {@link Either}로 태그되어 소유 측 Decider로 라우팅되고,
 * 상태는 양쪽 하위 상태를 모두 담은 {@link ComposedState}로 표현됩니다.</p>
 *
 * <p><strong>라우팅 규칙:</strong></p>
 * <ul>
 *   <li>Left Command → X.decide(command, stateX), 결과 이벤트는 Left로 태그</li>
 *   <li>Right Command → Y.decide(command, stateY), 결과 이벤트는 Right로 태그</li>
 *   <li>Left Event → X.evolve(현재 stateX, event), stateY는 그대로</li>
 *   <li>Right Event → Y.evolve(현재 stateY, event), stateX는 그대로</li>
 * </ul>
 *
 * <p><strong>불변식:</strong> evolve는 항상 인자로 받은 결합 상태에 담긴 <em>현재</em> 하위 상태에
 * 이벤트를 반영합니다. 초기 상태에서 다시 시작하면 해당 측의 이력이 사라집니다.</p>
 *
 * <p><strong>종료 정책:</strong> 양쪽 하위 상태가 모두 종료 상태일 때만 종료 상태입니다.
 * 한쪽이라도 종료되지 않았다면 그쪽은 여전히 새 Command를 받을 수 있기 때문입니다.</p>
 *
 * <p><strong>중첩:</strong> {@code Deciders.compose(x, Deciders.compose(y, z))}처럼 중첩할 수 있습니다.</p>
 *
 * @param <CX> X 측 Command 타입
 * @param <EX> X 측 Event 타입
 * @param <SX> X 측 State 타입
 * @param <CY> Y 측 Command 타입
 * @param <EY> Y 측 Event 타입
 * @param <SY> Y 측 State 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class ComposedDecider<CX, EX, SX, CY, EY, SY>
        implements Decider<Either<CX, CY>, Either<EX, EY>, ComposedState<SX, SY>> {

    private final Decider<CX, EX, SX> deciderX;
    private final Decider<CY, EY, SY> deciderY;

    /**
     * 생성자.
     *
     * @param deciderX X 측 Decider
     * @param deciderY Y 측 Decider
     * @throws IllegalArgumentException 어느 한쪽이라도 null인 경우
     */
    public ComposedDecider(Decider<CX, EX, SX> deciderX, Decider<CY, EY, SY> deciderY) {
        if (deciderX == null) {
            throw new IllegalArgumentException("deciderX cannot be null");
        }
        if (deciderY == null) {
            throw new IllegalArgumentException("deciderY cannot be null");
        }
        this.deciderX = deciderX;
        this.deciderY = deciderY;
    }

    @Override
    public ComposedState<SX, SY> initialState() {
        return new ComposedState.CombinedInitial<>(deciderX.initialState(), deciderY.initialState());
    }

    @Override
    public boolean isTerminal(ComposedState<SX, SY> state) {
        requireState(state);
        return deciderX.isTerminal(state.stateX()) && deciderY.isTerminal(state.stateY());
    }

    @Override
    public List<Either<EX, EY>> decide(Either<CX, CY> command, ComposedState<SX, SY> state) {
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        requireState(state);

        return command.fold(
            commandX -> tagLeft(deciderX.decide(commandX, state.stateX())),
            commandY -> tagRight(deciderY.decide(commandY, state.stateY()))
        );
    }

    @Override
    public ComposedState<SX, SY> evolve(ComposedState<SX, SY> state, Either<EX, EY> event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        requireState(state);

        return event.fold(
            eventX -> state.withStateX(deciderX.evolve(state.stateX(), eventX)),
            eventY -> state.withStateY(deciderY.evolve(state.stateY(), eventY))
        );
    }

    private static void requireState(ComposedState<?, ?> state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
    }

    private List<Either<EX, EY>> tagLeft(List<EX> events) {
        List<Either<EX, EY>> tagged = new ArrayList<>(events.size());
        for (EX event : events) {
            tagged.add(Either.left(event));
        }
        return List.copyOf(tagged);
    }

    private List<Either<EX, EY>> tagRight(List<EY> events) {
        List<Either<EX, EY>> tagged = new ArrayList<>(events.size());
        for (EY event : events) {
            tagged.add(Either.right(event));
        }
        return List.copyOf(tagged);
    }

    @Override
    public String toString() {
        return "ComposedDecider(" + deciderX + ", " + deciderY + ")";
    }
}
