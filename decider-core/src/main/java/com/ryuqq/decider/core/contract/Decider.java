package com.ryuqq.decider.core.contract;

import java.util.List;

/**
 * 순수 상태 기계로 표현된 Aggregate 계약.
 *
 * <p>Decider는 Aggregate의 업무 규칙을 두 개의 순수 함수로 표현합니다:</p>
 * <ul>
 *   <li><strong>decide:</strong> (Command, State) → Events</li>
 *   <li><strong>evolve:</strong> (State, Event) → State</li>
 * </ul>
 *
 * <p>상태를 어디에 저장하는지, 동시 접근을 어떻게 제어하는지는 Decider의 관심사가 아닙니다.
 * 모든 부수 효과(I/O, 저장, 동시성 제어)는 Runtime 계층에 있습니다.</p>
 *
 * <p><strong>오류 구분:</strong></p>
 * <ul>
 *   <li>인식할 수 없는 Command/Event: {@link IllegalArgumentException} (재시도 불가)</li>
 *   <li>인식했지만 현재 상태에 적용할 수 없는 Command: 빈 리스트 반환 ("아무 일도 일어나지 않음")</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Decider&lt;BulbCommand, BulbEvent, BulbState&gt; bulb = new BulbDecider();
 *
 * BulbState state = bulb.initialState();
 * List&lt;BulbEvent&gt; events = bulb.decide(new Fit(5), state);
 * state = Fold.fold(bulb, state, events);
 * </pre>
 *
 * @param <C> Command 타입
 * @param <E> Event 타입
 * @param <S> State 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface Decider<C, E, S> {

    /**
     * 이벤트가 하나도 적용되지 않은 초기 상태.
     *
     * <p>호출할 때마다 동일한 값을 반환해야 합니다.</p>
     *
     * @return 초기 상태
     */
    S initialState();

    /**
     * 더 이상 어떤 Command도 새 이벤트를 만들 수 없는 상태인지 확인.
     *
     * <p>조회 용도로만 사용되며, Runtime이 강제하지 않습니다.
     * 종료 상태에서 decide를 호출하면 관례상 빈 리스트를 반환해야 합니다.</p>
     *
     * @param state 확인할 상태
     * @return 종료 상태인 경우 true
     */
    boolean isTerminal(S state);

    /**
     * Command를 현재 상태에 적용하여 발생할 이벤트를 결정.
     *
     * @param command 실행할 명령
     * @param state 현재 상태
     * @return 발생한 이벤트 목록 (적용할 수 없는 경우 빈 리스트, null 불가)
     * @throws IllegalArgumentException 인식할 수 없는 Command인 경우
     */
    List<E> decide(C command, S state);

    /**
     * 이벤트 하나를 상태에 반영.
     *
     * @param state 현재 상태
     * @param event 반영할 이벤트
     * @return 새 상태
     * @throws IllegalArgumentException 인식할 수 없는 Event이거나 현재 상태에 반영할 수 없는 경우
     */
    S evolve(S state, E event);
}
