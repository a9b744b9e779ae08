package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.application.runtime.DeciderRuntime;
import com.ryuqq.decider.core.contract.Decider;
import com.ryuqq.decider.core.contract.Fold;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * In-Memory Runtime 구현체.
 *
 * <p>프로세스 내에 하나의 상태 값을 보관하고, decide 호출마다 그 상태에 이벤트를 접어 넣습니다.
 * 영속화하지 않으므로 프로세스 재시작 시 상태가 사라집니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>events = decider.decide(command, 현재 상태)</li>
 *   <li>현재 상태 = Fold.fold(decider, 현재 상태, events)</li>
 *   <li>events 반환</li>
 * </ol>
 *
 * <p>decide는 synchronized로 실행되어 같은 인스턴스에 대한 호출이 서로의 결과를 덮어쓰지 않습니다.</p>
 *
 * @param <C> Command 타입
 * @param <E> Event 타입
 * @param <S> State 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class InMemoryRuntime<C, E, S> implements DeciderRuntime<C, E, S> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRuntime.class);

    private final Decider<C, E, S> decider;
    private S state;

    /**
     * 생성자 (decider의 초기 상태에서 시작).
     *
     * @param decider 실행할 Decider
     * @throws IllegalArgumentException decider가 null인 경우
     */
    public InMemoryRuntime(Decider<C, E, S> decider) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        this.decider = decider;
        this.state = decider.initialState();
    }

    @Override
    public synchronized List<E> decide(C command) {
        List<E> events = decider.decide(command, state);
        state = Fold.fold(decider, state, events);
        log.debug("Decided {} event(s) in memory for {}", events.size(), decider);
        return events;
    }

    @Override
    public synchronized S state() {
        return state;
    }

    @Override
    public Decider<C, E, S> decider() {
        return decider;
    }

    @Override
    public String toString() {
        return "InMemoryRuntime(" + decider + ")";
    }
}
