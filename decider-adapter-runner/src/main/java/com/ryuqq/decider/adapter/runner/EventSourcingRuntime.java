package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.application.runtime.DeciderRuntime;
import com.ryuqq.decider.core.contract.Decider;
import com.ryuqq.decider.core.contract.Fold;
import com.ryuqq.decider.core.exception.ConcurrencyConflictException;
import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.spi.EventStore;
import com.ryuqq.decider.core.spi.EventStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 이벤트 소싱 Runtime 구현체.
 *
 * <p>키마다 버전이 붙은 추가 전용(append-only) 이벤트 스트림을 {@link EventStore}에 저장합니다.
 * 상태는 저장하지 않고, 매번 스트림 전체를 초기 상태에서부터 재생하여 재구성합니다.</p>
 *
 * <p><strong>decide 처리 흐름:</strong></p>
 * <pre>
 * 1. stream = eventStore.loadStream(key)       (없으면 빈 스트림, version 0)
 * 2. state  = Fold.fold(decider, initialState(), stream.events())
 * 3. events = decider.decide(command, state)
 * 4. eventStore.appendToStream(key, stream.expectedVersion(), events)
 *    - 그 사이 다른 쓰기 주체가 추가했다면 ConcurrencyConflictException
 * </pre>
 *
 * <p><strong>한계:</strong> 스냅샷/압축이 없으므로 state() 및 decide()의 비용은 스트림 길이에 비례합니다.</p>
 *
 * @param <C> Command 타입
 * @param <E> Event 타입
 * @param <S> State 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class EventSourcingRuntime<C, E, S> implements DeciderRuntime<C, E, S> {

    private static final Logger log = LoggerFactory.getLogger(EventSourcingRuntime.class);

    private final Decider<C, E, S> decider;
    private final EventStore<E> eventStore;
    private final AggregateKey key;

    /**
     * 생성자.
     *
     * @param decider 실행할 Decider
     * @param eventStore 이벤트 저장소
     * @param key Aggregate 키
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public EventSourcingRuntime(Decider<C, E, S> decider, EventStore<E> eventStore, AggregateKey key) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (eventStore == null) {
            throw new IllegalArgumentException("eventStore cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        this.decider = decider;
        this.eventStore = eventStore;
        this.key = key;
    }

    @Override
    public List<E> decide(C command) {
        // 1. 스트림 로드
        EventStream<E> stream = eventStore.loadStream(key);

        // 2. 상태 재구성
        S state = Fold.fold(decider, decider.initialState(), stream.events());

        // 3. 이벤트 결정
        List<E> events = decider.decide(command, state);

        // 4. 기대 버전 조건부 추가
        try {
            eventStore.appendToStream(key, stream.expectedVersion(), events);
        } catch (ConcurrencyConflictException e) {
            log.warn("Append conflict on {} at {}", key, stream.expectedVersion());
            throw e;
        }

        log.debug("Appended {} event(s) to {}, now at version {}", events.size(), key, stream.version() + events.size());
        return events;
    }

    @Override
    public S state() {
        EventStream<E> stream = eventStore.loadStream(key);
        return Fold.fold(decider, decider.initialState(), stream.events());
    }

    @Override
    public Decider<C, E, S> decider() {
        return decider;
    }

    /**
     * Aggregate 키 조회.
     *
     * @return Aggregate 키
     */
    public AggregateKey getKey() {
        return key;
    }

    @Override
    public String toString() {
        return "EventSourcingRuntime(" + decider + ", " + key + ")";
    }
}
