package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.application.runtime.DeciderRuntime;
import com.ryuqq.decider.core.contract.Decider;
import com.ryuqq.decider.core.contract.Fold;
import com.ryuqq.decider.core.exception.ConcurrencyConflictException;
import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.model.ETag;
import com.ryuqq.decider.core.spi.Container;
import com.ryuqq.decider.core.spi.StateCodec;
import com.ryuqq.decider.core.spi.StoredValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 상태 스냅샷 Runtime 구현체.
 *
 * <p>키마다 직렬화된 상태 하나와 ETag를 {@link Container}에 저장하고,
 * ETag 비교(compare-and-set)로 낙관적 동시성 제어를 수행합니다.</p>
 *
 * <p><strong>decide 처리 흐름:</strong></p>
 * <pre>
 * 1. container.get(key)
 *    - 없음 → state = initialState(), readEtag = ETag.generate()
 *    - 있음 → state = codec.deserialize(...), readEtag = 저장된 ETag
 * 2. events = decider.decide(command, state)
 * 3. newState = Fold.fold(decider, state, events)
 * 4. container.compareAndSet(key, readEtag, {serialize(newState), ETag.generate()})
 *    - false → ConcurrencyConflictException (덮어쓰지 않음)
 * </pre>
 *
 * <p><strong>재시도:</strong> 충돌 시 스스로 재시도하지 않습니다. 재시도 정책은 호출자 책임입니다.</p>
 *
 * @param <C> Command 타입
 * @param <E> Event 타입
 * @param <S> State 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class StateSnapshotRuntime<C, E, S> implements DeciderRuntime<C, E, S> {

    private static final Logger log = LoggerFactory.getLogger(StateSnapshotRuntime.class);

    private final Decider<C, E, S> decider;
    private final Container container;
    private final StateCodec<S> codec;
    private final AggregateKey key;

    /**
     * 생성자.
     *
     * @param decider 실행할 Decider
     * @param container 스냅샷 저장소
     * @param codec 상태 직렬화/역직렬화
     * @param key Aggregate 키
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public StateSnapshotRuntime(Decider<C, E, S> decider, Container container, StateCodec<S> codec, AggregateKey key) {
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (container == null) {
            throw new IllegalArgumentException("container cannot be null");
        }
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        this.decider = decider;
        this.container = container;
        this.codec = codec;
        this.key = key;
    }

    @Override
    public List<E> decide(C command) {
        // 1. 스냅샷 로드 (없으면 초기 상태 + 새 ETag)
        Optional<StoredValue> stored = container.get(key);
        S state = stored.map(value -> codec.deserialize(value.serializedState()))
            .orElseGet(decider::initialState);
        ETag readEtag = stored.map(StoredValue::etag)
            .orElseGet(ETag::generate);

        // 2. 이벤트 결정
        List<E> events = decider.decide(command, state);

        // 3. 새 상태 계산
        S newState = Fold.fold(decider, state, events);

        // 4. 조건부 저장
        StoredValue next = new StoredValue(codec.serialize(newState), ETag.generate());
        if (!container.compareAndSet(key, readEtag, next)) {
            ETag actual = container.get(key).map(StoredValue::etag).orElse(null);
            log.warn("Snapshot conflict on {}: read {} but found {}", key, readEtag, actual);
            throw new ConcurrencyConflictException(key, readEtag, actual);
        }

        log.debug("Stored snapshot for {} with {} after {} event(s)", key, next.etag(), events.size());
        return events;
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException 키에 저장된 스냅샷이 없는 경우
     */
    @Override
    public S state() {
        StoredValue stored = container.get(key)
            .orElseThrow(() -> new IllegalStateException("No snapshot stored for " + key));
        return codec.deserialize(stored.serializedState());
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
        return "StateSnapshotRuntime(" + decider + ", " + key + ")";
    }
}
