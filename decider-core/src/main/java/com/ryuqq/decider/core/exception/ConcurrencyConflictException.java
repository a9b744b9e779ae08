package com.ryuqq.decider.core.exception;

import com.ryuqq.decider.core.model.AggregateKey;

/**
 * 낙관적 동시성 검사 실패.
 *
 * <p>decide 도중 다른 쓰기 주체가 같은 키에 먼저 기록한 경우 발생합니다:</p>
 * <ul>
 *   <li>스냅샷 Runtime: 읽은 ETag와 저장소의 ETag가 다름</li>
 *   <li>이벤트 소싱 Runtime: 읽은 스트림 버전과 저장소의 스트림 버전이 다름</li>
 * </ul>
 *
 * <p>재시도로 복구 가능한 상황입니다. 호출자는 상태를 다시 읽고 decide를 다시 수행해야 하며,
 * Runtime은 스스로 재시도하지 않습니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class ConcurrencyConflictException extends RuntimeException {

    private final AggregateKey key;
    private final String expected;
    private final String actual;

    /**
     * 생성자.
     *
     * @param key 충돌이 발생한 Aggregate 키
     * @param expected 호출자가 읽었던 토큰 (ETag 또는 스트림 버전)
     * @param actual 쓰기 시점에 저장소에 있던 토큰
     */
    public ConcurrencyConflictException(AggregateKey key, Object expected, Object actual) {
        super(String.format("Concurrency conflict on %s (expected: %s, actual: %s)", key, expected, actual));
        this.key = key;
        this.expected = String.valueOf(expected);
        this.actual = String.valueOf(actual);
    }

    /**
     * 충돌이 발생한 Aggregate 키.
     *
     * @return Aggregate 키
     */
    public AggregateKey getKey() {
        return key;
    }

    /**
     * 호출자가 읽었던 토큰의 문자열 표현.
     *
     * @return 기대 토큰
     */
    public String getExpected() {
        return expected;
    }

    /**
     * 쓰기 시점에 저장소에 있던 토큰의 문자열 표현.
     *
     * @return 실제 토큰
     */
    public String getActual() {
        return actual;
    }
}
