package com.ryuqq.decider.core.model;

/**
 * Aggregate 인스턴스 식별자.
 *
 * <p>Runtime은 decide 호출마다 정확히 하나의 AggregateKey에 해당하는 저장 항목
 * (스냅샷 또는 이벤트 스트림)만 읽고 씁니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class AggregateKey {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private AggregateKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("AggregateKey cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("AggregateKey length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * AggregateKey 생성.
     *
     * @param value 키 값
     * @return AggregateKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static AggregateKey of(String value) {
        return new AggregateKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AggregateKey that = (AggregateKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "AggregateKey{" + value + '}';
    }
}
