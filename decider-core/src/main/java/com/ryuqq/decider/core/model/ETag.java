package com.ryuqq.decider.core.model;

import java.util.UUID;

/**
 * 저장된 스냅샷의 특정 버전을 가리키는 불투명 토큰.
 *
 * <p>스냅샷 Runtime의 낙관적 동시성 제어에 사용됩니다. 쓰기가 성공할 때마다
 * 새 ETag가 발급되며, 읽은 시점의 ETag와 저장소의 ETag가 다르면 쓰기가 거부됩니다.</p>
 *
 * <p>값의 내부 구조에는 의미가 없으며 동등성 비교에만 사용됩니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class ETag {

    private final String value;

    private ETag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ETag cannot be null or blank");
        }
        this.value = value;
    }

    /**
     * 기존 값으로 ETag 생성 (저장소에서 읽어온 값 복원용).
     *
     * @param value ETag 값
     * @return ETag 인스턴스
     * @throws IllegalArgumentException 값이 null 또는 빈 문자열인 경우
     */
    public static ETag of(String value) {
        return new ETag(value);
    }

    /**
     * 새로운 고유 ETag 생성.
     *
     * <p>{@link UUID#randomUUID()} 기반으로 전역적으로 고유한 값을 생성합니다.</p>
     *
     * @return 새 ETag
     */
    public static ETag generate() {
        return new ETag(UUID.randomUUID().toString());
    }

    /**
     * ETag 값 조회.
     *
     * @return ETag 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ETag eTag = (ETag) o;
        return value.equals(eTag.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ETag{" + value + '}';
    }
}
