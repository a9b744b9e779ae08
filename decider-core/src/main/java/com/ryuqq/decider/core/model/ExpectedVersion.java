package com.ryuqq.decider.core.model;

/**
 * 이벤트 스트림 추가(append) 시 기대하는 스트림 버전.
 *
 * <p>두 가지 경우를 구분합니다:</p>
 * <ul>
 *   <li>{@link #noStream()}: 스트림이 아직 존재하지 않아야 함</li>
 *   <li>{@link #exactly(long)}: 스트림이 존재하고 버전이 정확히 n이어야 함</li>
 * </ul>
 *
 * <p>버전 0을 "스트림 없음"의 표식으로 재사용하지 않습니다. 이벤트가 추가되었다가 비워진
 * 스트림처럼 존재하지만 버전이 0인 경우와 충돌하기 때문입니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class ExpectedVersion {

    private static final ExpectedVersion NO_STREAM = new ExpectedVersion(-1L);

    private final long value;

    private ExpectedVersion(long value) {
        this.value = value;
    }

    /**
     * 스트림이 존재하지 않아야 함을 나타내는 기대 버전.
     *
     * @return NO_STREAM 인스턴스
     */
    public static ExpectedVersion noStream() {
        return NO_STREAM;
    }

    /**
     * 스트림 버전이 정확히 version이어야 함을 나타내는 기대 버전.
     *
     * @param version 기대 버전 (0 이상)
     * @return ExpectedVersion 인스턴스
     * @throws IllegalArgumentException version이 음수인 경우
     */
    public static ExpectedVersion exactly(long version) {
        if (version < 0) {
            throw new IllegalArgumentException("version must be non-negative (current: " + version + ")");
        }
        return new ExpectedVersion(version);
    }

    /**
     * 스트림 부재를 기대하는지 확인.
     *
     * @return noStream()인 경우 true
     */
    public boolean isNoStream() {
        return this == NO_STREAM;
    }

    /**
     * 기대 버전 값 조회.
     *
     * @return 기대 버전
     * @throws IllegalStateException noStream()인 경우
     */
    public long getVersion() {
        if (isNoStream()) {
            throw new IllegalStateException("NO_STREAM has no version");
        }
        return value;
    }

    /**
     * 저장소의 현재 스트림 상태가 이 기대 버전과 일치하는지 확인.
     *
     * @param streamExists 스트림 존재 여부
     * @param currentVersion 현재 스트림 버전 (존재하지 않으면 무시)
     * @return 일치하면 true
     */
    public boolean matches(boolean streamExists, long currentVersion) {
        if (isNoStream()) {
            return !streamExists;
        }
        return streamExists && currentVersion == value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExpectedVersion that = (ExpectedVersion) o;
        return value == that.value;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(value);
    }

    @Override
    public String toString() {
        return isNoStream() ? "ExpectedVersion{NO_STREAM}" : "ExpectedVersion{" + value + '}';
    }
}
