package com.ryuqq.decider.adapter.runner.retry;

/**
 * ConflictRetrier 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 시도를 포함한 최대 시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs: 첫 재시도 전 대기 시간 (기본 10ms)</li>
 *   <li>maxDelayMs: 재시도 대기 시간 상한 (기본 1000ms)</li>
 *   <li>jitterFactor: Jitter 비율 0.0 ~ 1.0 (기본 0.1)</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 * @param maxAttempts 최대 시도 횟수 (1 이상이어야 함)
 * @param baseDelayMs 기본 지연 시간 (밀리초, 양수여야 함)
 * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record ConflictRetryConfig(
    int maxAttempts,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=3, baseDelayMs=10ms, maxDelayMs=1000ms, jitterFactor=0.1</p>
     */
    public ConflictRetryConfig() {
        this(3, 10, 1000, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ConflictRetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withMaxAttempts(int maxAttempts) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * baseDelayMs만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withBaseDelayMs(long baseDelayMs) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withMaxDelayMs(long maxDelayMs) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * jitterFactor만 변경한 새 인스턴스 생성.
     */
    public ConflictRetryConfig withJitterFactor(double jitterFactor) {
        return new ConflictRetryConfig(maxAttempts, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 연속 충돌 횟수에 따른 재시도 대기 시간 (Jitter 제외).
     *
     * <p>첫 충돌 이후 baseDelayMs에서 시작해 충돌이 반복될 때마다 두 배가 되며,
     * maxDelayMs에 도달하면 더 늘어나지 않습니다.</p>
     *
     * @param conflictCount 지금까지 연속으로 발생한 충돌 횟수 (1 이상)
     * @return 대기 시간 (밀리초, baseDelayMs ~ maxDelayMs)
     * @throws IllegalArgumentException conflictCount가 1 미만인 경우
     */
    public long retryDelayMs(int conflictCount) {
        if (conflictCount < 1) {
            throw new IllegalArgumentException(
                "conflictCount must be at least 1 (current: " + conflictCount + ")"
            );
        }

        long delay = baseDelayMs;
        for (int i = 1; i < conflictCount && delay < maxDelayMs; i++) {
            // 두 배가 상한을 넘으면 상한에서 멈춤 (long overflow 없음)
            delay = delay > maxDelayMs / 2 ? maxDelayMs : delay * 2;
        }
        return delay;
    }

    /**
     * Jitter를 더한 재시도 대기 시간.
     *
     * <p>같은 버전을 읽은 writer들이 동시에 다시 충돌하지 않도록 대기 시간을 흩뜨립니다.
     * 결과는 maxDelayMs를 넘지 않습니다.</p>
     *
     * @param conflictCount 지금까지 연속으로 발생한 충돌 횟수 (1 이상)
     * @param unitRandom [0.0, 1.0) 범위의 난수
     * @return 대기 시간 (밀리초)
     */
    public long jitteredRetryDelayMs(int conflictCount, double unitRandom) {
        long delay = retryDelayMs(conflictCount);
        long spread = (long) (delay * jitterFactor * unitRandom);
        return delay + Math.min(spread, maxDelayMs - delay);
    }
}
