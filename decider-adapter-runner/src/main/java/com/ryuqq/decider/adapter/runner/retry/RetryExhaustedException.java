package com.ryuqq.decider.adapter.runner.retry;

import com.ryuqq.decider.core.exception.ConcurrencyConflictException;

/**
 * 설정된 최대 시도 횟수 안에 충돌 없이 decide를 완료하지 못한 경우.
 *
 * <p>원인({@link #getCause()})은 마지막으로 발생한 {@link ConcurrencyConflictException}입니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public class RetryExhaustedException extends RuntimeException {

    private final int attempts;

    public RetryExhaustedException(int attempts, ConcurrencyConflictException lastConflict) {
        super("Gave up after " + attempts + " attempt(s): " + lastConflict.getMessage(), lastConflict);
        this.attempts = attempts;
    }

    /**
     * 수행한 시도 횟수.
     *
     * @return 시도 횟수
     */
    public int getAttempts() {
        return attempts;
    }
}
