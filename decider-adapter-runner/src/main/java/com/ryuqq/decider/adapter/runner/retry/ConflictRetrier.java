package com.ryuqq.decider.adapter.runner.retry;

import com.ryuqq.decider.application.runtime.DeciderRuntime;
import com.ryuqq.decider.core.exception.ConcurrencyConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 호출자 측 충돌 재시도 도우미.
 *
 * <p>Runtime은 스스로 재시도하지 않습니다. 재시도를 원하는 호출자는 이 클래스로
 * {@link DeciderRuntime#decide}를 감쌀 수 있습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * for attempt in 1..maxAttempts:
 *   try: return runtime.decide(command)     (매 시도마다 상태를 다시 읽음)
 *   catch ConcurrencyConflictException:
 *     마지막 시도 → RetryExhaustedException
 *     그 외      → sleep(config.jitteredRetryDelayMs(attempt, random)) 후 재시도
 * </pre>
 *
 * <p>충돌 이외의 예외(예: IllegalArgumentException)는 재시도하지 않고 그대로 전파합니다.</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class ConflictRetrier {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetrier.class);

    private final ConflictRetryConfig config;

    /**
     * 기본 설정으로 생성.
     */
    public ConflictRetrier() {
        this(new ConflictRetryConfig());
    }

    /**
     * 생성자.
     *
     * @param config 재시도 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ConflictRetrier(ConflictRetryConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
    }

    /**
     * 충돌 시 재시도하며 Command 실행.
     *
     * @param runtime 실행할 Runtime
     * @param command 실행할 Command
     * @param <C> Command 타입
     * @param <E> Event 타입
     * @return 최종적으로 성공한 시도의 이벤트 목록
     * @throws RetryExhaustedException 모든 시도가 충돌로 실패한 경우
     * @throws IllegalArgumentException runtime이 null이거나 Command가 유효하지 않은 경우
     */
    public <C, E> List<E> decide(DeciderRuntime<C, E, ?> runtime, C command) {
        if (runtime == null) {
            throw new IllegalArgumentException("runtime cannot be null");
        }

        for (int attempt = 1; ; attempt++) {
            try {
                return runtime.decide(command);
            } catch (ConcurrencyConflictException e) {
                if (attempt >= config.maxAttempts()) {
                    log.error("Retry exhausted for {} after {} attempt(s)", e.getKey(), attempt);
                    throw new RetryExhaustedException(attempt, e);
                }
                long delayMs = config.jitteredRetryDelayMs(attempt, ThreadLocalRandom.current().nextDouble());
                log.info("Conflict on {} (attempt {}/{}), retrying in {}ms",
                    e.getKey(), attempt, config.maxAttempts(), delayMs);
                sleep(delayMs);
            }
        }
    }

    /**
     * 설정 조회.
     *
     * @return 재시도 설정
     */
    public ConflictRetryConfig getConfig() {
        return config;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", e);
        }
    }
}
