package com.ryuqq.decider.adapter.runner;

import com.ryuqq.decider.testkit.fixture.BulbCommand;
import com.ryuqq.decider.testkit.fixture.BulbDecider;
import com.ryuqq.decider.testkit.fixture.BulbEvent;
import com.ryuqq.decider.testkit.fixture.BulbState;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRuntime 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class InMemoryRuntimeTest {

    @Test
    void constructor_StartsFromInitialState() {
        InMemoryRuntime<BulbCommand, BulbEvent, BulbState> runtime = new InMemoryRuntime<>(new BulbDecider());

        assertThat(runtime.state()).isEqualTo(new BulbState.NotFitted());
        assertThat(runtime.toString()).isEqualTo("InMemoryRuntime(Bulb)");
    }

    @Test
    void constructor_NullDecider_ThrowsException() {
        assertThatThrownBy(() -> new InMemoryRuntime<>(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decide_NoEvents_StateUnchanged() {
        // given
        InMemoryRuntime<Integer, Integer, Integer> runtime = new InMemoryRuntime<>(new CounterDecider());
        runtime.decide(5);

        // when
        List<Integer> events = runtime.decide(0);

        // then
        assertThat(events).isEmpty();
        assertThat(runtime.state()).isEqualTo(5);
    }

    @Test
    void decide_ConcurrentCallers_NoLostUpdates() throws Exception {
        // given
        InMemoryRuntime<Integer, Integer, Integer> runtime = new InMemoryRuntime<>(new CounterDecider());
        int threads = 8;
        int perThread = 250;
        ExecutorService executorService = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < threads; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                for (int j = 0; j < perThread; j++) {
                    runtime.decide(1);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertThat(runtime.state()).isEqualTo(threads * perThread);
    }
}
