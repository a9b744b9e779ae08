package com.ryuqq.decider.testkit.contract;

import com.ryuqq.decider.core.exception.ConcurrencyConflictException;
import com.ryuqq.decider.core.model.AggregateKey;
import com.ryuqq.decider.core.model.ExpectedVersion;
import com.ryuqq.decider.core.spi.EventStore;
import com.ryuqq.decider.core.spi.EventStream;
import com.ryuqq.decider.testkit.fixture.BulbEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the {@link EventStore} SPI.
 *
 * <p>Adapter modules extend this class and provide a fresh store per test.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Absent stream → empty, version 0, not existing</li>
 *   <li>Append under matching expected version → version advances by event count</li>
 *   <li>Stale expected version → ConcurrencyConflictException, concurrent writer's events preserved</li>
 *   <li>NO_STREAM and version 0 are distinct expectations</li>
 *   <li>Racing appends with the same expected version → exactly one succeeds</li>
 * </ul>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public abstract class AbstractEventStoreContractTest {

    private static final List<BulbEvent> FIT_AND_SWITCH_ON =
        List.of(new BulbEvent.Fitted(3), new BulbEvent.SwitchedOn());

    protected EventStore<BulbEvent> eventStore;

    /**
     * Creates the event store under test.
     *
     * @return a new, empty event store
     */
    protected abstract EventStore<BulbEvent> createEventStore();

    @BeforeEach
    void setUpEventStore() {
        eventStore = createEventStore();
    }

    @Test
    void loadStream_AbsentKey_ReturnsEmptyStream() {
        // When
        EventStream<BulbEvent> stream = eventStore.loadStream(AggregateKey.of("absent"));

        // Then
        assertTrue(stream.events().isEmpty());
        assertEquals(0, stream.version());
        assertFalse(stream.exists());
        assertEquals(ExpectedVersion.noStream(), stream.expectedVersion());
    }

    @Test
    void appendToStream_NoStream_CreatesStream() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-1");

        // When
        eventStore.appendToStream(key, ExpectedVersion.noStream(), FIT_AND_SWITCH_ON);

        // Then
        EventStream<BulbEvent> stream = eventStore.loadStream(key);
        assertTrue(stream.exists());
        assertEquals(2, stream.version());
        assertEquals(FIT_AND_SWITCH_ON, stream.events());
    }

    @Test
    void appendToStream_MatchingVersion_AppendsInOrder() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-2");
        eventStore.appendToStream(key, ExpectedVersion.noStream(), FIT_AND_SWITCH_ON);

        // When
        eventStore.appendToStream(key, ExpectedVersion.exactly(2), List.of(new BulbEvent.SwitchedOff()));

        // Then
        EventStream<BulbEvent> stream = eventStore.loadStream(key);
        assertEquals(3, stream.version());
        assertEquals(new BulbEvent.SwitchedOff(), stream.events().get(2));
        assertEquals(FIT_AND_SWITCH_ON, stream.events().subList(0, 2));
    }

    @Test
    void appendToStream_StaleVersionAfterConcurrentAppend_ThrowsAndKeepsConcurrentEvents() {
        // Given: both writers read version 1
        AggregateKey key = AggregateKey.of("bulb-3");
        eventStore.appendToStream(key, ExpectedVersion.noStream(), List.of(new BulbEvent.Fitted(3)));
        ExpectedVersion read = eventStore.loadStream(key).expectedVersion();

        // And: the concurrent writer appends 2 events first
        List<BulbEvent> concurrent = List.of(new BulbEvent.SwitchedOn(), new BulbEvent.SwitchedOff());
        eventStore.appendToStream(key, read, concurrent);

        // When & Then: the stale writer is rejected
        ConcurrencyConflictException exception = assertThrows(ConcurrencyConflictException.class,
            () -> eventStore.appendToStream(key, read, List.of(new BulbEvent.SwitchedOn())));
        assertEquals(key, exception.getKey());

        // And: the stream reflects the concurrent writer unmodified
        EventStream<BulbEvent> stream = eventStore.loadStream(key);
        assertEquals(3, stream.version());
        assertEquals(List.of(new BulbEvent.Fitted(3), new BulbEvent.SwitchedOn(), new BulbEvent.SwitchedOff()),
            stream.events());
    }

    @Test
    void appendToStream_NoStreamButStreamExists_Throws() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-4");
        eventStore.appendToStream(key, ExpectedVersion.noStream(), FIT_AND_SWITCH_ON);

        // When & Then
        assertThrows(ConcurrencyConflictException.class,
            () -> eventStore.appendToStream(key, ExpectedVersion.noStream(), List.of(new BulbEvent.SwitchedOff())));
        assertEquals(2, eventStore.loadStream(key).version());
    }

    @Test
    void appendToStream_VersionZeroButNoStream_Throws() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-5");

        // When & Then
        assertThrows(ConcurrencyConflictException.class,
            () -> eventStore.appendToStream(key, ExpectedVersion.exactly(0), FIT_AND_SWITCH_ON));
        assertFalse(eventStore.loadStream(key).exists());
    }

    @Test
    void appendToStream_EmptyEventsOnAbsentStream_DoesNotCreateStream() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-6");

        // When
        eventStore.appendToStream(key, ExpectedVersion.noStream(), List.of());

        // Then
        assertFalse(eventStore.loadStream(key).exists());
    }

    @Test
    void appendToStream_EmptyEventsWithStaleVersion_Throws() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-7");
        eventStore.appendToStream(key, ExpectedVersion.noStream(), FIT_AND_SWITCH_ON);

        // When & Then
        assertThrows(ConcurrencyConflictException.class,
            () -> eventStore.appendToStream(key, ExpectedVersion.exactly(1), List.of()));
    }

    @Test
    void loadStream_ReturnedStream_NotAffectedByLaterAppends() {
        // Given
        AggregateKey key = AggregateKey.of("bulb-8");
        eventStore.appendToStream(key, ExpectedVersion.noStream(), FIT_AND_SWITCH_ON);
        EventStream<BulbEvent> loaded = eventStore.loadStream(key);

        // When
        eventStore.appendToStream(key, ExpectedVersion.exactly(2), List.of(new BulbEvent.SwitchedOff()));

        // Then
        assertEquals(2, loaded.version());
        assertEquals(2, loaded.events().size());
        assertThrows(UnsupportedOperationException.class, () -> loaded.events().add(new BulbEvent.Blew()));
    }

    @Test
    void appendToStream_ConcurrentWritersSameVersion_ExactlyOneSucceeds() throws Exception {
        // Given
        AggregateKey key = AggregateKey.of("bulb-race");
        eventStore.appendToStream(key, ExpectedVersion.noStream(), List.of(new BulbEvent.Fitted(10)));
        ExpectedVersion read = ExpectedVersion.exactly(1);

        int writers = 16;
        ExecutorService executorService = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> futures = new ArrayList<>();

        // When
        for (int i = 0; i < writers; i++) {
            futures.add(executorService.submit(() -> {
                start.await();
                try {
                    eventStore.appendToStream(key, read, List.of(new BulbEvent.SwitchedOn()));
                    return true;
                } catch (ConcurrencyConflictException e) {
                    return false;
                }
            }));
        }
        start.countDown();

        int succeeded = 0;
        for (Future<Boolean> future : futures) {
            if (future.get(5, TimeUnit.SECONDS)) {
                succeeded++;
            }
        }
        executorService.shutdown();

        // Then
        assertEquals(1, succeeded);
        assertEquals(2, eventStore.loadStream(key).version());
    }

    @Test
    void nullArguments_ThrowIllegalArgumentException() {
        AggregateKey key = AggregateKey.of("null-check");

        assertThrows(IllegalArgumentException.class, () -> eventStore.loadStream(null));
        assertThrows(IllegalArgumentException.class,
            () -> eventStore.appendToStream(null, ExpectedVersion.noStream(), List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> eventStore.appendToStream(key, null, List.of()));
        assertThrows(IllegalArgumentException.class,
            () -> eventStore.appendToStream(key, ExpectedVersion.noStream(), null));
    }
}
