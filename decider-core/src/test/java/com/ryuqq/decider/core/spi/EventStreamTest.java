package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.ExpectedVersion;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EventStream 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class EventStreamTest {

    @Test
    void empty_HasNoStreamExpectation() {
        EventStream<String> stream = EventStream.empty();

        assertFalse(stream.exists());
        assertEquals(0, stream.version());
        assertEquals(ExpectedVersion.noStream(), stream.expectedVersion());
    }

    @Test
    void of_VersionEqualsEventCount() {
        EventStream<String> stream = EventStream.of(List.of("a", "b"));

        assertTrue(stream.exists());
        assertEquals(2, stream.version());
        assertEquals(ExpectedVersion.exactly(2), stream.expectedVersion());
    }

    @Test
    void constructor_CopiesEvents() {
        // Given
        List<String> source = new ArrayList<>(List.of("a"));

        // When
        EventStream<String> stream = EventStream.of(source);
        source.add("b");

        // Then
        assertEquals(List.of("a"), stream.events());
        assertThrows(UnsupportedOperationException.class, () -> stream.events().add("c"));
    }

    @Test
    void constructor_InvalidArguments_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new EventStream<String>(null, 0, false));
        assertThrows(IllegalArgumentException.class, () -> new EventStream<>(List.of(), -1, false));
    }
}
