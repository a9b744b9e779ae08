package com.ryuqq.decider.testkit.fixture;

import com.ryuqq.decider.testkit.fixture.BulbState.Status;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Bulb / Cat StateCodec 테스트.
 *
 * @author Decider Team
 * @since 1.0.0
 */
class StateCodecFixtureTest {

    private final BulbStateCodec bulbCodec = new BulbStateCodec();
    private final CatStateCodec catCodec = new CatStateCodec();

    @Test
    void bulb_SerializesToCompactText() {
        assertThat(bulbCodec.serialize(new BulbState.NotFitted())).isEqualTo("not_fitted");
        assertThat(bulbCodec.serialize(new BulbState.Working(Status.ON, 3))).isEqualTo("working:ON:3");
        assertThat(bulbCodec.serialize(new BulbState.Blown())).isEqualTo("blown");
    }

    @Test
    void bulb_DeserializesWorkingState() {
        assertThat(bulbCodec.deserialize("working:OFF:2")).isEqualTo(new BulbState.Working(Status.OFF, 2));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "working", "working:ON", "working:DIM:1", "working:ON:x", "on"})
    void bulb_MalformedText_ThrowsIllegalArgument(String text) {
        assertThatThrownBy(() -> bulbCodec.deserialize(text)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cat_SerializesAndDeserializes() {
        assertThat(catCodec.serialize(new CatState.Asleep())).isEqualTo("asleep");
        assertThat(catCodec.deserialize("awake")).isEqualTo(new CatState.Awake());
        assertThatThrownBy(() -> catCodec.deserialize("purring")).isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // deserialize(serialize(s)) == s
    // ============================================================

    static Stream<BulbState> bulbStates() {
        Stream<BulbState> working = Stream.of(Status.values())
            .flatMap(status -> IntStream.rangeClosed(0, 5).mapToObj(uses -> new BulbState.Working(status, uses)));
        return Stream.concat(Stream.of(new BulbState.NotFitted(), new BulbState.Blown()), working);
    }

    static Stream<CatState> catStates() {
        return Stream.of(new CatState.Awake(), new CatState.Asleep());
    }

    @ParameterizedTest
    @MethodSource("bulbStates")
    void bulb_RoundTrip_ReturnsEqualState(BulbState state) {
        assertThat(bulbCodec.deserialize(bulbCodec.serialize(state))).isEqualTo(state);
    }

    @ParameterizedTest
    @MethodSource("catStates")
    void cat_RoundTrip_ReturnsEqualState(CatState state) {
        assertThat(catCodec.deserialize(catCodec.serialize(state))).isEqualTo(state);
    }
}
