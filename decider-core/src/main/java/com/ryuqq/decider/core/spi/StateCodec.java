package com.ryuqq.decider.core.spi;

import java.util.function.Function;

/**
 * Text serializer/deserializer pair for a decider's state.
 *
 * <p>Supplied by the caller per decider; runtimes never inspect state internals.
 * Implementations must round-trip exactly: {@code deserialize(serialize(s)).equals(s)}
 * for every reachable state.</p>
 *
 * @param <S> state type
 *
 * @author Decider Team
 * @since 1.0.0
 */
public interface StateCodec<S> {

    /**
     * Serializes a state.
     *
     * @param state the state
     * @return text form
     */
    String serialize(S state);

    /**
     * Deserializes a state.
     *
     * @param text text form produced by {@link #serialize}
     * @return the state
     * @throws IllegalArgumentException if the text is not a known state
     */
    S deserialize(String text);

    /**
     * Builds a codec from two functions.
     *
     * @param serializer state to text
     * @param deserializer text to state
     * @param <S> state type
     * @return codec
     * @throws IllegalArgumentException if either function is null
     */
    static <S> StateCodec<S> of(Function<? super S, String> serializer, Function<String, ? extends S> deserializer) {
        if (serializer == null) {
            throw new IllegalArgumentException("serializer cannot be null");
        }
        if (deserializer == null) {
            throw new IllegalArgumentException("deserializer cannot be null");
        }
        return new StateCodec<>() {
            @Override
            public String serialize(S state) {
                return serializer.apply(state);
            }

            @Override
            public S deserialize(String text) {
                return deserializer.apply(text);
            }
        };
    }
}
