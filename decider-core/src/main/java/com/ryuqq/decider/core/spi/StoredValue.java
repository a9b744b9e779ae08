package com.ryuqq.decider.core.spi;

import com.ryuqq.decider.core.model.ETag;

/**
 * A serialized state snapshot together with the etag of the write that produced it.
 *
 * @param serializedState the state as produced by a {@link StateCodec}
 * @param etag the token identifying this stored version
 *
 * @author Decider Team
 * @since 1.0.0
 */
public record StoredValue(String serializedState, ETag etag) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException if any field is null
     */
    public StoredValue {
        if (serializedState == null) {
            throw new IllegalArgumentException("serializedState cannot be null");
        }
        if (etag == null) {
            throw new IllegalArgumentException("etag cannot be null");
        }
    }
}
