package com.ryuqq.decider.testkit.fixture;

import com.ryuqq.decider.core.spi.StateCodec;
import com.ryuqq.decider.testkit.fixture.BulbState.Blown;
import com.ryuqq.decider.testkit.fixture.BulbState.NotFitted;
import com.ryuqq.decider.testkit.fixture.BulbState.Status;
import com.ryuqq.decider.testkit.fixture.BulbState.Working;

/**
 * 전구 상태 텍스트 코덱.
 *
 * <p>형식: {@code not_fitted} | {@code working:<ON|OFF>:<remainingUses>} | {@code blown}</p>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class BulbStateCodec implements StateCodec<BulbState> {

    private static final String NOT_FITTED = "not_fitted";
    private static final String WORKING_PREFIX = "working:";
    private static final String BLOWN = "blown";

    @Override
    public String serialize(BulbState state) {
        if (state instanceof NotFitted) {
            return NOT_FITTED;
        }
        if (state instanceof Working working) {
            return WORKING_PREFIX + working.status().name() + ":" + working.remainingUses();
        }
        if (state instanceof Blown) {
            return BLOWN;
        }
        throw new IllegalArgumentException("Unknown state: " + state);
    }

    @Override
    public BulbState deserialize(String text) {
        if (NOT_FITTED.equals(text)) {
            return new NotFitted();
        }
        if (BLOWN.equals(text)) {
            return new Blown();
        }
        if (text != null && text.startsWith(WORKING_PREFIX)) {
            String[] parts = text.split(":");
            if (parts.length != 3) {
                throw new IllegalArgumentException("Malformed working state: " + text);
            }
            try {
                return new Working(Status.valueOf(parts[1]), Integer.parseInt(parts[2]));
            } catch (IllegalArgumentException e) {
                // NumberFormatException 포함
                throw new IllegalArgumentException("Malformed working state: " + text, e);
            }
        }
        throw new IllegalArgumentException("Unknown state: " + text);
    }
}
