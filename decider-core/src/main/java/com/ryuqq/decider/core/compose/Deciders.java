package com.ryuqq.decider.core.compose;

import com.ryuqq.decider.core.contract.Decider;

/**
 * Decider 합성 진입점.
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ComposedDecider&lt;CatCommand, CatEvent, CatState, BulbCommand, BulbEvent, BulbState&gt; catAndBulb =
 *     Deciders.compose(new CatDecider(), new BulbDecider());
 *
 * List&lt;Either&lt;CatEvent, BulbEvent&gt;&gt; events =
 *     catAndBulb.decide(Either.right(new Fit(5)), catAndBulb.initialState());
 * </pre>
 *
 * @author Decider Team
 * @since 1.0.0
 */
public final class Deciders {

    // Utility class - prevent instantiation
    private Deciders() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 두 Decider를 합성.
     *
     * @param deciderX X 측 (Left) Decider
     * @param deciderY Y 측 (Right) Decider
     * @return 합성된 Decider
     * @throws IllegalArgumentException 어느 한쪽이라도 null인 경우
     */
    public static <CX, EX, SX, CY, EY, SY> ComposedDecider<CX, EX, SX, CY, EY, SY> compose(
        Decider<CX, EX, SX> deciderX,
        Decider<CY, EY, SY> deciderY
    ) {
        return new ComposedDecider<>(deciderX, deciderY);
    }
}
