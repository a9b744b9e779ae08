package com.ryuqq.decider.core.compose;

import java.util.function.Function;

/**
 * 두 타입 중 하나를 담는 태그드 유니온.
 *
 * <p>합성된 Decider의 Command/Event 타입으로 사용됩니다. 태그(Left/Right)가 곧 소유 측을
 * 나타내므로, 두 Decider의 타입 집합이 겹치더라도 라우팅이 모호해지지 않습니다.</p>
 *
 * <p>Sealed interface로 정의되어 Left/Right 외의 구현을 허용하지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Either&lt;CatCommand, BulbCommand&gt; command = Either.right(new Fit(5));
 *
 * String side = command.fold(cat -&gt; "cat", bulb -&gt; "bulb");
 * </pre>
 *
 * @param <L> 왼쪽(X 측) 값 타입
 * @param <R> 오른쪽(Y 측) 값 타입
 *
 * @author Decider Team
 * @since 1.0.0
 */
public sealed interface Either<L, R> permits Either.Left, Either.Right {

    /**
     * 왼쪽 값 생성.
     *
     * @param value 값 (null 불가)
     * @param <L> 왼쪽 타입
     * @param <R> 오른쪽 타입
     * @return Left 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    /**
     * 오른쪽 값 생성.
     *
     * @param value 값 (null 불가)
     * @param <L> 왼쪽 타입
     * @param <R> 오른쪽 타입
     * @return Right 인스턴스
     * @throws IllegalArgumentException value가 null인 경우
     */
    static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    /**
     * 왼쪽 값인지 확인.
     *
     * @return Left인 경우 true
     */
    default boolean isLeft() {
        return this instanceof Left;
    }

    /**
     * 오른쪽 값인지 확인.
     *
     * @return Right인 경우 true
     */
    default boolean isRight() {
        return this instanceof Right;
    }

    /**
     * 양쪽 케이스를 하나의 결과로 접음.
     *
     * @param onLeft Left일 때 적용할 함수
     * @param onRight Right일 때 적용할 함수
     * @param <T> 결과 타입
     * @return 적용 결과
     */
    <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight);

    /**
     * 양쪽 값을 각각 변환.
     *
     * @param onLeft Left 값 변환 함수
     * @param onRight Right 값 변환 함수
     * @param <L2> 새 왼쪽 타입
     * @param <R2> 새 오른쪽 타입
     * @return 같은 쪽에 변환된 값을 담은 Either
     */
    default <L2, R2> Either<L2, R2> map(Function<? super L, ? extends L2> onLeft,
                                        Function<? super R, ? extends R2> onRight) {
        return fold(l -> Either.<L2, R2>left(onLeft.apply(l)), r -> Either.<L2, R2>right(onRight.apply(r)));
    }

    /**
     * 왼쪽 값.
     *
     * @param value 값
     * @param <L> 왼쪽 타입
     * @param <R> 오른쪽 타입
     */
    record Left<L, R>(L value) implements Either<L, R> {

        public Left {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onLeft.apply(value);
        }
    }

    /**
     * 오른쪽 값.
     *
     * @param value 값
     * @param <L> 왼쪽 타입
     * @param <R> 오른쪽 타입
     */
    record Right<L, R>(R value) implements Either<L, R> {

        public Right {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public <T> T fold(Function<? super L, ? extends T> onLeft, Function<? super R, ? extends T> onRight) {
            return onRight.apply(value);
        }
    }
}
