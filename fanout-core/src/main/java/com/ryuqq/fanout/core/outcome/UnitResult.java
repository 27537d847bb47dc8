package com.ryuqq.fanout.core.outcome;

/**
 * (계정, 리전) 단위 실행 결과.
 *
 * <p>UnitResult는 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Succeeded}: 연산이 값을 반환함 (값이 부정적이어도 성공으로 기록)</li>
 *   <li>{@link Failed}: 연산이 예외를 던짐 (failure marker)</li>
 * </ul>
 *
 * <p>엔진은 반환값을 해석하지 않습니다. "false 반환"과 "예외 발생"의 구분은
 * 호출자에게 그대로 전달됩니다.</p>
 *
 * @param <T> 연산 결과 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public sealed interface UnitResult<T> permits Succeeded, Failed {

    /**
     * 성공 결과 생성.
     *
     * @param value 연산 반환값 (null 허용)
     * @param <T> 결과 타입
     * @return Succeeded 인스턴스
     */
    static <T> UnitResult<T> succeeded(T value) {
        return new Succeeded<>(value);
    }

    /**
     * 예외로부터 failure marker 생성.
     *
     * @param error 연산이 던진 예외
     * @param <T> 결과 타입
     * @return Failed 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    static <T> UnitResult<T> failed(Throwable error) {
        return Failed.from(error);
    }

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isSucceeded() {
        return this instanceof Succeeded;
    }

    /**
     * 결과가 failure marker인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }
}
