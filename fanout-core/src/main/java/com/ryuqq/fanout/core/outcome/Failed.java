package com.ryuqq.fanout.core.outcome;

/**
 * Failure marker.
 *
 * <p>리전 단위 연산이 예외를 던졌음을 나타냅니다. 같은 계정의 다른 리전이나
 * 다른 계정의 처리는 중단되지 않습니다.</p>
 *
 * @param errorType 예외 클래스 이름 (예: java.net.SocketTimeoutException)
 * @param message 오류 메시지 (null 허용)
 * @param <T> 결과 타입 (Succeeded와 같은 Map에 담기 위한 타입 파라미터)
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record Failed<T>(
    String errorType,
    String message
) implements UnitResult<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorType이 null이거나 빈 문자열인 경우
     */
    public Failed {
        if (errorType == null || errorType.isBlank()) {
            throw new IllegalArgumentException("errorType cannot be null or blank");
        }
        // message는 null 허용
    }

    /**
     * 예외로부터 Failed 생성.
     *
     * @param error 원인 예외
     * @param <T> 결과 타입
     * @return Failed 인스턴스
     * @throws IllegalArgumentException error가 null인 경우
     */
    public static <T> Failed<T> from(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new Failed<>(error.getClass().getName(), error.getMessage());
    }
}
