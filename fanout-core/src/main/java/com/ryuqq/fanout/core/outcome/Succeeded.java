package com.ryuqq.fanout.core.outcome;

/**
 * 성공 결과.
 *
 * @param value 연산 반환값 (null 허용)
 * @param <T> 결과 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record Succeeded<T>(T value) implements UnitResult<T> {
}
