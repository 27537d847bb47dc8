/**
 * 단위 실행 결과 모델.
 *
 * <p>{@link com.ryuqq.fanout.core.outcome.UnitResult}는 sealed interface이며
 * {@link com.ryuqq.fanout.core.outcome.Succeeded}와
 * {@link com.ryuqq.fanout.core.outcome.Failed} 두 가지 경우만 허용합니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.outcome;
