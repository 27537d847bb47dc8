/**
 * Fan-out runtime adapter.
 *
 * <p>{@link com.ryuqq.fanout.adapter.runner.FanOutExecutor}는 고정 크기 worker 풀 위에서
 * 계정 단위 fan-out/fan-in을 수행합니다. worker 스레드마다 계정 세션 캐시를 하나씩 소유합니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.runner;
