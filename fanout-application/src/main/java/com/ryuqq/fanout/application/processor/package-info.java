/**
 * Fan-out 처리 포트와 결과 모델.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>fanout-adapter-runner: 고정 크기 스레드 풀 기반 FanOutExecutor</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.processor;
