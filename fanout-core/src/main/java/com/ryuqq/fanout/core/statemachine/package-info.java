/**
 * 계정/리전 단위 상태 머신.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.statemachine;
