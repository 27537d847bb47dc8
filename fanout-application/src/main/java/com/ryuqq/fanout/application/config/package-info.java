/**
 * Role chain 설정과 실행 환경 신호.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.config;
