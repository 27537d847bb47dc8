/**
 * Organizational Unit 트리 탐색과 OU 기반 계정 선택.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.hierarchy;
