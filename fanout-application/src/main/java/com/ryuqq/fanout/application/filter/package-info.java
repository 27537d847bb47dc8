/**
 * BatchResult 기반 계정 필터.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.filter;
