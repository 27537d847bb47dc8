/**
 * Role chain 해석.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fanout.application.identity.RootSessionResolver} - root 세션 memoize</li>
 *   <li>{@link com.ryuqq.fanout.application.identity.SessionCache} - worker 전용 계정 세션 캐시</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.identity;
