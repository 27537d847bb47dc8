/**
 * Organization 도메인 모델.
 *
 * <ul>
 *   <li>{@link com.ryuqq.fanout.core.model.Account} - 멤버 계정 스냅샷</li>
 *   <li>{@link com.ryuqq.fanout.core.model.RoleArn} - 계정별 Role 식별자</li>
 *   <li>{@link com.ryuqq.fanout.core.model.ChildType} - 트리 자식 유형</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.model;
