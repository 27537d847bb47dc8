/**
 * In-memory credential provider.
 *
 * <p>테스트 및 레퍼런스 용도입니다. 실제 자격 증명을 발급하지 않습니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.inmemory.credential;
