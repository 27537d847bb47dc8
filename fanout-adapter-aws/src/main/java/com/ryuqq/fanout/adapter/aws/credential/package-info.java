/**
 * AWS STS 기반 자격 증명 adapter.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.aws.credential;
