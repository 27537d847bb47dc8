/**
 * AWS Organizations 기반 디렉터리 adapter.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.aws.directory;
