/**
 * Identity handle 추상화.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.core.identity;
