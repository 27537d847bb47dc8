/**
 * In-memory organization directory.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.adapter.inmemory.directory;
