/**
 * Application service.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.application.service;
