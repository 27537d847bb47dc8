/**
 * Contract test infrastructure.
 *
 * <p>{@link com.ryuqq.fanout.testkit.contract.AbstractContractTest} wires the in-memory
 * credential provider and organization directory into a real fan-out executor.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
package com.ryuqq.fanout.testkit.contract;
