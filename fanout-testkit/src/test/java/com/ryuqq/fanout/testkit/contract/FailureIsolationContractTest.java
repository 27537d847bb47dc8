package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.application.processor.BatchResult;
import com.ryuqq.fanout.core.model.Account;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 1: Failure Isolation.
 *
 * <p>This test validates that no single account or region failure aborts the batch.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Account role assumption denied → account absent, others processed</li>
 *   <li>Operation throws in one region → Failed marker there, other regions succeed</li>
 *   <li>Every account denied → empty result, no exception</li>
 *   <li>Every region of an account fails → account present with only Failed markers</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
class FailureIsolationContractTest extends AbstractContractTest {

    @Test
    void testFailureIsolation_IdentityDeniedAndRegionError_BatchCompletes() {
        // Given: T1 cannot be assumed, T2 fails in us-east-1 only
        Account t1 = createAccount("111111111111", "t1");
        Account t2 = createAccount("222222222222", "t2");
        credentialProvider.denyAccount(t1.id());

        // When
        BatchResult<String> result = executor().runBatch(List.of(t1, t2), (account, region, session) -> {
            if (account.id().equals(t2.id()) && region.equals(EAST)) {
                throw new IOException("connection reset");
            }
            return "ok";
        });

        // Then
        assertAccountAbsent(result, t1.id());
        assertAllRegionsPresent(result, t2.id());
        assertRegionFailed(result, t2.id(), EAST, IOException.class);
        assertRegionSucceeded(result, t2.id(), WEST, "ok");
        assertEquals(1, result.size());
    }

    @Test
    void testFailureIsolation_AllAccountsDenied_EmptyResult() {
        // Given
        Account t1 = createAccount("111111111111", "t1");
        Account t2 = createAccount("222222222222", "t2");
        credentialProvider.denyAccount(t1.id());
        credentialProvider.denyAccount(t2.id());

        // When
        BatchResult<Boolean> result = executor().runBatch(List.of(t1, t2), (account, region, session) -> true);

        // Then
        assertTrue(result.isEmpty(), "Denied accounts must not appear in the result");
    }

    @Test
    void testFailureIsolation_AllRegionsFail_AccountPresentWithFailures() {
        // Given
        Account t1 = createAccount("111111111111", "t1");

        // When
        BatchResult<Boolean> result = executor().runBatch(List.of(t1), (account, region, session) -> {
            throw new IllegalStateException("service unavailable in " + region);
        });

        // Then
        assertAllRegionsPresent(result, t1.id());
        assertRegionFailed(result, t1.id(), EAST, IllegalStateException.class);
        assertRegionFailed(result, t1.id(), WEST, IllegalStateException.class);
    }

    @Test
    void testFailureIsolation_DeniedAccount_OtherAccountsStillAssumed() {
        // Given
        Account t1 = createAccount("111111111111", "t1");
        Account t2 = createAccount("222222222222", "t2");
        Account t3 = createAccount("333333333333", "t3");
        credentialProvider.denyAccount(t2.id());

        // When
        BatchResult<Boolean> result = executor().runBatch(List.of(t1, t2, t3), (account, region, session) -> true);

        // Then
        assertEquals(1, credentialProvider.assumeCount(accountRoleArn(t1.id())));
        assertEquals(1, credentialProvider.assumeCount(accountRoleArn(t2.id())));
        assertEquals(1, credentialProvider.assumeCount(accountRoleArn(t3.id())));
        assertAccountAbsent(result, t2.id());
        assertAllRegionsPresent(result, t1.id());
        assertAllRegionsPresent(result, t3.id());
    }
}
