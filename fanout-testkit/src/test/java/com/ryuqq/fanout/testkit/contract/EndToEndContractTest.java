package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.adapter.inmemory.credential.InMemoryIdentitySession;
import com.ryuqq.fanout.application.config.ExecutionEnvironment;
import com.ryuqq.fanout.application.config.OrgAccessConfig;
import com.ryuqq.fanout.application.filter.MatchedAccount;
import com.ryuqq.fanout.application.processor.BatchResult;
import com.ryuqq.fanout.application.service.OrgAccountService;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.model.RoleArn;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 6: End to End.
 *
 * <p>This test drives policy configuration, unit selection, fan-out and region matching
 * through {@link OrgAccountService}.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Policy query → account role used for every account</li>
 *   <li>Region check → only accounts with a passing region, annotated with those regions</li>
 *   <li>Check failure in a region → treated as not matching</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
class EndToEndContractTest extends AbstractContractTest {

    @Test
    void testEndToEnd_PolicyQuery_AccountRoleApplied() {
        // Given
        accessConfig = OrgAccessConfig.fromQuery(
                List.of(Map.of("org-account-role", "SecurityAudit")),
                null,
                ExecutionEnvironment.standalone());
        Account t1 = createAccount("111111111111", "t1");
        directory.addAccount("r-root", t1);
        OrgAccountService<InMemoryIdentitySession> service = createService(executor());

        // When
        BatchResult<RoleArn> result = service.process(
                List.of(),
                (account, region, session) -> session.roleArn().orElseThrow());

        // Then
        assertRegionSucceeded(result, t1.id(), EAST, RoleArn.of("arn:aws:iam::111111111111:role/SecurityAudit"));
    }

    @Test
    void testEndToEnd_RegionCheck_MatchingAccountsAnnotated() {
        // Given: stack present in east for t1, nowhere for t2, check errors in west for t3
        Account t1 = createAccount("111111111111", "t1");
        Account t2 = createAccount("222222222222", "t2");
        Account t3 = createAccount("333333333333", "t3");
        Account t4 = createAccount("444444444444", "t4");
        directory
                .addUnit("r-root", "ou-workloads")
                .addAccount("ou-workloads", t1)
                .addAccount("ou-workloads", t2)
                .addAccount("ou-workloads", t3)
                .addAccount("r-root", t4);
        credentialProvider.denyAccount(t3.id());
        Set<String> deployed = Set.of(t1.id() + "/" + EAST);
        OrgAccountService<InMemoryIdentitySession> service = createService(executor());

        // When
        List<MatchedAccount> matched = service.match(List.of("ou-workloads"), (account, region, session) -> {
            if (account.id().equals(t2.id()) && region.equals(WEST)) {
                throw new IllegalStateException("DescribeStacks throttled");
            }
            return deployed.contains(account.id() + "/" + region);
        });

        // Then
        assertEquals(1, matched.size());
        assertEquals(t1, matched.get(0).account());
        assertEquals(List.of(EAST), matched.get(0).matchingRegions());
    }

    @Test
    void testEndToEnd_ControlTowerOrganization_DefaultRoleSwitched() {
        // Given
        accessConfig = OrgAccessConfig.fromQuery(List.of(), null, new ExecutionEnvironment(false, true));
        Account t1 = createAccount("111111111111", "t1");

        // When
        executor().runBatch(List.of(t1), (account, region, session) -> true);

        // Then
        assertEquals(1, credentialProvider.assumeCount(
                RoleArn.of("arn:aws:iam::111111111111:role/AWSControlTowerExecution")));
    }
}
