package com.ryuqq.fanout.testkit.contract;

import com.ryuqq.fanout.application.config.PolicyQuery;
import com.ryuqq.fanout.application.service.OrgPolicyService;
import com.ryuqq.fanout.core.model.Policy;
import com.ryuqq.fanout.core.model.PolicyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for Scenario 7: Organization Policies.
 *
 * <p>This test validates policy listing driven by the query {@code filter} entry.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>No filter → service control policies</li>
 *   <li>Filter → only policies of that type</li>
 *   <li>Unknown filter → rejected before the directory is queried</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
class OrgPolicyContractTest extends AbstractContractTest {

    private OrgPolicyService service;

    @BeforeEach
    void setUpPolicies() {
        directory
                .addPolicy(new Policy("p-FullAWSAccess", "FullAWSAccess", null,
                        PolicyType.SERVICE_CONTROL_POLICY, "Allows access to every operation", true, Map.of()))
                .addPolicy(Policy.of("p-deny-root", "deny-root", PolicyType.SERVICE_CONTROL_POLICY))
                .addPolicy(Policy.of("p-cost-center", "cost-center", PolicyType.TAG_POLICY))
                .addPolicy(Policy.of("p-backup-daily", "backup-daily", PolicyType.BACKUP_POLICY));
        service = new OrgPolicyService(directory);
    }

    private List<String> policyIds(List<Map<String, Object>> query) {
        return service.listPolicies(PolicyQuery.fromQuery(query)).stream()
                .map(Policy::id)
                .collect(Collectors.toList());
    }

    @Test
    void testPolicies_NoFilter_ServiceControlPolicies() {
        assertEquals(List.of("p-FullAWSAccess", "p-deny-root"), policyIds(List.of()));
    }

    @Test
    void testPolicies_TagFilter_OnlyTagPolicies() {
        assertEquals(List.of("p-cost-center"), policyIds(List.of(Map.of("filter", "TAG_POLICY"))));
    }

    @Test
    void testPolicies_TypeWithoutPolicies_Empty() {
        assertTrue(policyIds(List.of(Map.of("filter", "AISERVICES_OPT_OUT_POLICY"))).isEmpty());
    }

    @Test
    void testPolicies_UnknownFilter_Rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> policyIds(List.of(Map.of("filter", "UNKNOWN_POLICY"))));
    }
}
