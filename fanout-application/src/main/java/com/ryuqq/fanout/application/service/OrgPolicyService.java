package com.ryuqq.fanout.application.service;

import com.ryuqq.fanout.application.config.PolicyQuery;
import com.ryuqq.fanout.core.model.Policy;
import com.ryuqq.fanout.core.spi.OrganizationDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Organization 정책 조회 서비스.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class OrgPolicyService {

    private static final Logger log = LoggerFactory.getLogger(OrgPolicyService.class);

    private final OrganizationDirectory directory;

    /**
     * 생성자.
     *
     * @param directory Organization 조회 SPI
     * @throws IllegalArgumentException directory가 null인 경우
     */
    public OrgPolicyService(OrganizationDirectory directory) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.directory = directory;
    }

    /**
     * 조회 조건에 맞는 정책 목록.
     *
     * @param query 조회 조건 (null이면 SCP)
     * @return 정책 목록
     */
    public List<Policy> listPolicies(PolicyQuery query) {
        PolicyQuery effective = query == null ? new PolicyQuery() : query;
        List<Policy> policies = directory.listPolicies(effective.policyType());
        log.debug("Found {} {} policies", policies.size(), effective.policyType());
        return policies;
    }
}
