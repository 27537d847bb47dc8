package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.model.ChildType;
import com.ryuqq.fanout.core.model.Policy;
import com.ryuqq.fanout.core.model.PolicyType;

import java.util.List;

/**
 * Organization 조회 SPI.
 *
 * <p>페이지네이션은 구현체가 처리하며, 모든 페이지를 합친 결과를 반환합니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public interface OrganizationDirectory {

    /**
     * 부모 노드의 직계 자식 ID 목록 조회.
     *
     * @param parentId 부모 노드 ID (root 또는 OU)
     * @param childType 조회할 자식 유형
     * @return 자식 ID 목록 (없으면 빈 List)
     */
    List<String> listChildren(String parentId, ChildType childType);

    /**
     * Organization의 모든 계정 조회.
     *
     * @return 계정 목록 (태그 포함)
     */
    List<Account> listAccounts();

    /**
     * 유형별 Organization 정책 조회.
     *
     * @param policyType 정책 유형
     * @return 정책 목록 (없으면 빈 List)
     */
    List<Policy> listPolicies(PolicyType policyType);
}
