package com.ryuqq.fanout.application.config;

import com.ryuqq.fanout.core.model.PolicyType;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Organization 정책 조회 조건.
 *
 * <p>query 블록의 {@value #FILTER_KEY} 항목으로 정책 유형을 지정하며,
 * 지정하지 않으면 {@link PolicyType#SERVICE_CONTROL_POLICY}를 조회합니다.</p>
 *
 * <pre>
 * query:
 *   - filter: TAG_POLICY
 * </pre>
 *
 * @param policyType 조회할 정책 유형 (null 불가)
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record PolicyQuery(PolicyType policyType) {

    public static final String FILTER_KEY = "filter";

    /**
     * 기본 조건 생성자 (SCP).
     */
    public PolicyQuery() {
        this(PolicyType.DEFAULT);
    }

    public PolicyQuery {
        if (policyType == null) {
            throw new IllegalArgumentException("policyType cannot be null");
        }
    }

    /**
     * 정책의 query 블록으로부터 조회 조건 생성.
     *
     * @param query 정책 query 블록 (null이면 기본 조건)
     * @return PolicyQuery
     * @throws IllegalArgumentException filter가 문자열이 아니거나 알 수 없는 정책 유형인 경우
     */
    public static PolicyQuery fromQuery(List<Map<String, Object>> query) {
        String filter = QueryParams.stringParam(QueryParams.merge(query), FILTER_KEY);
        if (filter == null) {
            return new PolicyQuery();
        }
        try {
            return new PolicyQuery(PolicyType.valueOf(filter));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                FILTER_KEY + " must be one of " + Arrays.toString(PolicyType.values()) + " (current: " + filter + ")",
                e
            );
        }
    }
}
