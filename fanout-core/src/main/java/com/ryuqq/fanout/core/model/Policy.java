package com.ryuqq.fanout.core.model;

import java.util.Map;

/**
 * Organization 정책 스냅샷.
 *
 * @param id 정책 ID (null/blank 불가)
 * @param name 정책 이름 (null 불가)
 * @param arn 정책 ARN (null 허용)
 * @param type 정책 유형 (null 불가)
 * @param description 설명 (null 허용)
 * @param awsManaged AWS 관리형 정책 여부
 * @param tags 정책 태그 (null이면 빈 Map)
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record Policy(
    String id,
    String name,
    String arn,
    PolicyType type,
    String description,
    boolean awsManaged,
    Map<String, String> tags
) {

    public Policy {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * 고객 관리형 정책을 태그 없이 생성.
     *
     * @param id 정책 ID
     * @param name 정책 이름
     * @param type 정책 유형
     * @return Policy 인스턴스
     */
    public static Policy of(String id, String name, PolicyType type) {
        return new Policy(id, name, null, type, null, false, Map.of());
    }
}
