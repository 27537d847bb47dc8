package com.ryuqq.fanout.core.model;

import java.util.Map;

/**
 * Organization 멤버 계정 스냅샷.
 *
 * <p>Directory에서 호출당 한 번 조회되며, 이후 fan-out 동안 변경되지 않습니다.</p>
 *
 * @param id 계정 ID (12자리 숫자 문자열, null/blank 불가)
 * @param name 계정 표시 이름 (null 불가)
 * @param arn 계정 ARN (null 허용)
 * @param tags 계정 태그 (null이면 빈 Map)
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record Account(
    String id,
    String name,
    String arn,
    Map<String, String> tags
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException id가 null/blank이거나 name이 null인 경우
     */
    public Account {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * 태그 없이 Account 생성.
     *
     * @param id 계정 ID
     * @param name 계정 이름
     * @return Account 인스턴스
     */
    public static Account of(String id, String name) {
        return new Account(id, name, null, Map.of());
    }
}
