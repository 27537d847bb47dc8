package com.ryuqq.fanout.application.config;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 정책 query 블록 병합 및 값 추출.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
final class QueryParams {

    private QueryParams() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * query Map 목록을 순서대로 병합 (뒤의 값이 우선).
     */
    static Map<String, Object> merge(List<Map<String, Object>> query) {
        Map<String, Object> params = new HashMap<>();
        if (query != null) {
            for (Map<String, Object> entry : query) {
                if (entry != null) {
                    params.putAll(entry);
                }
            }
        }
        return params;
    }

    /**
     * 문자열 값 추출.
     *
     * @return 값 (없으면 null)
     * @throws IllegalArgumentException 값이 문자열이 아닌 경우
     */
    static String stringParam(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(
                key + " must be a string (current: " + value.getClass().getSimpleName() + ")"
            );
        }
        return text;
    }
}
