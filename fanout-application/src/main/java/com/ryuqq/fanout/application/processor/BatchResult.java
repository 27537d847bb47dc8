package com.ryuqq.fanout.application.processor;

import com.ryuqq.fanout.core.outcome.UnitResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fan-out 배치 결과.
 *
 * <p>계정 ID → (리전 → {@link UnitResult}) 매핑입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>identity 해석에 실패한 계정은 <strong>존재하지 않음</strong> (빈 Map으로도 기록되지 않음)</li>
 *   <li>포함된 계정은 처리된 모든 리전에 대해 결과를 가짐</li>
 *   <li>계정 ID는 중복되지 않음</li>
 * </ul>
 *
 * @param <T> 리전 연산 결과 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class BatchResult<T> {

    private final Map<String, Map<String, UnitResult<T>>> results;

    private BatchResult(Map<String, Map<String, UnitResult<T>>> results) {
        this.results = results;
    }

    /**
     * Map으로부터 불변 BatchResult 생성.
     *
     * @param results 계정 ID → 리전 결과
     * @param <T> 결과 타입
     * @return BatchResult
     * @throws IllegalArgumentException results가 null인 경우
     */
    public static <T> BatchResult<T> of(Map<String, Map<String, UnitResult<T>>> results) {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        Map<String, Map<String, UnitResult<T>>> copy = new LinkedHashMap<>();
        results.forEach((accountId, regions) ->
            copy.put(accountId, Collections.unmodifiableMap(new LinkedHashMap<>(regions))));
        return new BatchResult<>(Collections.unmodifiableMap(copy));
    }

    /**
     * 빈 결과.
     *
     * @param <T> 결과 타입
     * @return 빈 BatchResult
     */
    public static <T> BatchResult<T> empty() {
        return new BatchResult<>(Map.of());
    }

    /**
     * 계정 포함 여부.
     *
     * @param accountId 계정 ID
     * @return 결과에 포함되어 있으면 true
     */
    public boolean contains(String accountId) {
        return results.containsKey(accountId);
    }

    /**
     * 계정의 리전별 결과.
     *
     * @param accountId 계정 ID
     * @return 리전 → 결과 (계정이 없으면 empty)
     */
    public Optional<Map<String, UnitResult<T>>> get(String accountId) {
        return Optional.ofNullable(results.get(accountId));
    }

    public Set<String> accountIds() {
        return results.keySet();
    }

    public int size() {
        return results.size();
    }

    public boolean isEmpty() {
        return results.isEmpty();
    }

    /**
     * 전체 결과의 읽기 전용 view.
     *
     * @return 계정 ID → 리전 결과
     */
    public Map<String, Map<String, UnitResult<T>>> asMap() {
        return results;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        BatchResult<?> that = (BatchResult<?>) o;
        return results.equals(that.results);
    }

    @Override
    public int hashCode() {
        return results.hashCode();
    }

    @Override
    public String toString() {
        return "BatchResult{" + results + '}';
    }
}
