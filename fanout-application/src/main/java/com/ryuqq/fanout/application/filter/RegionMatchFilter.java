package com.ryuqq.fanout.application.filter;

import com.ryuqq.fanout.application.processor.BatchResult;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.outcome.Succeeded;
import com.ryuqq.fanout.core.outcome.UnitResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Boolean 리전 검사 결과로 계정을 선택하는 필터.
 *
 * <p><strong>선택 규칙:</strong></p>
 * <ul>
 *   <li>BatchResult에 없는 계정 (identity 실패) → 제외</li>
 *   <li>{@code Succeeded(true)}인 리전이 하나도 없는 계정 → 제외</li>
 *   <li>{@code Failed}와 {@code Succeeded(false)}는 모두 불일치로 취급</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class RegionMatchFilter {

    /**
     * 계정 필터링.
     *
     * @param accounts 후보 계정 (순서 유지)
     * @param results 리전 검사 결과
     * @return 하나 이상의 리전에서 일치한 계정과 일치 리전
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public List<MatchedAccount> filter(List<Account> accounts, BatchResult<Boolean> results) {
        if (accounts == null) {
            throw new IllegalArgumentException("accounts cannot be null");
        }
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }

        List<MatchedAccount> matched = new ArrayList<>();
        for (Account account : accounts) {
            Optional<Map<String, UnitResult<Boolean>>> regions = results.get(account.id());
            if (regions.isEmpty()) {
                continue;
            }

            List<String> matchingRegions = new ArrayList<>();
            regions.get().forEach((region, result) -> {
                if (isMatch(result)) {
                    matchingRegions.add(region);
                }
            });

            if (!matchingRegions.isEmpty()) {
                matched.add(new MatchedAccount(account, matchingRegions));
            }
        }
        return matched;
    }

    private static boolean isMatch(UnitResult<Boolean> result) {
        return result instanceof Succeeded<Boolean> succeeded && Boolean.TRUE.equals(succeeded.value());
    }
}
