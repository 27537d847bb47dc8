package com.ryuqq.fanout.application.filter;

import com.ryuqq.fanout.core.model.Account;

import java.util.List;

/**
 * 리전 검사를 통과한 계정.
 *
 * @param account 계정
 * @param matchingRegions 검사 결과가 true인 리전 (처리 순서)
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record MatchedAccount(
    Account account,
    List<String> matchingRegions
) {

    public MatchedAccount {
        if (account == null) {
            throw new IllegalArgumentException("account cannot be null");
        }
        if (matchingRegions == null || matchingRegions.isEmpty()) {
            throw new IllegalArgumentException("matchingRegions cannot be null or empty");
        }
        matchingRegions = List.copyOf(matchingRegions);
    }
}
