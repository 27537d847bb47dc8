package com.ryuqq.fanout.application.hierarchy;

import com.ryuqq.fanout.core.model.Account;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * OU 기반 계정 선택 필터.
 *
 * <p>후보 계정 중 설정된 root OU 아래(하위 OU 포함)에 속한 계정만 남깁니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class OrganizationUnitFilter {

    private static final Logger log = LoggerFactory.getLogger(OrganizationUnitFilter.class);

    private final OrgTreeWalker walker;

    public OrganizationUnitFilter(OrgTreeWalker walker) {
        if (walker == null) {
            throw new IllegalArgumentException("walker cannot be null");
        }
        this.walker = walker;
    }

    /**
     * 계정 필터링.
     *
     * @param candidates 후보 계정 (순서 유지)
     * @param unitRoots root OU ID 목록
     * @return unitRoots 아래에 속한 계정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public List<Account> filter(List<Account> candidates, Collection<String> unitRoots) {
        if (candidates == null) {
            throw new IllegalArgumentException("candidates cannot be null");
        }
        if (unitRoots == null) {
            throw new IllegalArgumentException("unitRoots cannot be null");
        }

        Set<String> units = walker.resolveUnits(unitRoots);
        Set<String> accountIds = walker.resolveAccounts(units);

        List<Account> selected = new ArrayList<>();
        for (Account account : candidates) {
            if (accountIds.contains(account.id())) {
                selected.add(account);
            }
        }

        log.debug("OU filter selected {} of {} accounts under {} units", selected.size(), candidates.size(), units.size());
        return selected;
    }
}
