package com.ryuqq.fanout.application.service;

import com.ryuqq.fanout.application.filter.MatchedAccount;
import com.ryuqq.fanout.application.filter.RegionMatchFilter;
import com.ryuqq.fanout.application.hierarchy.OrganizationUnitFilter;
import com.ryuqq.fanout.application.processor.AccountSetProcessor;
import com.ryuqq.fanout.application.processor.BatchResult;
import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.spi.OrganizationDirectory;
import com.ryuqq.fanout.core.spi.RegionOperation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;

/**
 * Organization 계정 조회 → OU 선택 → fan-out 흐름을 묶는 서비스.
 *
 * <pre>
 * directory.listAccounts()            (호출당 한 번)
 *   ↓ OrganizationUnitFilter          (unitRoots가 있을 때만)
 *   ↓ AccountSetProcessor.runBatch
 *   ↓ RegionMatchFilter               (match 호출 시)
 * </pre>
 *
 * @param <S> 세션 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class OrgAccountService<S extends IdentitySession> {

    private static final Logger log = LoggerFactory.getLogger(OrgAccountService.class);

    private final OrganizationDirectory directory;
    private final OrganizationUnitFilter unitFilter;
    private final AccountSetProcessor<S> processor;
    private final RegionMatchFilter matchFilter;

    /**
     * 생성자.
     *
     * @param directory Organization 조회 SPI
     * @param unitFilter OU 필터
     * @param processor fan-out 처리기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public OrgAccountService(OrganizationDirectory directory,
                             OrganizationUnitFilter unitFilter,
                             AccountSetProcessor<S> processor) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (unitFilter == null) {
            throw new IllegalArgumentException("unitFilter cannot be null");
        }
        if (processor == null) {
            throw new IllegalArgumentException("processor cannot be null");
        }
        this.directory = directory;
        this.unitFilter = unitFilter;
        this.processor = processor;
        this.matchFilter = new RegionMatchFilter();
    }

    /**
     * 계정 조회.
     *
     * @param unitRoots root OU ID 목록 (비어있으면 전체 계정)
     * @return 선택된 계정
     */
    public List<Account> listAccounts(Collection<String> unitRoots) {
        List<Account> accounts = directory.listAccounts();
        if (unitRoots == null || unitRoots.isEmpty()) {
            return accounts;
        }
        return unitFilter.filter(accounts, unitRoots);
    }

    /**
     * 선택된 계정에 대해 리전 연산 실행.
     *
     * @param unitRoots root OU ID 목록 (비어있으면 전체 계정)
     * @param operation 리전 연산
     * @param <T> 결과 타입
     * @return 배치 결과
     */
    public <T> BatchResult<T> process(Collection<String> unitRoots, RegionOperation<S, T> operation) {
        List<Account> accounts = listAccounts(unitRoots);
        log.info("Processing {} accounts", accounts.size());
        return processor.runBatch(accounts, operation);
    }

    /**
     * 리전 검사를 통과한 계정 조회.
     *
     * @param unitRoots root OU ID 목록 (비어있으면 전체 계정)
     * @param check Boolean 리전 검사
     * @return 하나 이상의 리전에서 true인 계정
     */
    public List<MatchedAccount> match(Collection<String> unitRoots, RegionOperation<S, Boolean> check) {
        List<Account> accounts = listAccounts(unitRoots);
        BatchResult<Boolean> results = processor.runBatch(accounts, check);
        List<MatchedAccount> matched = matchFilter.filter(accounts, results);
        log.info("{} of {} accounts matched", matched.size(), accounts.size());
        return matched;
    }
}
