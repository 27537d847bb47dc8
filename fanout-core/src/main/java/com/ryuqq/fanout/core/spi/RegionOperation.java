package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.Account;

/**
 * (계정, 리전) 단위로 실행되는 호출자 정의 연산.
 *
 * <p>엔진은 이 연산이 무엇을 검사하는지 알지 못합니다. 던져진 예외는 엔진이 잡아
 * failure marker로 기록합니다.</p>
 *
 * @param <S> 세션 타입
 * @param <T> 결과 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RegionOperation<S extends IdentitySession, T> {

    /**
     * 계정의 한 리전에 대해 연산 실행.
     *
     * @param account 대상 계정
     * @param region 대상 리전
     * @param session 계정 Role 세션
     * @return 연산 결과
     * @throws Exception 연산 실패 시 (failure marker로 기록됨)
     */
    T process(Account account, String region, S session) throws Exception;
}
