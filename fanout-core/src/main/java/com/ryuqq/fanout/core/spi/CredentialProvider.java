package com.ryuqq.fanout.core.spi;

import com.ryuqq.fanout.core.identity.IdentityResolutionException;
import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.RoleArn;

/**
 * Credential Provider SPI.
 *
 * <p>Role assume 프로토콜 자체는 구현체가 담당합니다. 코어는 프로토콜에 무관합니다.</p>
 *
 * <p><strong>Role Chain:</strong></p>
 * <pre>
 * localIdentity()                         실행 identity
 *   ↓ assumeIdentity(orgAccessRole)       (선택) org 접근 identity
 *   ↓ assumeIdentity(accountRole)         계정별 identity
 * </pre>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 여러 worker에서 동시에 호출됨</li>
 *   <li>거부된 assume은 {@link IdentityResolutionException}으로 보고</li>
 * </ul>
 *
 * @param <S> 구현체가 발급하는 세션 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public interface CredentialProvider<S extends IdentitySession> {

    /**
     * 실행 환경의 기본 identity.
     *
     * @return 로컬 세션
     */
    S localIdentity();

    /**
     * parent 세션으로 Role을 assume.
     *
     * @param roleArn assume할 Role
     * @param sessionLabel 세션 이름 (감사 로그에 기록됨)
     * @param region 자격 증명 서비스 엔드포인트 리전
     * @param parent assume을 수행하는 세션
     * @return 새 세션
     * @throws IdentityResolutionException assume이 거부된 경우
     */
    S assumeIdentity(RoleArn roleArn, String sessionLabel, String region, S parent);
}
