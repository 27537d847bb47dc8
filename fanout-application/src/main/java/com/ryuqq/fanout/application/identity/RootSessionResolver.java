package com.ryuqq.fanout.application.identity;

import com.ryuqq.fanout.application.config.ExecutionEnvironment;
import com.ryuqq.fanout.application.config.OrgAccessConfig;
import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.RoleArn;
import com.ryuqq.fanout.core.spi.CredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Root 세션 해석기.
 *
 * <p>모든 계정별 assume의 기반이 되는 최상위 세션을 해석하고 memoize합니다.</p>
 *
 * <p><strong>해석 규칙:</strong></p>
 * <pre>
 * org-access-role 없음                         → 실행 identity
 * 서버리스 트리거 + member-role 지정            → 실행 identity (이미 org 범위)
 * 그 외                                        → 실행 identity로 org-access-role assume
 * </pre>
 *
 * <p>결과는 인스턴스 수명 동안 한 번만 계산되며 만료 갱신을 하지 않습니다.
 * 반환된 세션은 불변이므로 여러 worker가 동기화 없이 읽어도 안전합니다.</p>
 *
 * @param <S> 세션 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class RootSessionResolver<S extends IdentitySession> {

    /**
     * Org 계정 assume 시 사용하는 세션 이름.
     */
    public static final String SESSION_LABEL = "FanOutOrgAccount";

    private static final Logger log = LoggerFactory.getLogger(RootSessionResolver.class);

    private final CredentialProvider<S> credentialProvider;
    private final OrgAccessConfig config;
    private final ExecutionEnvironment environment;

    private S rootSession;

    /**
     * 생성자.
     *
     * @param credentialProvider 자격 증명 Provider
     * @param config org 접근 설정
     * @param environment 실행 환경
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public RootSessionResolver(CredentialProvider<S> credentialProvider,
                               OrgAccessConfig config,
                               ExecutionEnvironment environment) {
        if (credentialProvider == null) {
            throw new IllegalArgumentException("credentialProvider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        this.credentialProvider = credentialProvider;
        this.config = config;
        this.environment = environment;
    }

    /**
     * Root 세션 조회 (최초 호출 시 해석).
     *
     * @return memoize된 root 세션
     * @throws com.ryuqq.fanout.core.identity.IdentityResolutionException org-access-role assume이 거부된 경우
     */
    public synchronized S getRootSession() {
        if (rootSession == null) {
            rootSession = resolve();
        }
        return rootSession;
    }

    private S resolve() {
        String orgAccessRole = config.orgAccessRole();
        S local = credentialProvider.localIdentity();

        if (orgAccessRole == null) {
            log.debug("No {} configured, using local identity as root session", OrgAccessConfig.ORG_ACCESS_ROLE_KEY);
            return local;
        }
        if (environment.serverlessTrigger() && config.memberRoleBound()) {
            log.debug("Running in trigger context with member-role, using local identity as root session");
            return local;
        }

        log.info("Assuming org access role {}", orgAccessRole);
        return credentialProvider.assumeIdentity(
            RoleArn.of(orgAccessRole),
            SESSION_LABEL,
            config.region(),
            local
        );
    }
}
