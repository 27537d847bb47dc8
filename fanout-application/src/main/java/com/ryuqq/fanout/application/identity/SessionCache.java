package com.ryuqq.fanout.application.identity;

import com.ryuqq.fanout.application.config.OrgAccessConfig;
import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.Account;
import com.ryuqq.fanout.core.model.RoleArn;
import com.ryuqq.fanout.core.spi.CredentialProvider;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Worker 전용 계정 세션 캐시.
 *
 * <p>해석된 Role ARN을 키로 assume된 세션을 보관합니다.</p>
 *
 * <p><strong>단일 소유자 불변식:</strong></p>
 * <ul>
 *   <li>하나의 캐시는 하나의 worker 스레드만 사용합니다 (최초 호출 스레드에 바인딩)</li>
 *   <li>다른 스레드에서 호출하면 {@link IllegalStateException}</li>
 *   <li>따라서 내부 Map은 락 없이 변경됩니다</li>
 *   <li>worker 간 공유가 없으므로 같은 Role을 여러 worker가 각각 assume할 수 있습니다</li>
 * </ul>
 *
 * <p><strong>만료 처리:</strong> 캐시된 세션이 refreshWindow 이내에 만료되면
 * 다시 assume하여 교체합니다. 만료 정보가 없는 세션은 계속 재사용됩니다.</p>
 *
 * @param <S> 세션 타입
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class SessionCache<S extends IdentitySession> {

    private final CredentialProvider<S> credentialProvider;
    private final OrgAccessConfig config;
    private final Clock clock;
    private final Duration refreshWindow;
    private final Map<RoleArn, S> sessions = new HashMap<>();

    private volatile Thread owner;

    /**
     * 생성자.
     *
     * @param credentialProvider 자격 증명 Provider
     * @param config org 접근 설정 (partition, region)
     * @param clock 만료 판단 기준 시계
     * @param refreshWindow 만료 전 갱신 여유 시간 (음수 불가)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SessionCache(CredentialProvider<S> credentialProvider,
                        OrgAccessConfig config,
                        Clock clock,
                        Duration refreshWindow) {
        if (credentialProvider == null) {
            throw new IllegalArgumentException("credentialProvider cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (refreshWindow == null || refreshWindow.isNegative()) {
            throw new IllegalArgumentException("refreshWindow cannot be null or negative");
        }
        this.credentialProvider = credentialProvider;
        this.config = config;
        this.clock = clock;
        this.refreshWindow = refreshWindow;
    }

    /**
     * 계정 세션 해석.
     *
     * <p>캐시 hit이면 같은 인스턴스를 반환하고 assume을 호출하지 않습니다.
     * miss 또는 만료 임박이면 rootSession으로 assume하여 저장합니다.</p>
     *
     * @param rootSession assume을 수행할 root 세션
     * @param account 대상 계정
     * @param roleTemplate 계정 Role 이름 또는 ARN 템플릿
     * @return 계정 세션
     * @throws IllegalStateException 소유 스레드가 아닌 스레드에서 호출된 경우
     * @throws com.ryuqq.fanout.core.identity.IdentityResolutionException assume이 거부된 경우
     */
    public S resolveIdentity(S rootSession, Account account, String roleTemplate) {
        checkOwner();
        RoleArn roleArn = RoleArn.forAccount(roleTemplate, account.id(), config.partition());

        S cached = sessions.get(roleArn);
        if (cached != null && !cached.expiresWithin(clock.instant(), refreshWindow)) {
            return cached;
        }

        S session = credentialProvider.assumeIdentity(
            roleArn,
            RootSessionResolver.SESSION_LABEL,
            config.region(),
            rootSession
        );
        sessions.put(roleArn, session);
        return session;
    }

    /**
     * 캐시된 세션 수.
     *
     * @return 항목 수
     */
    public int size() {
        return sessions.size();
    }

    private void checkOwner() {
        Thread current = Thread.currentThread();
        if (owner == null) {
            owner = current;
        } else if (owner != current) {
            throw new IllegalStateException(
                "SessionCache is owned by " + owner.getName() + " but was used from " + current.getName()
            );
        }
    }
}
