package com.ryuqq.fanout.adapter.inmemory.credential;

import com.ryuqq.fanout.core.identity.IdentityResolutionException;
import com.ryuqq.fanout.core.model.RoleArn;
import com.ryuqq.fanout.core.spi.CredentialProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * In-memory implementation of {@link CredentialProvider} for testing and reference purposes.
 *
 * <p>Every successful assume issues a new {@link InMemoryIdentitySession} and records the call,
 * so callers can verify how many assumptions a cache actually triggered.</p>
 *
 * <p><strong>Failure injection:</strong></p>
 * <ul>
 *   <li>{@link #deny(RoleArn)}: assume of a specific role is rejected</li>
 *   <li>{@link #denyAccount(String)}: any role inside an account is rejected (suspended account)</li>
 * </ul>
 *
 * <p><strong>Thread Safety:</strong> all state lives in concurrent collections.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public class InMemoryCredentialProvider implements CredentialProvider<InMemoryIdentitySession> {

    private final InMemoryIdentitySession localIdentity = InMemoryIdentitySession.local();
    private final Set<RoleArn> deniedRoles = ConcurrentHashMap.newKeySet();
    private final Set<String> deniedAccounts = ConcurrentHashMap.newKeySet();
    private final ConcurrentLinkedQueue<AssumeCall> calls = new ConcurrentLinkedQueue<>();
    private final Clock clock;
    private volatile Duration sessionDuration;

    /**
     * 만료 없는 세션을 발급하는 Provider 생성.
     */
    public InMemoryCredentialProvider() {
        this(Clock.systemUTC(), null);
    }

    /**
     * 만료 시각이 있는 세션을 발급하는 Provider 생성.
     *
     * @param clock 만료 시각 계산 기준
     * @param sessionDuration 세션 유효 기간 (null이면 만료 없음)
     */
    public InMemoryCredentialProvider(Clock clock, Duration sessionDuration) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
        this.sessionDuration = sessionDuration;
    }

    @Override
    public InMemoryIdentitySession localIdentity() {
        return localIdentity;
    }

    @Override
    public InMemoryIdentitySession assumeIdentity(RoleArn roleArn, String sessionLabel, String region,
                                                  InMemoryIdentitySession parent) {
        if (roleArn == null) {
            throw new IllegalArgumentException("roleArn cannot be null");
        }
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }

        calls.add(new AssumeCall(roleArn, sessionLabel, region, parent));

        if (deniedRoles.contains(roleArn) || deniedAccounts.contains(accountIdOf(roleArn))) {
            throw new IdentityResolutionException(roleArn,
                "AccessDenied: not authorized to assume " + roleArn.getValue());
        }

        Duration duration = sessionDuration;
        Instant expiresAt = duration == null ? null : clock.instant().plus(duration);
        return new InMemoryIdentitySession(roleArn, sessionLabel, region, parent, expiresAt);
    }

    /**
     * 특정 Role의 assume을 거부하도록 설정.
     *
     * @param roleArn 거부할 Role
     */
    public void deny(RoleArn roleArn) {
        deniedRoles.add(roleArn);
    }

    /**
     * 계정 내 모든 Role의 assume을 거부하도록 설정.
     *
     * @param accountId 거부할 계정 ID
     */
    public void denyAccount(String accountId) {
        deniedAccounts.add(accountId);
    }

    /**
     * 이후 발급되는 세션의 유효 기간 변경.
     *
     * @param sessionDuration 유효 기간 (null이면 만료 없음)
     */
    public void setSessionDuration(Duration sessionDuration) {
        this.sessionDuration = sessionDuration;
    }

    /**
     * 기록된 assume 호출 목록 (거부된 호출 포함).
     *
     * @return 호출 순서대로의 스냅샷
     */
    public List<AssumeCall> getCalls() {
        return List.copyOf(calls);
    }

    /**
     * 특정 Role에 대한 assume 호출 횟수.
     *
     * @param roleArn Role
     * @return 호출 횟수
     */
    public long assumeCount(RoleArn roleArn) {
        return calls.stream().filter(call -> call.roleArn().equals(roleArn)).count();
    }

    /**
     * 모든 상태 초기화 (테스트용).
     */
    public void clear() {
        deniedRoles.clear();
        deniedAccounts.clear();
        calls.clear();
    }

    private static String accountIdOf(RoleArn roleArn) {
        // arn:partition:iam::<accountId>:role/<name>
        String[] parts = roleArn.getValue().split(":");
        return parts.length > 4 ? parts[4] : "";
    }

    /**
     * 기록된 assume 호출.
     *
     * @param roleArn assume 대상 Role
     * @param sessionLabel 세션 이름
     * @param region 엔드포인트 리전
     * @param parent assume을 수행한 세션
     */
    public record AssumeCall(
        RoleArn roleArn,
        String sessionLabel,
        String region,
        InMemoryIdentitySession parent
    ) {
    }
}
