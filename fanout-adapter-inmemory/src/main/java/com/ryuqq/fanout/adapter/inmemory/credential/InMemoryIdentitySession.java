package com.ryuqq.fanout.adapter.inmemory.credential;

import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.RoleArn;

import java.time.Instant;
import java.util.Optional;

/**
 * In-memory identity handle.
 *
 * <p>Immutable. Equality is reference based, so tests can assert that a cache returned
 * the very same handle rather than an equivalent one.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class InMemoryIdentitySession implements IdentitySession {

    private final RoleArn roleArn;
    private final String sessionLabel;
    private final String region;
    private final InMemoryIdentitySession parent;
    private final Instant expiresAt;

    InMemoryIdentitySession(RoleArn roleArn, String sessionLabel, String region,
                            InMemoryIdentitySession parent, Instant expiresAt) {
        this.roleArn = roleArn;
        this.sessionLabel = sessionLabel;
        this.region = region;
        this.parent = parent;
        this.expiresAt = expiresAt;
    }

    /**
     * 실행 환경 기본 identity 생성.
     *
     * @return Role, 만료 정보가 없는 로컬 세션
     */
    public static InMemoryIdentitySession local() {
        return new InMemoryIdentitySession(null, null, null, null, null);
    }

    @Override
    public Optional<RoleArn> roleArn() {
        return Optional.ofNullable(roleArn);
    }

    @Override
    public Optional<Instant> expiration() {
        return Optional.ofNullable(expiresAt);
    }

    public String getSessionLabel() {
        return sessionLabel;
    }

    public String getRegion() {
        return region;
    }

    /**
     * assume을 수행한 세션.
     *
     * @return parent 세션 (로컬 세션이면 empty)
     */
    public Optional<InMemoryIdentitySession> getParent() {
        return Optional.ofNullable(parent);
    }

    @Override
    public String toString() {
        return "InMemoryIdentitySession{" + (roleArn == null ? "local" : roleArn.getValue()) + '}';
    }
}
