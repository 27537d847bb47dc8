package com.ryuqq.fanout.adapter.aws.credential;

import com.ryuqq.fanout.core.identity.IdentitySession;
import com.ryuqq.fanout.core.model.RoleArn;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.awscore.client.builder.AwsClientBuilder;
import software.amazon.awssdk.regions.Region;

import java.time.Instant;
import java.util.Optional;

/**
 * AWS 자격 증명 세션.
 *
 * <p>assume된 세션은 고정된 임시 자격 증명({@link StaticCredentialsProvider})을 가지며,
 * 로컬 세션은 기본 자격 증명 체인을 그대로 사용합니다.</p>
 *
 * <p>세션은 리전에 종속되지 않습니다. 클라이언트를 만들 때
 * {@link #configure(AwsClientBuilder, String)}로 리전을 지정합니다:</p>
 * <pre>{@code
 * Ec2Client ec2 = session.configure(Ec2Client.builder(), region).build();
 * }</pre>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class AwsIdentitySession implements IdentitySession {

    private final RoleArn roleArn;
    private final AwsCredentialsProvider credentialsProvider;
    private final Instant expiration;
    private final String region;

    private AwsIdentitySession(RoleArn roleArn,
                               AwsCredentialsProvider credentialsProvider,
                               Instant expiration,
                               String region) {
        if (credentialsProvider == null) {
            throw new IllegalArgumentException("credentialsProvider cannot be null");
        }
        if (region == null || region.isBlank()) {
            throw new IllegalArgumentException("region cannot be null or blank");
        }
        this.roleArn = roleArn;
        this.credentialsProvider = credentialsProvider;
        this.expiration = expiration;
        this.region = region;
    }

    /**
     * 실행 환경의 기본 identity 세션 생성.
     *
     * @param credentialsProvider 기본 자격 증명 Provider
     * @param region 기본 리전
     * @return 로컬 세션 (Role, 만료 정보 없음)
     */
    public static AwsIdentitySession local(AwsCredentialsProvider credentialsProvider, String region) {
        return new AwsIdentitySession(null, credentialsProvider, null, region);
    }

    /**
     * assume 결과로 세션 생성.
     *
     * @param roleArn assume한 Role
     * @param credentials 임시 자격 증명
     * @param expiration 만료 시각 (null 허용)
     * @param region 기본 리전
     * @return assume된 세션
     */
    public static AwsIdentitySession assumed(RoleArn roleArn,
                                             AwsSessionCredentials credentials,
                                             Instant expiration,
                                             String region) {
        if (roleArn == null) {
            throw new IllegalArgumentException("roleArn cannot be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials cannot be null");
        }
        return new AwsIdentitySession(roleArn, StaticCredentialsProvider.create(credentials), expiration, region);
    }

    @Override
    public Optional<RoleArn> roleArn() {
        return Optional.ofNullable(roleArn);
    }

    @Override
    public Optional<Instant> expiration() {
        return Optional.ofNullable(expiration);
    }

    public AwsCredentialsProvider getCredentialsProvider() {
        return credentialsProvider;
    }

    public String getRegion() {
        return region;
    }

    /**
     * 클라이언트 빌더에 이 세션의 자격 증명과 리전을 설정.
     *
     * @param builder 서비스 클라이언트 빌더
     * @param region 대상 리전
     * @param <B> 빌더 타입
     * @param <C> 클라이언트 타입
     * @return 설정된 빌더
     */
    public <B extends AwsClientBuilder<B, C>, C> B configure(B builder, String region) {
        return builder
            .credentialsProvider(credentialsProvider)
            .region(Region.of(region));
    }

    @Override
    public String toString() {
        return "AwsIdentitySession{roleArn=" + (roleArn == null ? "local" : roleArn.getValue())
            + ", region=" + region + ", expiration=" + expiration + "}";
    }
}
