package com.ryuqq.fanout.adapter.aws.credential;

import com.ryuqq.fanout.core.identity.IdentityResolutionException;
import com.ryuqq.fanout.core.model.RoleArn;
import com.ryuqq.fanout.core.spi.CredentialProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.awscore.exception.AwsServiceException;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.model.AssumeRoleRequest;
import software.amazon.awssdk.services.sts.model.AssumeRoleResponse;
import software.amazon.awssdk.services.sts.model.Credentials;

/**
 * STS 기반 CredentialProvider.
 *
 * <p>부모 세션의 자격 증명으로 {@code sts:AssumeRole}을 호출하여 임시 자격 증명을 발급받습니다.</p>
 *
 * <p><strong>오류 매핑:</strong></p>
 * <ul>
 *   <li>AwsServiceException (AccessDenied, RegionDisabled 등) → IdentityResolutionException</li>
 *   <li>SdkClientException (네트워크, 자격 증명 없음 등) → IdentityResolutionException</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public class StsCredentialProvider implements CredentialProvider<AwsIdentitySession> {

    private static final Logger log = LoggerFactory.getLogger(StsCredentialProvider.class);

    private final AwsIdentitySession localIdentity;
    private final StsClientFactory stsClientFactory;

    /**
     * 기본 자격 증명 체인을 사용하는 생성자.
     *
     * @param region 기본 리전
     */
    public StsCredentialProvider(String region) {
        this(DefaultCredentialsProvider.create(), region, StsClientFactory.standard());
    }

    /**
     * 생성자.
     *
     * @param localCredentials 실행 환경 자격 증명
     * @param region 기본 리전
     * @param stsClientFactory STS 클라이언트 팩토리
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public StsCredentialProvider(AwsCredentialsProvider localCredentials,
                                 String region,
                                 StsClientFactory stsClientFactory) {
        if (stsClientFactory == null) {
            throw new IllegalArgumentException("stsClientFactory cannot be null");
        }
        this.localIdentity = AwsIdentitySession.local(localCredentials, region);
        this.stsClientFactory = stsClientFactory;
    }

    @Override
    public AwsIdentitySession localIdentity() {
        return localIdentity;
    }

    @Override
    public AwsIdentitySession assumeIdentity(RoleArn roleArn, String sessionLabel, String region,
                                             AwsIdentitySession parent) {
        if (roleArn == null) {
            throw new IllegalArgumentException("roleArn cannot be null");
        }
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        String endpointRegion = region != null ? region : parent.getRegion();

        AssumeRoleRequest request = AssumeRoleRequest.builder()
            .roleArn(roleArn.getValue())
            .roleSessionName(sessionLabel)
            .build();

        try (StsClient sts = stsClientFactory.create(parent.getCredentialsProvider(), endpointRegion)) {
            AssumeRoleResponse response = sts.assumeRole(request);
            Credentials credentials = response.credentials();
            log.debug("Assumed role {} (expires {})", roleArn, credentials.expiration());

            return AwsIdentitySession.assumed(
                roleArn,
                AwsSessionCredentials.create(
                    credentials.accessKeyId(),
                    credentials.secretAccessKey(),
                    credentials.sessionToken()
                ),
                credentials.expiration(),
                endpointRegion
            );
        } catch (AwsServiceException e) {
            String code = e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : null;
            throw new IdentityResolutionException(roleArn,
                (code != null ? code : "AssumeRoleFailed") + ": " + e.getMessage(), e);
        } catch (SdkClientException e) {
            throw new IdentityResolutionException(roleArn, "AssumeRoleFailed: " + e.getMessage(), e);
        }
    }
}
