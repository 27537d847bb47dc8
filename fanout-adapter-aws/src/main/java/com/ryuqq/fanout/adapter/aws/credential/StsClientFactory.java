package com.ryuqq.fanout.adapter.aws.credential;

import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClient;

/**
 * 부모 세션의 자격 증명으로 STS 클라이언트를 생성합니다.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StsClientFactory {

    /**
     * STS 클라이언트 생성.
     *
     * @param credentialsProvider assume을 수행할 자격 증명
     * @param region STS 엔드포인트 리전
     * @return 새 클라이언트 (호출자가 close)
     */
    StsClient create(AwsCredentialsProvider credentialsProvider, String region);

    /**
     * SDK 기본 빌더를 사용하는 팩토리.
     *
     * @return 기본 팩토리
     */
    static StsClientFactory standard() {
        return (credentialsProvider, region) -> StsClient.builder()
            .credentialsProvider(credentialsProvider)
            .region(Region.of(region))
            .build();
    }
}
