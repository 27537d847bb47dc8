package com.ryuqq.fanout.adapter.aws.credential;

import com.ryuqq.fanout.core.model.RoleArn;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.sts.StsClientBuilder;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * AwsIdentitySession 테스트.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
class AwsIdentitySessionTest {

    private static final RoleArn ROLE = RoleArn.of("arn:aws:iam::111111111111:role/OrganizationAccountAccessRole");
    private static final Instant EXPIRES_AT = Instant.parse("2026-01-01T01:00:00Z");

    private final AwsIdentitySession assumed = AwsIdentitySession.assumed(
        ROLE,
        AwsSessionCredentials.create("ASIAKEY", "SECRET", "TOKEN"),
        EXPIRES_AT,
        "us-east-1"
    );

    @Test
    void assumed_세션은_만료_시각_기준으로_갱신_여부를_판단함() {
        assertThat(assumed.expiresWithin(EXPIRES_AT.minus(Duration.ofMinutes(10)), Duration.ofMinutes(5))).isFalse();
        assertThat(assumed.expiresWithin(EXPIRES_AT.minus(Duration.ofMinutes(3)), Duration.ofMinutes(5))).isTrue();
    }

    @Test
    void local_세션은_만료되지_않음() {
        AwsIdentitySession local = AwsIdentitySession.local(
            StaticCredentialsProvider.create(AwsBasicCredentials.create("KEY", "SECRET")), "us-east-1");

        assertThat(local.roleArn()).isEmpty();
        assertThat(local.expiresWithin(Instant.MAX.minusSeconds(1), Duration.ZERO)).isFalse();
    }

    @Test
    void configure_빌더에_자격_증명과_리전을_설정함() {
        StsClientBuilder builder = mock(StsClientBuilder.class, RETURNS_SELF);

        StsClientBuilder configured = assumed.configure(builder, "eu-west-1");

        assertThat(configured).isSameAs(builder);
        verify(builder).credentialsProvider(assumed.getCredentialsProvider());
        verify(builder).region(Region.EU_WEST_1);
    }

    @Test
    void 필수_값이_없으면_예외() {
        assertThatThrownBy(() -> AwsIdentitySession.assumed(null, AwsSessionCredentials.create("a", "b", "c"), null, "us-east-1"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AwsIdentitySession.assumed(ROLE, null, null, "us-east-1"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AwsIdentitySession.local(null, "us-east-1"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> AwsIdentitySession.local(
            StaticCredentialsProvider.create(AwsBasicCredentials.create("KEY", "SECRET")), " "))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
