package com.ryuqq.fanout.core.identity;

import com.ryuqq.fanout.core.model.RoleArn;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Assume된 identity handle.
 *
 * <p>특정 Role에 바인딩된 불투명한 자격 증명 객체입니다. 리전에 종속되지 않으며,
 * 리전은 사용 시점에 호출자가 지정합니다.</p>
 *
 * <p>구현체는 불변이어야 합니다. 루트 세션은 여러 worker가 동기화 없이 공유해서 읽습니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public interface IdentitySession {

    /**
     * 이 세션이 바인딩된 Role.
     *
     * @return Role ARN (실행 환경의 기본 identity인 경우 empty)
     */
    Optional<RoleArn> roleArn();

    /**
     * 자격 증명 만료 시각.
     *
     * @return 만료 시각 (만료 정보가 없으면 empty)
     */
    Optional<Instant> expiration();

    /**
     * 주어진 시각 기준으로 window 이내에 만료되는지 확인.
     *
     * <p>만료 정보가 없는 세션은 만료되지 않는 것으로 간주합니다.</p>
     *
     * @param now 기준 시각
     * @param window 갱신 여유 시간
     * @return window 이내 만료 여부
     */
    default boolean expiresWithin(Instant now, Duration window) {
        return expiration()
            .map(expiresAt -> !now.plus(window).isBefore(expiresAt))
            .orElse(false);
    }
}
