package com.ryuqq.fanout.adapter.runner;

import java.util.List;

/**
 * FanOutExecutor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 동시 처리 worker 수 (기본 8)</li>
 *   <li>regions: 계정마다 순회할 리전 목록 (기본 us-east-1)</li>
 *   <li>sessionRefreshWindowMs: 캐시된 계정 세션을 만료 전에 갱신하는 여유 시간 (기본 300000ms = 5분)</li>
 *   <li>shutdownTimeoutMs: graceful shutdown 대기 시간 (기본 60000ms)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>계정 수가 많고 연산이 I/O 위주: concurrency 증가 (8 → 16~32)</li>
 *   <li>자격 증명 API throttling 발생: concurrency 감소</li>
 * </ul>
 *
 * @author FanOut Team
 * @since 1.0.0
 * @param concurrency 동시 처리 worker 수 (1 이상이어야 함)
 * @param regions 리전 목록 (비어있을 수 없음, blank 항목 불가)
 * @param sessionRefreshWindowMs 세션 갱신 여유 시간 (밀리초, 0 이상이어야 함)
 * @param shutdownTimeoutMs shutdown 대기 시간 (밀리초, 양수여야 함)
 */
public record FanOutConfig(
    int concurrency,
    List<String> regions,
    long sessionRefreshWindowMs,
    long shutdownTimeoutMs
) {

    public static final String DEFAULT_REGION = "us-east-1";

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: concurrency=8, regions=[us-east-1], sessionRefreshWindowMs=300000ms,
     * shutdownTimeoutMs=60000ms</p>
     */
    public FanOutConfig() {
        this(8, List.of(DEFAULT_REGION), 300000, 60000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FanOutConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (regions == null || regions.isEmpty()) {
            throw new IllegalArgumentException("regions cannot be null or empty");
        }
        for (String region : regions) {
            if (region == null || region.isBlank()) {
                throw new IllegalArgumentException("regions cannot contain null or blank entries (current: " + regions + ")");
            }
        }
        if (sessionRefreshWindowMs < 0) {
            throw new IllegalArgumentException(
                "sessionRefreshWindowMs cannot be negative (current: " + sessionRefreshWindowMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
        regions = List.copyOf(regions);
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withConcurrency(int concurrency) {
        return new FanOutConfig(concurrency, regions, sessionRefreshWindowMs, shutdownTimeoutMs);
    }

    /**
     * regions만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withRegions(List<String> regions) {
        return new FanOutConfig(concurrency, regions, sessionRefreshWindowMs, shutdownTimeoutMs);
    }

    /**
     * sessionRefreshWindowMs만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withSessionRefreshWindowMs(long sessionRefreshWindowMs) {
        return new FanOutConfig(concurrency, regions, sessionRefreshWindowMs, shutdownTimeoutMs);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public FanOutConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new FanOutConfig(concurrency, regions, sessionRefreshWindowMs, shutdownTimeoutMs);
    }
}
