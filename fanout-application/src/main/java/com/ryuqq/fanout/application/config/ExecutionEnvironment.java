package com.ryuqq.fanout.application.config;

import java.util.Map;

/**
 * 실행 환경 신호.
 *
 * <p>root identity 해석과 기본 계정 Role 선택에 영향을 주는 환경 정보입니다.</p>
 *
 * <ul>
 *   <li>serverlessTrigger: 서버리스 함수(트리거) 안에서 실행 중 ({@value #SERVERLESS_MARKER} 존재)</li>
 *   <li>controlTowerOrg: Control Tower 관리 landing zone ({@value #CONTROL_TOWER_MARKER} 값이 비어있지 않음)</li>
 * </ul>
 *
 * @param serverlessTrigger 서버리스 트리거 컨텍스트 여부
 * @param controlTowerOrg Control Tower 배포 여부
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public record ExecutionEnvironment(
    boolean serverlessTrigger,
    boolean controlTowerOrg
) {

    public static final String SERVERLESS_MARKER = "LAMBDA_TASK_ROOT";

    public static final String CONTROL_TOWER_MARKER = "AWS_CONTROL_TOWER_ORG";

    /**
     * 신호가 없는 환경 (로컬 CLI 실행).
     *
     * @return 기본 ExecutionEnvironment
     */
    public static ExecutionEnvironment standalone() {
        return new ExecutionEnvironment(false, false);
    }

    /**
     * 프로세스 환경 변수로부터 생성.
     *
     * @return ExecutionEnvironment
     */
    public static ExecutionEnvironment fromSystem() {
        return from(System.getenv());
    }

    /**
     * 환경 변수 Map으로부터 생성.
     *
     * @param env 환경 변수
     * @return ExecutionEnvironment
     * @throws IllegalArgumentException env가 null인 경우
     */
    public static ExecutionEnvironment from(Map<String, String> env) {
        if (env == null) {
            throw new IllegalArgumentException("env cannot be null");
        }
        String controlTower = env.get(CONTROL_TOWER_MARKER);
        return new ExecutionEnvironment(
            env.containsKey(SERVERLESS_MARKER),
            controlTower != null && !controlTower.isEmpty()
        );
    }
}
