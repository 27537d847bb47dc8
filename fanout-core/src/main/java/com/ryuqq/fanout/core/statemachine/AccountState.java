package com.ryuqq.fanout.core.statemachine;

/**
 * 계정 단위 fan-out 작업의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING
 *    │
 *    ├─► IDENTITY_RESOLVED ──► DONE (모든 리전 처리 완료)
 *    │
 *    └─► IDENTITY_FAILED ────► DONE (결과에서 제외)
 * </pre>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public enum AccountState {

    /**
     * 대기 중 (아직 identity 해석 전).
     */
    PENDING,

    /**
     * 계정 Role assume 성공. 리전 순회 중.
     */
    IDENTITY_RESOLVED,

    /**
     * 계정 Role assume 실패. BatchResult에 포함되지 않음.
     */
    IDENTITY_FAILED,

    /**
     * 종료.
     */
    DONE;

    /**
     * 종료 상태인지 확인.
     *
     * @return DONE인 경우 true
     */
    public boolean isTerminal() {
        return this == DONE;
    }
}
