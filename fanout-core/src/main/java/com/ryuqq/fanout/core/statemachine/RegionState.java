package com.ryuqq.fanout.core.statemachine;

/**
 * (계정, 리전) 단위 실행 상태.
 *
 * <pre>
 * RUNNING ─► SUCCEEDED
 *        └─► FAILED
 * </pre>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public enum RegionState {

    RUNNING,

    SUCCEEDED,

    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return SUCCEEDED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
