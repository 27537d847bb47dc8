package com.ryuqq.fanout.core.statemachine;

/**
 * 계정 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING → IDENTITY_RESOLVED</li>
 *   <li>PENDING → IDENTITY_FAILED</li>
 *   <li>IDENTITY_RESOLVED → DONE</li>
 *   <li>IDENTITY_FAILED → DONE</li>
 * </ul>
 *
 * <p>DONE에서는 어떤 상태로도 전이할 수 없습니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public final class AccountStateTransition {

    // Utility class - prevent instantiation
    private AccountStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(AccountState from, AccountState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case PENDING -> to == AccountState.IDENTITY_RESOLVED || to == AccountState.IDENTITY_FAILED;
            case IDENTITY_RESOLVED, IDENTITY_FAILED -> to == AccountState.DONE;
            case DONE -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static AccountState transition(AccountState current, AccountState next) {
        validate(current, next);
        return next;
    }
}
