package com.ryuqq.fanout.core.identity;

import com.ryuqq.fanout.core.model.RoleArn;

/**
 * Role assume 실패.
 *
 * <p>Credential provider가 assume을 거부한 경우 (AccessDenied, 정지된 계정 등)
 * 발생합니다. 해당 계정은 BatchResult에서 제외되고 배치는 계속 진행됩니다.</p>
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public class IdentityResolutionException extends RuntimeException {

    private final RoleArn roleArn;

    /**
     * 생성자.
     *
     * @param roleArn assume 대상 Role
     * @param message 오류 메시지
     * @param cause 원인 (null 허용)
     */
    public IdentityResolutionException(RoleArn roleArn, String message, Throwable cause) {
        super(message, cause);
        this.roleArn = roleArn;
    }

    /**
     * 원인 없이 생성.
     *
     * @param roleArn assume 대상 Role
     * @param message 오류 메시지
     */
    public IdentityResolutionException(RoleArn roleArn, String message) {
        this(roleArn, message, null);
    }

    /**
     * assume 대상 Role 조회.
     *
     * @return Role ARN
     */
    public RoleArn getRoleArn() {
        return roleArn;
    }
}
