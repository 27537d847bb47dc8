package com.ryuqq.fanout.core.model;

/**
 * Organization 정책 유형.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public enum PolicyType {

    SERVICE_CONTROL_POLICY,
    TAG_POLICY,
    BACKUP_POLICY,
    AISERVICES_OPT_OUT_POLICY;

    /**
     * 기본 정책 유형 (SCP).
     */
    public static final PolicyType DEFAULT = SERVICE_CONTROL_POLICY;
}
