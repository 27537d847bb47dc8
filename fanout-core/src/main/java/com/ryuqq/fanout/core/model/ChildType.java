package com.ryuqq.fanout.core.model;

/**
 * Organization 트리 노드의 자식 유형.
 *
 * @author FanOut Team
 * @since 1.0.0
 */
public enum ChildType {

    /**
     * 멤버 계정.
     */
    ACCOUNT,

    /**
     * 하위 Organizational Unit.
     */
    ORGANIZATIONAL_UNIT
}
