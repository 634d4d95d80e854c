package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * 엔티티 유형이 전이에 필요한 capability를 선언하지 않은 경우.
 *
 * <p>저장소 변경 전에 발생하므로 부분 상태 변경이 남지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class UnsupportedCapabilityException extends ValidationException {

    public static final String CODE = "LIFECYCLE-VALIDATION-002";

    private final EntityKey entityKey;
    private final Transition transition;

    public UnsupportedCapabilityException(EntityKey entityKey, Transition transition) {
        super(CODE, String.format("%s does not support transition '%s'", entityKey, transition));
        this.entityKey = entityKey;
        this.transition = transition;
    }

    public EntityKey getEntityKey() {
        return entityKey;
    }

    public Transition getTransition() {
        return transition;
    }
}
