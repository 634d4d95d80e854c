package com.ryuqq.lifecycle.core.exception;

import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * 현재 상태에서 허용되지 않는 전이를 시도한 경우.
 *
 * <p>메시지 형식: {@code This wrestler 'Hulk' is unemployed and cannot be retired.}</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class TransitionNotAllowedException extends ValidationException {

    public static final String CODE = "LIFECYCLE-VALIDATION-001";

    private final EntityKey entityKey;
    private final Transition transition;

    public TransitionNotAllowedException(EntityKey entityKey, Transition transition, String message) {
        super(CODE, message);
        this.entityKey = entityKey;
        this.transition = transition;
    }

    /**
     * 상태 사유로 거부된 전이.
     *
     * @param key 엔티티 키
     * @param name 엔티티 이름
     * @param transition 시도한 전이
     * @param reason 현재 상태 설명 (예: "unemployed", "already suspended")
     * @return 예외 인스턴스
     */
    public static TransitionNotAllowedException because(
            EntityKey key, String name, Transition transition, String reason) {
        String message = String.format(
            "This %s '%s' is %s and cannot be %s.",
            key.type().label().toLowerCase(java.util.Locale.ROOT),
            name,
            reason,
            transition.pastTense()
        );
        return new TransitionNotAllowedException(key, transition, message);
    }

    public EntityKey getEntityKey() {
        return entityKey;
    }

    public Transition getTransition() {
        return transition;
    }
}
