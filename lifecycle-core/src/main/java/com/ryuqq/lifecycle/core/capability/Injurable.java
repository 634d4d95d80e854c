package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;

/**
 * 부상 처리 가능한 엔티티 (개인 엔티티만 해당).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface Injurable extends RosterEntity {

    /**
     * 진행 중인 부상 기간이 있는지.
     *
     * @return 부상 중이면 true
     */
    boolean isInjured();

    default boolean isHealthy() {
        return !isInjured();
    }

    /**
     * 부상 처리 가능 여부 검증 (고용 중이고 정지·부상·은퇴 상태가 아닐 때만 허용).
     */
    default void ensureCanBeInjured() {
        StateTransition.validate(this, Transition.INJURE);
    }
}
