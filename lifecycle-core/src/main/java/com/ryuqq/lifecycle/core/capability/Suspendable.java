package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;

/**
 * 정지/복귀 가능한 엔티티.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface Suspendable extends RosterEntity {

    /**
     * 진행 중인 정지 기간이 있는지.
     *
     * @return 정지 중이면 true
     */
    boolean isSuspended();

    /**
     * 정지 가능 여부 검증 (고용 중인 경우에만 허용).
     */
    default void ensureCanBeSuspended() {
        StateTransition.validate(this, Transition.SUSPEND);
    }

    /**
     * 복귀 가능 여부 검증 (정지 중인 경우에만 허용).
     */
    default void ensureCanBeReinstated() {
        StateTransition.validate(this, Transition.REINSTATE);
    }
}
