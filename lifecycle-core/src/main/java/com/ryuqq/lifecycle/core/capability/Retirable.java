package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;

/**
 * 은퇴 가능한 엔티티.
 *
 * <p>은퇴는 종료 상태가 아닙니다. 다시 고용하면 은퇴 기간이 먼저 종료됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface Retirable extends RosterEntity {

    /**
     * 진행 중인 은퇴 기간이 있는지.
     *
     * @return 은퇴 상태면 true
     */
    boolean isRetired();

    /**
     * 은퇴 가능 여부 검증.
     */
    default void ensureCanBeRetired() {
        StateTransition.validate(this, Transition.RETIRE);
    }
}
