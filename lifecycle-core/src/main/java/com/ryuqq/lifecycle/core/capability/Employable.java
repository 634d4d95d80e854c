package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;

/**
 * 고용/해고 가능한 엔티티.
 *
 * <p>정지(suspended) 또는 부상(injured) 상태의 엔티티도 고용 상태이므로
 * {@link #isEmployed()}는 true입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface Employable extends RosterEntity {

    /**
     * 현재 진행 중인 고용 기간이 있는지.
     *
     * @return 고용 중이면 true
     */
    boolean isEmployed();

    /**
     * 미래 시작일로 예약된 고용이 있는지.
     *
     * @return 예약된 고용이 있으면 true
     */
    boolean hasFutureEmployment();

    /**
     * 과거 고용이 해고(release)로 종료되었고 현재 고용 중이 아닌지.
     *
     * @return 해고 상태면 true
     */
    boolean isReleased();

    /**
     * 고용 가능 여부 검증.
     *
     * @throws com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException 이미 고용 중이거나
     *         고용이 예약된 경우
     */
    default void ensureCanBeEmployed() {
        StateTransition.validate(this, Transition.EMPLOY);
    }

    /**
     * 해고 가능 여부 검증.
     *
     * @throws com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException 미고용, 은퇴,
     *         고용 예약 상태인 경우
     */
    default void ensureCanBeReleased() {
        StateTransition.validate(this, Transition.RELEASE);
    }
}
