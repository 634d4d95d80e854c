package com.ryuqq.lifecycle.application.validation;

import com.ryuqq.lifecycle.application.transition.ValidationStrategy;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.HasWrestlers;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException;
import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.statemachine.RosterState;
import com.ryuqq.lifecycle.core.statemachine.StateTransition;

import java.util.List;

/**
 * 팀 단위 전이의 멤버 상태 검증.
 *
 * <p><strong>태그팀 은퇴:</strong></p>
 * <ul>
 *   <li>현재 레슬러가 없으면 거부</li>
 *   <li>부상 또는 정지 중인 레슬러가 있으면 거부</li>
 *   <li>은퇴할 수 없는 상태의 레슬러가 있으면 거부</li>
 * </ul>
 *
 * <p><strong>태그팀 정지:</strong></p>
 * <ul>
 *   <li>현재 레슬러가 없으면 거부</li>
 *   <li>이미 정지됐거나 부상 중인 레슬러가 있으면 거부</li>
 *   <li>정지할 수 없는 상태의 레슬러가 있으면 거부</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class MemberValidations {

    private MemberValidations() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static ValidationStrategy teamRetirement() {
        return (entity, transition) -> {
            if (transition == Transition.RETIRE) {
                validateMembers(entity, transition);
            }
        };
    }

    public static ValidationStrategy teamSuspension() {
        return (entity, transition) -> {
            if (transition == Transition.SUSPEND) {
                validateMembers(entity, transition);
            }
        };
    }

    private static void validateMembers(RosterEntity team, Transition transition) {
        if (!(team instanceof HasWrestlers group)) {
            return;
        }
        List<RosterEntity> wrestlers = group.currentWrestlers();
        if (wrestlers.isEmpty()) {
            throw reject(team, transition, "has no current wrestlers");
        }
        for (RosterEntity wrestler : wrestlers) {
            if (Capabilities.isInjured(wrestler)) {
                throw reject(team, transition, "has an injured wrestler ('" + wrestler.name() + "')");
            }
            if (Capabilities.isSuspended(wrestler)) {
                throw reject(team, transition, "has a suspended wrestler ('" + wrestler.name() + "')");
            }
            if (!Capabilities.supports(wrestler, transition)
                || !StateTransition.isAllowed(RosterState.of(wrestler), transition)) {
                throw reject(team, transition, "has a wrestler ('" + wrestler.name() + "') who cannot be " + transition.pastTense());
            }
        }
    }

    private static TransitionNotAllowedException reject(RosterEntity team, Transition transition, String reason) {
        return new TransitionNotAllowedException(
            team.key(),
            transition,
            String.format("%s '%s' %s and cannot be %s.", team.type().label(), team.name(), reason, transition.pastTense())
        );
    }
}
