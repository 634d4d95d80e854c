package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * 로스터 상태 전이 규칙.
 *
 * <p><strong>허용되는 전이 (출발 상태):</strong></p>
 * <ul>
 *   <li>employ: UNEMPLOYED, RELEASED, RETIRED (은퇴 기간을 먼저 종료)</li>
 *   <li>release: EMPLOYED, SUSPENDED, INJURED</li>
 *   <li>suspend: EMPLOYED</li>
 *   <li>reinstate: SUSPENDED</li>
 *   <li>retire: EMPLOYED, SUSPENDED, INJURED</li>
 *   <li>injure: EMPLOYED</li>
 * </ul>
 *
 * <p>그 외 조합은 모두 {@link TransitionNotAllowedException}입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태에서 전이가 허용되는지 확인.
     *
     * @param from 현재 상태
     * @param transition 전이
     * @return 허용되면 true
     * @throws IllegalArgumentException from 또는 transition이 null인 경우
     */
    public static boolean isAllowed(RosterState from, Transition transition) {
        if (from == null || transition == null) {
            throw new IllegalArgumentException(
                "State and transition cannot be null (from: " + from + ", transition: " + transition + ")"
            );
        }
        return switch (transition) {
            case EMPLOY -> from == RosterState.UNEMPLOYED
                || from == RosterState.RELEASED
                || from == RosterState.RETIRED;
            case RELEASE, RETIRE -> from == RosterState.EMPLOYED
                || from == RosterState.SUSPENDED
                || from == RosterState.INJURED;
            case SUSPEND, INJURE -> from == RosterState.EMPLOYED;
            case REINSTATE -> from == RosterState.SUSPENDED;
        };
    }

    /**
     * 엔티티의 현재 상태에서 전이가 허용되는지 검증.
     *
     * @param entity 대상 엔티티
     * @param transition 전이
     * @throws IllegalArgumentException entity 또는 transition이 null인 경우
     * @throws TransitionNotAllowedException 허용되지 않는 전이인 경우
     */
    public static void validate(RosterEntity entity, Transition transition) {
        if (entity == null || transition == null) {
            throw new IllegalArgumentException("entity and transition cannot be null");
        }
        RosterState current = RosterState.of(entity);
        if (!isAllowed(current, transition)) {
            throw TransitionNotAllowedException.because(entity.key(), entity.name(), transition, reason(current, transition));
        }
    }

    /**
     * 전이 적용 결과 상태.
     *
     * <p>검증을 통과한 경우에만 다음 상태를 반환합니다.</p>
     *
     * @param current 현재 상태
     * @param transition 전이
     * @return 전이 후 상태
     * @throws IllegalStateException 허용되지 않는 전이인 경우
     */
    public static RosterState next(RosterState current, Transition transition) {
        if (!isAllowed(current, transition)) {
            throw new IllegalStateException(
                String.format("Invalid roster transition: %s → %s", current, transition)
            );
        }
        return switch (transition) {
            case EMPLOY, REINSTATE -> RosterState.EMPLOYED;
            case RELEASE -> RosterState.RELEASED;
            case SUSPEND -> RosterState.SUSPENDED;
            case RETIRE -> RosterState.RETIRED;
            case INJURE -> RosterState.INJURED;
        };
    }

    private static String reason(RosterState current, Transition transition) {
        boolean repeated = switch (transition) {
            case EMPLOY -> current == RosterState.EMPLOYED;
            case SUSPEND -> current == RosterState.SUSPENDED;
            case INJURE -> current == RosterState.INJURED;
            case RETIRE -> current == RosterState.RETIRED;
            case RELEASE -> current == RosterState.RELEASED;
            case REINSTATE -> false;
        };
        return repeated ? "already " + current.description() : current.description();
    }
}
