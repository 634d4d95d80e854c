package com.ryuqq.lifecycle.application.cascade;

import com.ryuqq.lifecycle.application.transition.CascadeStrategy;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.ManagesMembers;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * 복귀(reinstate) cascade 전략 모음.
 *
 * <ul>
 *   <li>{@link #wrestlers()}: 정지된 레슬러 복귀 (태그팀 복귀 시)</li>
 *   <li>{@link #managers()}: 정지된 매니저 복귀. 단, 매니저가 관리하는 다른
 *       레슬러/태그팀 중 여전히 정지된 대상이 있으면 복귀시키지 않음</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class ReinstatementCascadeStrategy {

    private ReinstatementCascadeStrategy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static CascadeStrategy wrestlers() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.REINSTATE) {
                return;
            }
            for (RosterEntity wrestler : Relationship.WRESTLERS.of(entity)) {
                if (Capabilities.isSuspended(wrestler)) {
                    cascade.spawn(wrestler, Transition.REINSTATE, date).execute();
                }
            }
        };
    }

    public static CascadeStrategy managers() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.REINSTATE) {
                return;
            }
            for (RosterEntity manager : Relationship.MANAGERS.of(entity)) {
                if (Capabilities.isSuspended(manager) && hasNoOtherSuspendedMembers(manager, entity)) {
                    cascade.spawn(manager, Transition.REINSTATE, date).execute();
                }
            }
        };
    }

    /**
     * 매니저가 관리하는 대상 중 복귀 중인 엔티티를 제외하고 정지된 대상이 없는지.
     *
     * @param manager 매니저
     * @param reinstated 지금 복귀 중인 엔티티
     * @return 다른 정지 대상이 없으면 true
     */
    static boolean hasNoOtherSuspendedMembers(RosterEntity manager, RosterEntity reinstated) {
        if (!(manager instanceof ManagesMembers managing)) {
            return true;
        }
        return managing.currentManagedMembers().stream()
            .filter(managed -> !managed.key().equals(reinstated.key()))
            .noneMatch(Capabilities::isSuspended);
    }
}
