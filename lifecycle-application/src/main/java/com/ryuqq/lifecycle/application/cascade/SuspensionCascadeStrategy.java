package com.ryuqq.lifecycle.application.cascade;

import com.ryuqq.lifecycle.application.transition.CascadeStrategy;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;

import java.util.List;

/**
 * 정지(suspend) cascade 전략 모음.
 *
 * <p>고용 중이고 아직 정지되지 않은 관계 대상만 정지합니다.</p>
 *
 * <ul>
 *   <li>레슬러 정지 → 매니저 정지</li>
 *   <li>태그팀 정지 → 레슬러, 매니저 정지</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class SuspensionCascadeStrategy {

    private SuspensionCascadeStrategy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static CascadeStrategy managers() {
        return of(Relationship.MANAGERS);
    }

    public static CascadeStrategy wrestlers() {
        return of(Relationship.WRESTLERS);
    }

    /**
     * 관계 대상 정지.
     *
     * @param relationship 대상 관계
     * @return cascade 전략
     */
    public static CascadeStrategy of(Relationship relationship) {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.SUSPEND) {
                return;
            }
            for (RosterEntity member : suspendable(relationship.of(entity))) {
                cascade.spawn(member, Transition.SUSPEND, date).execute();
            }
        };
    }

    static List<RosterEntity> suspendable(List<RosterEntity> targets) {
        return targets.stream()
            .filter(target -> Capabilities.supports(target, Transition.SUSPEND))
            .filter(Capabilities::isEmployed)
            .filter(target -> !Capabilities.isSuspended(target))
            .toList();
    }
}
