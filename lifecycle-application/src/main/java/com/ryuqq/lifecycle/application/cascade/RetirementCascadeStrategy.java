package com.ryuqq.lifecycle.application.cascade;

import com.ryuqq.lifecycle.application.transition.CascadeStrategy;
import com.ryuqq.lifecycle.core.capability.BelongsToGroup;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.capability.TeamMember;
import com.ryuqq.lifecycle.core.model.Transition;
import com.ryuqq.lifecycle.core.spi.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 은퇴(retire) cascade 전략 모음.
 *
 * <p>은퇴 cascade는 추가 전이를 만들지 않고 열린 관계 기간을 닫습니다.</p>
 *
 * <ul>
 *   <li>{@link #leaveTagTeam()}: 현재 태그팀에서 탈퇴</li>
 *   <li>{@link #removeManagers()}: 배정된 매니저 관계 종료</li>
 *   <li>{@link #leaveGroup()}: 현재 스테이블에서 탈퇴</li>
 *   <li>{@link #disbandGroup()}: 스테이블의 모든 레슬러/태그팀/매니저 멤버십 종료</li>
 *   <li>{@link #endManagement()}: 매니저가 관리하던 레슬러/태그팀 관계 종료</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class RetirementCascadeStrategy {

    private static final Logger log = LoggerFactory.getLogger(RetirementCascadeStrategy.class);

    private RetirementCascadeStrategy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static CascadeStrategy leaveTagTeam() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.RETIRE || !(entity instanceof TeamMember member)) {
                return;
            }
            member.currentTagTeam().ifPresent(team -> {
                cascade.lifecycleContext().membership().removeWrestler(team, entity, date);
                log.debug("{} left tag team {}", entity.key(), team.key());
            });
        };
    }

    public static CascadeStrategy removeManagers() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.RETIRE) {
                return;
            }
            MembershipRepository membership = cascade.lifecycleContext().membership();
            for (RosterEntity manager : Relationship.MANAGERS.of(entity)) {
                membership.removeManager(entity, manager, date);
            }
        };
    }

    public static CascadeStrategy leaveGroup() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.RETIRE || !(entity instanceof BelongsToGroup member)) {
                return;
            }
            member.currentGroup().ifPresent(group -> MemberKind.of(entity.type()).ifPresent(kind -> {
                cascade.lifecycleContext().membership().remove(kind, group, entity, date);
                log.debug("{} left group {}", entity.key(), group.key());
            }));
        };
    }

    public static CascadeStrategy disbandGroup() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.RETIRE || !(entity instanceof MemberGroup group)) {
                return;
            }
            MembershipRepository membership = cascade.lifecycleContext().membership();
            for (MemberKind kind : MemberKind.values()) {
                for (RosterEntity member : group.currentMembers(kind)) {
                    membership.remove(kind, group, member, date);
                }
            }
        };
    }

    public static CascadeStrategy endManagement() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.RETIRE) {
                return;
            }
            MembershipRepository membership = cascade.lifecycleContext().membership();
            for (RosterEntity managed : Relationship.MANAGED_WRESTLERS.of(entity)) {
                membership.removeManager(managed, entity, date);
            }
            for (RosterEntity managed : Relationship.MANAGED_TAG_TEAMS.of(entity)) {
                membership.removeManager(managed, entity, date);
            }
        };
    }
}
