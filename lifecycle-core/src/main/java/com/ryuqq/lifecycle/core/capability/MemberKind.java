package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * 그룹 멤버 관계 종류.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum MemberKind {

    WRESTLERS {
        @Override
        public List<RosterEntity> membersOf(MemberGroup group) {
            return group.currentWrestlers();
        }
    },
    TAG_TEAMS {
        @Override
        public List<RosterEntity> membersOf(MemberGroup group) {
            return group.currentTagTeams();
        }
    },
    MANAGERS {
        @Override
        public List<RosterEntity> membersOf(MemberGroup group) {
            return group.currentManagers();
        }
    };

    /**
     * 그룹에서 이 종류의 현재 멤버 조회.
     *
     * @param group 대상 그룹
     * @return 멤버 목록
     */
    public abstract List<RosterEntity> membersOf(MemberGroup group);

    /**
     * 엔티티 유형이 그룹 안에서 차지하는 멤버 종류.
     *
     * @param type 엔티티 유형
     * @return 멤버 종류 (심판, 스테이블은 empty)
     */
    public static Optional<MemberKind> of(EntityType type) {
        return switch (type) {
            case WRESTLER -> Optional.of(WRESTLERS);
            case TAG_TEAM -> Optional.of(TAG_TEAMS);
            case MANAGER -> Optional.of(MANAGERS);
            case REFEREE, STABLE -> Optional.empty();
        };
    }
}
