package com.ryuqq.lifecycle.application.cascade;

import com.ryuqq.lifecycle.core.capability.HasManagers;
import com.ryuqq.lifecycle.core.capability.HasSubMembers;
import com.ryuqq.lifecycle.core.capability.HasTagTeams;
import com.ryuqq.lifecycle.core.capability.HasWrestlers;
import com.ryuqq.lifecycle.core.capability.ManagesMembers;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;

import java.util.List;
import java.util.Locale;

/**
 * capability로 보호되는 관계 접근자.
 *
 * <p>엔티티가 관계 capability를 선언하지 않았으면 빈 리스트를 반환하며,
 * 선언하지 않은 관계를 역참조하지 않습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum Relationship {

    MANAGERS("currentManagers") {
        @Override
        public List<RosterEntity> of(RosterEntity entity) {
            return entity instanceof HasManagers owner ? owner.currentManagers() : List.of();
        }
    },
    WRESTLERS("currentWrestlers") {
        @Override
        public List<RosterEntity> of(RosterEntity entity) {
            return entity instanceof HasWrestlers group ? group.currentWrestlers() : List.of();
        }
    },
    TAG_TEAMS("currentTagTeams") {
        @Override
        public List<RosterEntity> of(RosterEntity entity) {
            return entity instanceof HasTagTeams group ? group.currentTagTeams() : List.of();
        }
    },
    MEMBERS("currentMembers") {
        @Override
        public List<RosterEntity> of(RosterEntity entity) {
            return entity instanceof HasSubMembers group ? group.currentMembers() : List.of();
        }
    },
    MANAGED_WRESTLERS("currentManagedWrestlers") {
        @Override
        public List<RosterEntity> of(RosterEntity entity) {
            return entity instanceof ManagesMembers manager ? manager.currentManagedWrestlers() : List.of();
        }
    },
    MANAGED_TAG_TEAMS("currentManagedTagTeams") {
        @Override
        public List<RosterEntity> of(RosterEntity entity) {
            return entity instanceof ManagesMembers manager ? manager.currentManagedTagTeams() : List.of();
        }
    };

    private final String accessorName;

    Relationship(String accessorName) {
        this.accessorName = accessorName;
    }

    /**
     * 엔티티의 현재 관계 대상 조회.
     *
     * @param entity 기준 엔티티
     * @return 관계 대상 (capability가 없으면 빈 리스트)
     */
    public abstract List<RosterEntity> of(RosterEntity entity);

    public String accessorName() {
        return accessorName;
    }

    /**
     * 멤버 종류에 대응하는 관계.
     *
     * @param kind 멤버 종류
     * @return WRESTLERS, TAG_TEAMS 또는 MANAGERS
     */
    public static Relationship forKind(MemberKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        return switch (kind) {
            case WRESTLERS -> WRESTLERS;
            case TAG_TEAMS -> TAG_TEAMS;
            case MANAGERS -> MANAGERS;
        };
    }

    /**
     * 접근자 이름 또는 상수 이름으로 조회.
     *
     * @param name "currentManagers", "managers", "MANAGED_WRESTLERS" 등
     * @return 관계
     * @throws ConfigurationException 알 수 없는 관계 이름인 경우
     */
    public static Relationship fromName(String name) {
        if (name == null) {
            throw ConfigurationException.unknownCriterion("null");
        }
        String normalized = name.replace("_", "").toLowerCase(Locale.ROOT);
        for (Relationship relationship : values()) {
            String accessor = relationship.accessorName.toLowerCase(Locale.ROOT);
            if (accessor.equals(normalized)
                || accessor.equals("current" + normalized)
                || relationship.name().replace("_", "").toLowerCase(Locale.ROOT).equals(normalized)) {
                return relationship;
            }
        }
        throw new ConfigurationException(ConfigurationException.UNKNOWN_CRITERION, "Unknown relationship: " + name);
    }
}
