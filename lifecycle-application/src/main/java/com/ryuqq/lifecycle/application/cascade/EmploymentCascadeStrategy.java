package com.ryuqq.lifecycle.application.cascade;

import com.ryuqq.lifecycle.application.transition.CascadeContext;
import com.ryuqq.lifecycle.application.transition.CascadeStrategy;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.HasManagers;
import com.ryuqq.lifecycle.core.capability.HasTagTeams;
import com.ryuqq.lifecycle.core.capability.HasWrestlers;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * 고용(employ) cascade 전략 모음.
 *
 * <p>모든 전략은 전이가 EMPLOY일 때만 동작하며, 관계 대상 중 아직 고용되지 않은
 * 엔티티만 고용합니다.</p>
 *
 * <p><strong>전략:</strong></p>
 * <ul>
 *   <li>{@link #managers()}: 미고용 매니저 고용</li>
 *   <li>{@link #wrestlers()}: 미고용 레슬러 고용</li>
 *   <li>{@link #tagTeams()}: 미고용 태그팀 고용 (각 팀에 wrestlers + managers cascade 재적용)</li>
 *   <li>{@link #allMembers()}: 레슬러 → 태그팀 → 매니저 순서, 호출 단위 방문 집합으로 중복 방지</li>
 *   <li>{@link #custom(Collection)}: 임의의 관계 목록</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class EmploymentCascadeStrategy {

    static final String ALL_MEMBERS_SCOPE = "employment.allMembers";

    private EmploymentCascadeStrategy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 엔티티가 가진 관계에 맞는 기본 고용 cascade.
     *
     * <p>매니저 → 레슬러 → 태그팀 순서. 관계가 없으면 빈 목록.</p>
     *
     * @param entity 고용 대상
     * @return cascade 목록
     */
    public static List<CascadeStrategy> forEntity(RosterEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        List<CascadeStrategy> cascades = new ArrayList<>();
        if (entity instanceof HasManagers) {
            cascades.add(managers());
        }
        if (entity instanceof HasWrestlers) {
            cascades.add(wrestlers());
        }
        if (entity instanceof HasTagTeams) {
            cascades.add(tagTeams());
        }
        return cascades;
    }

    public static CascadeStrategy managers() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.EMPLOY) {
                return;
            }
            for (RosterEntity manager : unemployed(Relationship.MANAGERS.of(entity))) {
                cascade.spawn(manager, Transition.EMPLOY, date).execute();
            }
        };
    }

    public static CascadeStrategy wrestlers() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.EMPLOY) {
                return;
            }
            for (RosterEntity wrestler : unemployed(Relationship.WRESTLERS.of(entity))) {
                cascade.spawn(wrestler, Transition.EMPLOY, date).execute();
            }
        };
    }

    public static CascadeStrategy tagTeams() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.EMPLOY) {
                return;
            }
            for (RosterEntity tagTeam : unemployed(Relationship.TAG_TEAMS.of(entity))) {
                cascade.spawn(tagTeam, Transition.EMPLOY, date)
                    .withCascade(wrestlers())
                    .withCascade(managers())
                    .execute();
            }
        };
    }

    /**
     * 전체 멤버 고용.
     *
     * <p>방문 집합은 {@link CascadeContext}에 있으므로 최상위 호출 하나에 한정되고,
     * 그룹 ↔ 멤버 상호 참조가 있어도 (type, id)마다 최대 한 번만 방문합니다.</p>
     *
     * @return cascade 전략
     */
    public static CascadeStrategy allMembers() {
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.EMPLOY) {
                return;
            }
            if (!cascade.markVisited(ALL_MEMBERS_SCOPE, entity.key())) {
                return;
            }

            // 레슬러 먼저 (매니저를 가질 수 있음)
            for (RosterEntity wrestler : unemployed(Relationship.WRESTLERS.of(entity))) {
                if (cascade.markVisited(ALL_MEMBERS_SCOPE, wrestler.key())) {
                    cascade.spawn(wrestler, Transition.EMPLOY, date)
                        .withCascade(visitedManagers())
                        .execute();
                }
            }

            for (RosterEntity tagTeam : unemployed(Relationship.TAG_TEAMS.of(entity))) {
                if (cascade.markVisited(ALL_MEMBERS_SCOPE, tagTeam.key())) {
                    cascade.spawn(tagTeam, Transition.EMPLOY, date)
                        .withCascade(visitedWrestlers())
                        .withCascade(visitedManagers())
                        .execute();
                }
            }

            employVisited(Relationship.MANAGERS.of(entity), date, cascade);
        };
    }

    /**
     * 지정한 관계들의 미고용 대상 고용.
     *
     * @param relationships 관계 목록
     * @return cascade 전략
     */
    public static CascadeStrategy custom(Collection<Relationship> relationships) {
        if (relationships == null) {
            throw new IllegalArgumentException("relationships cannot be null");
        }
        List<Relationship> ordered = List.copyOf(relationships);
        return (entity, date, transition, cascade) -> {
            if (transition != Transition.EMPLOY) {
                return;
            }
            for (Relationship relationship : ordered) {
                for (RosterEntity related : unemployed(relationship.of(entity))) {
                    cascade.spawn(related, Transition.EMPLOY, date).execute();
                }
            }
        };
    }

    public static CascadeStrategy custom(Relationship... relationships) {
        return custom(Arrays.asList(relationships));
    }

    /**
     * 관계 접근자 이름으로 구성 (예: "currentManagers").
     *
     * @param relationshipNames 관계 이름 목록
     * @return cascade 전략
     * @throws com.ryuqq.lifecycle.core.exception.ConfigurationException 알 수 없는 이름인 경우
     */
    public static CascadeStrategy customByName(Collection<String> relationshipNames) {
        if (relationshipNames == null) {
            throw new IllegalArgumentException("relationshipNames cannot be null");
        }
        return custom(relationshipNames.stream().map(Relationship::fromName).toList());
    }

    private static CascadeStrategy visitedManagers() {
        return (entity, date, transition, cascade) -> {
            if (transition == Transition.EMPLOY) {
                employVisited(Relationship.MANAGERS.of(entity), date, cascade);
            }
        };
    }

    private static CascadeStrategy visitedWrestlers() {
        return (entity, date, transition, cascade) -> {
            if (transition == Transition.EMPLOY) {
                employVisited(Relationship.WRESTLERS.of(entity), date, cascade);
            }
        };
    }

    private static void employVisited(List<RosterEntity> targets, LocalDateTime date, CascadeContext cascade) {
        for (RosterEntity target : unemployed(targets)) {
            if (cascade.markVisited(ALL_MEMBERS_SCOPE, target.key())) {
                cascade.spawn(target, Transition.EMPLOY, date).execute();
            }
        }
    }

    private static List<RosterEntity> unemployed(List<RosterEntity> targets) {
        return targets.stream()
            .filter(target -> Capabilities.supports(target, Transition.EMPLOY))
            .filter(Capabilities::isUnemployed)
            .toList();
    }
}
