package com.ryuqq.lifecycle.application.group;

import com.ryuqq.lifecycle.application.cascade.RetirementCascadeStrategy;
import com.ryuqq.lifecycle.application.collection.MemberCollectionManager;
import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.application.transition.StatusTransitionPipeline;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.MembershipConflictException;
import com.ryuqq.lifecycle.core.spi.MembershipRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 그룹(스테이블) 멤버십 오케스트레이터.
 *
 * <p>merge, split, transfer를 작업 큐에 쌓고 {@link #execute()}에서 하나의 트랜잭션으로
 * 실행합니다. 작업을 모두 실행한 뒤 등록 순서대로 후속 cascade를 실행합니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * GroupMembershipOrchestrator.transferMembers(context, from, to)
 *     .transferWrestlers(List.of(wrestler))
 *     .withEmploymentCascade()
 *     .withSourceStableRetirement()
 *     .onDate(date)
 *     .execute();
 * </pre>
 *
 * <p><strong>제약:</strong></p>
 * <ul>
 *   <li>source와 target이 같은 그룹이면 {@link MembershipConflictException}</li>
 *   <li>merge는 레슬러와 태그팀만 이동 (매니저는 개별 멤버에 연결됨)</li>
 *   <li>split은 빈 그룹을 만들고 이후 transfer의 target으로 사용</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class GroupMembershipOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GroupMembershipOrchestrator.class);

    private final LifecycleContext context;
    private final List<GroupOperation> operations = new ArrayList<>();
    private final List<GroupCascade> cascades = new ArrayList<>();
    private MemberGroup sourceGroup;
    private MemberGroup targetGroup;
    private LocalDateTime effectiveDate;

    private GroupMembershipOrchestrator(LifecycleContext context, MemberGroup sourceGroup, MemberGroup targetGroup) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
        this.sourceGroup = sourceGroup;
        this.targetGroup = targetGroup;
    }

    /**
     * 두 그룹 병합 (secondary의 레슬러/태그팀을 primary로 이동 후 secondary 은퇴).
     *
     * @param primary 남는 그룹
     * @param secondary 흡수되어 은퇴하는 그룹
     * @param newName primary의 새 이름 (nullable)
     * @return 오케스트레이터
     * @throws MembershipConflictException 같은 그룹인 경우
     */
    public static GroupMembershipOrchestrator mergeStables(LifecycleContext context, MemberGroup primary,
                                                           MemberGroup secondary, String newName) {
        requireGroup(primary, "primary");
        requireGroup(secondary, "secondary");
        requireDistinct(primary, secondary);
        GroupMembershipOrchestrator orchestrator = new GroupMembershipOrchestrator(context, secondary, primary);
        orchestrator.operations.add(date -> orchestrator.merge(primary, secondary, newName, date));
        return orchestrator;
    }

    /**
     * 그룹 분할 (빈 새 그룹을 만들고 transfer의 target으로 설정).
     *
     * @param original 원래 그룹
     * @param newName 새 그룹 이름
     * @return 오케스트레이터
     */
    public static GroupMembershipOrchestrator splitStable(LifecycleContext context, MemberGroup original, String newName) {
        requireGroup(original, "original");
        if (newName == null || newName.isBlank()) {
            throw new IllegalArgumentException("newName cannot be null or blank");
        }
        GroupMembershipOrchestrator orchestrator = new GroupMembershipOrchestrator(context, original, null);
        orchestrator.operations.add(date -> orchestrator.split(newName, date));
        return orchestrator;
    }

    public static GroupMembershipOrchestrator transferMembers(LifecycleContext context, MemberGroup from, MemberGroup to) {
        requireGroup(from, "from");
        requireGroup(to, "to");
        requireDistinct(from, to);
        return new GroupMembershipOrchestrator(context, from, to);
    }

    public GroupMembershipOrchestrator onDate(LocalDateTime date) {
        this.effectiveDate = date;
        return this;
    }

    // ===== 이동 작업 =====

    public GroupMembershipOrchestrator transferWrestlers(Collection<? extends RosterEntity> wrestlers) {
        List<RosterEntity> members = List.copyOf(wrestlers);
        operations.add(date -> transfer(MemberKind.WRESTLERS, members, date));
        return this;
    }

    public GroupMembershipOrchestrator transferTagTeams(Collection<? extends RosterEntity> tagTeams) {
        List<RosterEntity> members = List.copyOf(tagTeams);
        operations.add(date -> transfer(MemberKind.TAG_TEAMS, members, date));
        return this;
    }

    public GroupMembershipOrchestrator transferManagers(Collection<? extends RosterEntity> managers) {
        List<RosterEntity> members = List.copyOf(managers);
        operations.add(date -> transfer(MemberKind.MANAGERS, members, date));
        return this;
    }

    /**
     * source 그룹의 가용 멤버 전체 이동 (레슬러, 태그팀, 매니저 순).
     *
     * @return 오케스트레이터
     */
    public GroupMembershipOrchestrator transferAllAvailableMembers() {
        operations.add(date -> {
            if (sourceGroup == null) {
                return targetGroup;
            }
            for (MemberKind kind : List.of(MemberKind.WRESTLERS, MemberKind.TAG_TEAMS, MemberKind.MANAGERS)) {
                List<RosterEntity> available = MemberCollectionManager.from(context, kind.membersOf(sourceGroup))
                    .filterByAvailability(true)
                    .get();
                transfer(kind, available, date);
            }
            return targetGroup;
        });
        return this;
    }

    /**
     * 조건에 맞는 source 그룹 레슬러 이동.
     *
     * @param criteria 컬렉션 매니저 조건 맵 (예: {@code employmentStatus=employed})
     * @return 오케스트레이터
     */
    public GroupMembershipOrchestrator transferMembersByCriteria(Map<String, ?> criteria) {
        if (criteria == null) {
            throw new IllegalArgumentException("criteria cannot be null");
        }
        Map<String, Object> snapshot = new LinkedHashMap<>(criteria);
        operations.add(date -> {
            if (sourceGroup == null) {
                return targetGroup;
            }
            List<RosterEntity> matched = MemberCollectionManager.from(context, sourceGroup.currentWrestlers())
                .filterByCriteria(snapshot)
                .get();
            return transfer(MemberKind.WRESTLERS, matched, date);
        });
        return this;
    }

    // ===== 후속 cascade =====

    /**
     * target 그룹의 미고용 레슬러, 태그팀, 매니저 고용.
     *
     * @return 오케스트레이터
     */
    public GroupMembershipOrchestrator withEmploymentCascade() {
        cascades.add(date -> {
            if (targetGroup == null) {
                return;
            }
            for (MemberKind kind : List.of(MemberKind.WRESTLERS, MemberKind.TAG_TEAMS, MemberKind.MANAGERS)) {
                MemberCollectionManager.from(context, kind.membersOf(targetGroup))
                    .filterByEmploymentStatus("unemployed")
                    .batchEmploy(date, null);
            }
        });
        return this;
    }

    public GroupMembershipOrchestrator withSuspensionCascade() {
        return withSuspensionCascade(EnumSet.allOf(MemberKind.class));
    }

    /**
     * target 그룹의 고용 중이고 정지되지 않은 멤버 정지.
     *
     * <p>그룹에 직접 연결된 매니저는 정지하지 않으므로 MANAGERS는 무시됩니다.</p>
     *
     * @param kinds 대상 멤버 종류
     * @return 오케스트레이터
     */
    public GroupMembershipOrchestrator withSuspensionCascade(Set<MemberKind> kinds) {
        if (kinds == null) {
            throw new IllegalArgumentException("kinds cannot be null");
        }
        Set<MemberKind> requested = kinds.isEmpty() ? EnumSet.noneOf(MemberKind.class) : EnumSet.copyOf(kinds);
        cascades.add(date -> {
            if (targetGroup == null) {
                return;
            }
            for (MemberKind kind : List.of(MemberKind.WRESTLERS, MemberKind.TAG_TEAMS)) {
                if (!requested.contains(kind)) {
                    continue;
                }
                MemberCollectionManager.from(context, kind.membersOf(targetGroup))
                    .filterByEmploymentStatus("employed")
                    .filterBySuspensionStatus("active")
                    .batchSuspend(date, null);
            }
        });
        return this;
    }

    public GroupMembershipOrchestrator withSourceStableRetirement() {
        cascades.add(date -> {
            if (sourceGroup != null) {
                StatusTransitionPipeline.retire(context, sourceGroup, date)
                    .withCascade(RetirementCascadeStrategy.disbandGroup())
                    .execute();
            }
        });
        return this;
    }

    /**
     * 등록된 작업과 cascade를 하나의 트랜잭션으로 실행.
     *
     * @return 작업이 만든 그룹 목록
     */
    public GroupOrchestrationResult execute() {
        LocalDateTime date = context.dates().resolve(effectiveDate);
        return context.transactionManager().runInTransaction(() -> {
            Set<MemberGroup> produced = new LinkedHashSet<>();
            for (GroupOperation operation : operations) {
                MemberGroup result = operation.apply(date);
                if (result != null) {
                    produced.add(result);
                }
            }
            for (GroupCascade cascade : cascades) {
                cascade.apply(date);
            }
            log.info("Group orchestration completed: {} operation(s), {} cascade(s), groups={}",
                operations.size(), cascades.size(), produced.stream().map(RosterEntity::key).toList());
            return new GroupOrchestrationResult(new ArrayList<>(produced));
        });
    }

    private MemberGroup merge(MemberGroup primary, MemberGroup secondary, String newName, LocalDateTime date) {
        MembershipRepository membership = context.membership();
        for (MemberKind kind : List.of(MemberKind.WRESTLERS, MemberKind.TAG_TEAMS)) {
            for (RosterEntity member : kind.membersOf(secondary)) {
                membership.remove(kind, secondary, member, date);
                membership.add(kind, primary, member, date);
            }
        }
        if (newName != null && !newName.isBlank()) {
            context.repositoryFor(primary).update(primary, Map.of("name", newName));
        }
        StatusTransitionPipeline.retire(context, secondary, date)
            .withCascade(RetirementCascadeStrategy.disbandGroup())
            .execute();
        log.debug("Merged {} into {}", secondary.key(), primary.key());
        return primary;
    }

    private MemberGroup split(String newName, LocalDateTime date) {
        MemberGroup created = context.membership().createGroup(newName, date);
        this.targetGroup = created;
        log.debug("Split {} into new group {}", sourceGroup.key(), created.key());
        return created;
    }

    private MemberGroup transfer(MemberKind kind, List<RosterEntity> members, LocalDateTime date) {
        MembershipRepository membership = context.membership();
        for (RosterEntity member : members) {
            if (sourceGroup != null) {
                membership.remove(kind, sourceGroup, member, date);
            }
            if (targetGroup != null) {
                membership.add(kind, targetGroup, member, date);
            }
        }
        log.debug("Transferred {} {} from {} to {}", members.size(), kind,
            sourceGroup == null ? "-" : sourceGroup.key(), targetGroup == null ? "-" : targetGroup.key());
        return targetGroup;
    }

    private static void requireGroup(MemberGroup group, String name) {
        if (group == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    private static void requireDistinct(MemberGroup a, MemberGroup b) {
        if (a.key().equals(b.key())) {
            throw MembershipConflictException.sameGroup(a.key());
        }
    }

    @FunctionalInterface
    private interface GroupOperation {
        MemberGroup apply(LocalDateTime date);
    }

    @FunctionalInterface
    private interface GroupCascade {
        void apply(LocalDateTime date);
    }
}
