package com.ryuqq.lifecycle.application.action;

import com.ryuqq.lifecycle.application.cascade.EmploymentCascadeStrategy;
import com.ryuqq.lifecycle.application.cascade.ReinstatementCascadeStrategy;
import com.ryuqq.lifecycle.application.cascade.Relationship;
import com.ryuqq.lifecycle.application.cascade.RetirementCascadeStrategy;
import com.ryuqq.lifecycle.application.cascade.SuspensionCascadeStrategy;
import com.ryuqq.lifecycle.application.collection.MemberCollectionManager;
import com.ryuqq.lifecycle.application.context.LifecycleContext;
import com.ryuqq.lifecycle.application.transition.CascadeStrategy;
import com.ryuqq.lifecycle.application.transition.StatusTransitionPipeline;
import com.ryuqq.lifecycle.application.validation.MemberValidations;
import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.UnsupportedCapabilityException;
import com.ryuqq.lifecycle.core.model.Transition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;

/**
 * {@link LifecycleActions} 기본 구현.
 *
 * <p><strong>유형별 cascade:</strong></p>
 * <pre>
 * employ    : HasManagers → managers, HasWrestlers → wrestlers, HasTagTeams → tagTeams
 * suspend   : WRESTLER → managers
 *             TAG_TEAM → teamSuspension 검증, wrestlers, managers
 * reinstate : WRESTLER → managers
 *             TAG_TEAM → wrestlers, managers
 * retire    : WRESTLER → leaveTagTeam, removeManagers, leaveGroup
 *             TAG_TEAM → teamRetirement 검증, leaveGroup, removeManagers
 *             STABLE   → disbandGroup
 *             MANAGER, REFEREE → leaveGroup, endManagement
 * injure    : 개인만 허용, cascade 없음
 * release   : cascade 없음
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class DefaultLifecycleActions implements LifecycleActions {

    private static final Logger log = LoggerFactory.getLogger(DefaultLifecycleActions.class);

    private final LifecycleContext context;

    public DefaultLifecycleActions(LifecycleContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        this.context = context;
    }

    // ===== 단일 엔티티 =====

    @Override
    public void employ(RosterEntity entity, LocalDateTime date, String notes) {
        StatusTransitionPipeline pipeline = pipeline(Transition.EMPLOY, entity, date, notes);
        EmploymentCascadeStrategy.forEntity(entity).forEach(pipeline::withCascade);
        pipeline.execute();
    }

    @Override
    public void release(RosterEntity entity, LocalDateTime date, String notes) {
        pipeline(Transition.RELEASE, entity, date, notes).execute();
    }

    @Override
    public void suspend(RosterEntity entity, LocalDateTime date, String notes) {
        StatusTransitionPipeline pipeline = pipeline(Transition.SUSPEND, entity, date, notes);
        switch (entity.type()) {
            case WRESTLER -> pipeline.withCascade(SuspensionCascadeStrategy.managers());
            case TAG_TEAM -> pipeline
                .withValidation(MemberValidations.teamSuspension())
                .withCascade(SuspensionCascadeStrategy.wrestlers())
                .withCascade(SuspensionCascadeStrategy.managers());
            default -> {
            }
        }
        pipeline.execute();
    }

    @Override
    public void reinstate(RosterEntity entity, LocalDateTime date, String notes) {
        StatusTransitionPipeline pipeline = pipeline(Transition.REINSTATE, entity, date, notes);
        switch (entity.type()) {
            case WRESTLER -> pipeline.withCascade(ReinstatementCascadeStrategy.managers());
            case TAG_TEAM -> pipeline
                .withCascade(ReinstatementCascadeStrategy.wrestlers())
                .withCascade(ReinstatementCascadeStrategy.managers());
            default -> {
            }
        }
        pipeline.execute();
    }

    @Override
    public void retire(RosterEntity entity, LocalDateTime date, String notes) {
        StatusTransitionPipeline pipeline = pipeline(Transition.RETIRE, entity, date, notes);
        switch (entity.type()) {
            case WRESTLER -> pipeline
                .withCascade(RetirementCascadeStrategy.leaveTagTeam())
                .withCascade(RetirementCascadeStrategy.removeManagers())
                .withCascade(RetirementCascadeStrategy.leaveGroup());
            case TAG_TEAM -> pipeline
                .withValidation(MemberValidations.teamRetirement())
                .withCascade(RetirementCascadeStrategy.leaveGroup())
                .withCascade(RetirementCascadeStrategy.removeManagers());
            case STABLE -> pipeline.withCascade(RetirementCascadeStrategy.disbandGroup());
            case MANAGER, REFEREE -> pipeline
                .withCascade(RetirementCascadeStrategy.leaveGroup())
                .withCascade(RetirementCascadeStrategy.endManagement());
        }
        pipeline.execute();
    }

    @Override
    public void injure(RosterEntity entity, LocalDateTime date, String notes) {
        if (!entity.type().isIndividual()) {
            throw new UnsupportedCapabilityException(entity.key(), Transition.INJURE);
        }
        pipeline(Transition.INJURE, entity, date, notes).execute();
    }

    // ===== 다중 엔티티 =====

    @Override
    public void employMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes) {
        forEachInTransaction(entities, entity -> employ(entity, date, notes));
    }

    @Override
    public void releaseMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes) {
        forEachInTransaction(entities, entity -> release(entity, date, notes));
    }

    @Override
    public void suspendMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes) {
        forEachInTransaction(entities, entity -> suspend(entity, date, notes));
    }

    @Override
    public void reinstateMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes) {
        forEachInTransaction(entities, entity -> reinstate(entity, date, notes));
    }

    @Override
    public void retireMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes) {
        forEachInTransaction(entities, entity -> retire(entity, date, notes));
    }

    @Override
    public void injureMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes) {
        forEachInTransaction(entities, entity -> injure(entity, date, notes));
    }

    // ===== 직접 실행 =====

    @Override
    public void direct(Transition transition, RosterEntity entity, LocalDateTime date, String notes) {
        pipeline(transition, entity, date, notes).execute();
    }

    @Override
    public void withCustomCascade(Transition transition, RosterEntity entity, List<CascadeStrategy> cascades,
                                  LocalDateTime date, String notes) {
        if (cascades == null) {
            throw new IllegalArgumentException("cascades cannot be null");
        }
        StatusTransitionPipeline pipeline = pipeline(transition, entity, date, notes);
        cascades.forEach(pipeline::withCascade);
        pipeline.execute();
    }

    // ===== 그룹 멤버 =====

    @Override
    public void suspendMembersByKind(RosterEntity group, Set<MemberKind> kinds, LocalDateTime date, String notes) {
        List<RosterEntity> targets = new ArrayList<>();
        for (MemberKind kind : orderedKinds(kinds)) {
            Relationship.forKind(kind).of(group).stream()
                .filter(Capabilities::isEmployed)
                .filter(member -> !Capabilities.isSuspended(member))
                .forEach(targets::add);
        }
        log.debug("Suspending {} member(s) of {} by kind {}", targets.size(), group.key(), kinds);
        suspendMany(targets, date, notes);
    }

    @Override
    public void suspendAvailableMembers(RosterEntity group, LocalDateTime date, String notes) {
        List<RosterEntity> members = allMembers(group);
        if (members.isEmpty()) {
            return;
        }
        MemberCollectionManager.from(context, members)
            .filterByEmploymentStatus("employed")
            .filterBySuspensionStatus("active")
            .batchSuspend(date, notes);
    }

    @Override
    public void reinstateMembersByKind(RosterEntity group, Set<MemberKind> kinds, LocalDateTime date, String notes) {
        List<RosterEntity> targets = new ArrayList<>();
        for (MemberKind kind : orderedKinds(kinds)) {
            Relationship.forKind(kind).of(group).stream()
                .filter(Capabilities::isSuspended)
                .forEach(targets::add);
        }
        log.debug("Reinstating {} member(s) of {} by kind {}", targets.size(), group.key(), kinds);
        reinstateMany(targets, date, notes);
    }

    @Override
    public void reinstateAllSuspendedMembers(RosterEntity group, LocalDateTime date, String notes) {
        List<RosterEntity> members = allMembers(group);
        if (members.isEmpty()) {
            return;
        }
        MemberCollectionManager.from(context, members)
            .filterBySuspensionStatus("suspended")
            .batchReinstate(date, notes);
    }

    private StatusTransitionPipeline pipeline(Transition transition, RosterEntity entity,
                                              LocalDateTime date, String notes) {
        return StatusTransitionPipeline.create(context, entity, transition, date).withNotes(notes);
    }

    private void forEachInTransaction(Collection<? extends RosterEntity> entities,
                                      Consumer<RosterEntity> action) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        context.transactionManager().runWithoutResult(() -> entities.forEach(action));
    }

    private static List<RosterEntity> allMembers(RosterEntity group) {
        List<RosterEntity> members = new ArrayList<>();
        members.addAll(Relationship.WRESTLERS.of(group));
        members.addAll(Relationship.MANAGERS.of(group));
        members.addAll(Relationship.TAG_TEAMS.of(group));
        return members;
    }

    // 순서: wrestlers, managers, tag teams
    private static List<MemberKind> orderedKinds(Set<MemberKind> kinds) {
        if (kinds == null) {
            throw new IllegalArgumentException("kinds cannot be null");
        }
        Set<MemberKind> requested = kinds.isEmpty() ? EnumSet.noneOf(MemberKind.class) : EnumSet.copyOf(kinds);
        List<MemberKind> ordered = new ArrayList<>();
        for (MemberKind kind : List.of(MemberKind.WRESTLERS, MemberKind.MANAGERS, MemberKind.TAG_TEAMS)) {
            if (requested.contains(kind)) {
                ordered.add(kind);
            }
        }
        return ordered;
    }
}
