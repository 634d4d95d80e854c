package com.ryuqq.lifecycle.application.action;

import com.ryuqq.lifecycle.application.transition.CascadeStrategy;
import com.ryuqq.lifecycle.core.capability.MemberKind;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 엔티티 유형별 cascade/검증을 자동으로 고르는 생명주기 액션.
 *
 * <p>단일 엔티티 액션은 {@link com.ryuqq.lifecycle.application.transition.StatusTransitionPipeline}
 * 하나를 구성해 실행합니다. {@code *Many} 액션은 하나의 트랜잭션 안에서 순서대로 반복합니다.</p>
 *
 * <p>date와 notes는 모두 nullable이며, date가 null이면 현재 시각을 사용합니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @see DefaultLifecycleActions
 */
public interface LifecycleActions {

    /**
     * 고용 (관계 capability에 따라 매니저/레슬러/태그팀 고용 cascade).
     */
    void employ(RosterEntity entity, LocalDateTime date, String notes);

    void release(RosterEntity entity, LocalDateTime date, String notes);

    /**
     * 정지 (레슬러: 매니저, 태그팀: 팀 검증 후 레슬러와 매니저).
     */
    void suspend(RosterEntity entity, LocalDateTime date, String notes);

    void reinstate(RosterEntity entity, LocalDateTime date, String notes);

    /**
     * 은퇴 (소속 해제, 매니저 관계 종료, 스테이블 해산 등).
     */
    void retire(RosterEntity entity, LocalDateTime date, String notes);

    /**
     * 부상.
     *
     * @throws com.ryuqq.lifecycle.core.exception.UnsupportedCapabilityException 개인이 아닌 엔티티인 경우
     */
    void injure(RosterEntity entity, LocalDateTime date, String notes);

    void employMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes);

    void releaseMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes);

    void suspendMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes);

    void reinstateMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes);

    void retireMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes);

    void injureMany(Collection<? extends RosterEntity> entities, LocalDateTime date, String notes);

    /**
     * cascade 없이 전이만 적용.
     */
    void direct(Transition transition, RosterEntity entity, LocalDateTime date, String notes);

    /**
     * 호출자가 지정한 cascade만으로 전이 적용.
     */
    void withCustomCascade(Transition transition, RosterEntity entity, List<CascadeStrategy> cascades,
                           LocalDateTime date, String notes);

    /**
     * 지정한 종류의 멤버 중 고용 중이고 정지되지 않은 멤버를 정지.
     */
    void suspendMembersByKind(RosterEntity group, Set<MemberKind> kinds, LocalDateTime date, String notes);

    /**
     * 모든 종류의 가용 멤버(고용 중, 정지 아님)를 정지.
     */
    void suspendAvailableMembers(RosterEntity group, LocalDateTime date, String notes);

    /**
     * 지정한 종류의 정지된 멤버를 복귀.
     */
    void reinstateMembersByKind(RosterEntity group, Set<MemberKind> kinds, LocalDateTime date, String notes);

    void reinstateAllSuspendedMembers(RosterEntity group, LocalDateTime date, String notes);
}
