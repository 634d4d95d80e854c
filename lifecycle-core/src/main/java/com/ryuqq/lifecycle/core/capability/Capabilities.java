package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.exception.UnsupportedCapabilityException;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * capability 판별 및 기본 검증 가드 디스패치.
 *
 * <p>관계를 순회하거나 전이를 적용하기 전에 항상 이 클래스로 capability를 확인합니다.
 * 엔티티가 capability를 선언하지 않은 경우 상태 조회 메서드는 false를 반환합니다.</p>
 *
 * <p><strong>전이별 필요 capability:</strong></p>
 * <ul>
 *   <li>employ, release → {@link Employable}</li>
 *   <li>suspend, reinstate → {@link Suspendable}</li>
 *   <li>retire → {@link Retirable}</li>
 *   <li>injure → {@link Injurable}</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Capabilities {

    private Capabilities() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 엔티티가 전이를 지원하는지 확인.
     *
     * @param entity 대상 엔티티
     * @param transition 전이
     * @return 필요한 capability를 구현했으면 true
     */
    public static boolean supports(RosterEntity entity, Transition transition) {
        if (entity == null || transition == null) {
            throw new IllegalArgumentException("entity and transition cannot be null");
        }
        return switch (transition) {
            case EMPLOY, RELEASE -> entity instanceof Employable;
            case SUSPEND, REINSTATE -> entity instanceof Suspendable;
            case RETIRE -> entity instanceof Retirable;
            case INJURE -> entity instanceof Injurable;
        };
    }

    /**
     * 전이 지원 여부 검증.
     *
     * @param entity 대상 엔티티
     * @param transition 전이
     * @throws UnsupportedCapabilityException capability가 없는 경우
     */
    public static void require(RosterEntity entity, Transition transition) {
        if (!supports(entity, transition)) {
            throw new UnsupportedCapabilityException(entity.key(), transition);
        }
    }

    /**
     * 전이의 기본 검증 가드 실행 (capability 확인 포함).
     *
     * <p>예: EMPLOY → {@link Employable#ensureCanBeEmployed()}</p>
     *
     * @param entity 대상 엔티티
     * @param transition 전이
     * @throws UnsupportedCapabilityException capability가 없는 경우
     * @throws com.ryuqq.lifecycle.core.exception.TransitionNotAllowedException 가드가 거부한 경우
     */
    public static void ensureCanBe(RosterEntity entity, Transition transition) {
        require(entity, transition);
        switch (transition) {
            case EMPLOY -> ((Employable) entity).ensureCanBeEmployed();
            case RELEASE -> ((Employable) entity).ensureCanBeReleased();
            case SUSPEND -> ((Suspendable) entity).ensureCanBeSuspended();
            case REINSTATE -> ((Suspendable) entity).ensureCanBeReinstated();
            case RETIRE -> ((Retirable) entity).ensureCanBeRetired();
            case INJURE -> ((Injurable) entity).ensureCanBeInjured();
        }
    }

    public static boolean isEmployed(RosterEntity entity) {
        return entity instanceof Employable employable && employable.isEmployed();
    }

    public static boolean isUnemployed(RosterEntity entity) {
        return entity instanceof Employable employable && !employable.isEmployed();
    }

    public static boolean isReleased(RosterEntity entity) {
        return entity instanceof Employable employable && employable.isReleased();
    }

    public static boolean hasFutureEmployment(RosterEntity entity) {
        return entity instanceof Employable employable && employable.hasFutureEmployment();
    }

    public static boolean isSuspended(RosterEntity entity) {
        return entity instanceof Suspendable suspendable && suspendable.isSuspended();
    }

    public static boolean isInjured(RosterEntity entity) {
        return entity instanceof Injurable injurable && injurable.isInjured();
    }

    public static boolean isRetired(RosterEntity entity) {
        return entity instanceof Retirable retirable && retirable.isRetired();
    }

    /**
     * 가용성 판정: 고용 중 AND 정지 아님 AND 부상 아님 AND 은퇴 아님.
     *
     * <p>각 검사는 해당 capability가 있을 때만 적용되며, 첫 실패에서 중단합니다.
     * 정지 capability가 없는 엔티티는 정지 검사로 제외되지 않습니다.</p>
     *
     * @param entity 대상 엔티티
     * @return 가용하면 true
     */
    public static boolean isAvailable(RosterEntity entity) {
        if (entity instanceof Employable employable && !employable.isEmployed()) {
            return false;
        }
        if (entity instanceof Suspendable suspendable && suspendable.isSuspended()) {
            return false;
        }
        if (entity instanceof Injurable injurable && injurable.isInjured()) {
            return false;
        }
        return !(entity instanceof Retirable retirable && retirable.isRetired());
    }
}
