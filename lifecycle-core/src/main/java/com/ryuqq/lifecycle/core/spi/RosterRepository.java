package com.ryuqq.lifecycle.core.spi;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.exception.ConfigurationException;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.model.Transition;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 엔티티 유형별 상태 기간(state period) 저장소 SPI.
 *
 * <p>오케스트레이션 계층은 엔티티의 기본 레코드를 만들거나 삭제하지 않고,
 * 고용·정지·부상·은퇴 기간 레코드의 시작/종료만 요청합니다.</p>
 *
 * <p><strong>변경 메서드 매핑:</strong></p>
 * <pre>
 * employ    → createEmployment(entity, date, notes)
 * suspend   → createSuspension(entity, date, notes)
 * release   → createRelease(entity, date, notes)
 * retire    → createRetirement(entity, date, notes)
 * injure    → createInjury(entity, date, notes)
 * reinstate → createReinstatement(entity, date, notes)
 * </pre>
 *
 * <p>구현하지 않은 변경 메서드는 기본 구현이 {@link ConfigurationException}을 던집니다.
 * 예를 들어 태그팀 저장소는 {@link #createInjury}를 구현하지 않습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>모든 메서드는 호출자가 연 ambient 트랜잭션 안에서 실행됩니다</li>
 *   <li>notes는 null일 수 있습니다</li>
 * </ul>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface RosterRepository {

    /**
     * 이 저장소가 담당하는 엔티티 유형.
     *
     * @return 엔티티 유형
     */
    EntityType entityType();

    default void createEmployment(RosterEntity entity, LocalDateTime date, String notes) {
        throw ConfigurationException.missingMutation(entityType(), Transition.EMPLOY.mutationName());
    }

    default void createSuspension(RosterEntity entity, LocalDateTime date, String notes) {
        throw ConfigurationException.missingMutation(entityType(), Transition.SUSPEND.mutationName());
    }

    default void createRelease(RosterEntity entity, LocalDateTime date, String notes) {
        throw ConfigurationException.missingMutation(entityType(), Transition.RELEASE.mutationName());
    }

    default void createRetirement(RosterEntity entity, LocalDateTime date, String notes) {
        throw ConfigurationException.missingMutation(entityType(), Transition.RETIRE.mutationName());
    }

    default void createInjury(RosterEntity entity, LocalDateTime date, String notes) {
        throw ConfigurationException.missingMutation(entityType(), Transition.INJURE.mutationName());
    }

    default void createReinstatement(RosterEntity entity, LocalDateTime date, String notes) {
        throw ConfigurationException.missingMutation(entityType(), Transition.REINSTATE.mutationName());
    }

    /**
     * 진행 중인 은퇴 기간 종료.
     *
     * @param entity 은퇴 상태 엔티티
     * @param date 종료일
     */
    default void endRetirement(RosterEntity entity, LocalDateTime date) {
        throw ConfigurationException.missingMutation(entityType(), "endRetirement");
    }

    /**
     * 이름 변경 등 단순 속성 갱신.
     *
     * @param entity 대상 엔티티
     * @param data 변경할 속성 (예: {"name": "New Name"})
     */
    default void update(RosterEntity entity, Map<String, Object> data) {
        throw ConfigurationException.missingMutation(entityType(), "update");
    }

    /**
     * 전이에 대응하는 변경 메서드 호출.
     *
     * @param transition 전이
     * @param entity 대상 엔티티
     * @param date 유효일
     * @param notes 메모 (nullable)
     */
    default void apply(Transition transition, RosterEntity entity, LocalDateTime date, String notes) {
        switch (transition) {
            case EMPLOY -> createEmployment(entity, date, notes);
            case SUSPEND -> createSuspension(entity, date, notes);
            case RELEASE -> createRelease(entity, date, notes);
            case RETIRE -> createRetirement(entity, date, notes);
            case INJURE -> createInjury(entity, date, notes);
            case REINSTATE -> createReinstatement(entity, date, notes);
        }
    }
}
