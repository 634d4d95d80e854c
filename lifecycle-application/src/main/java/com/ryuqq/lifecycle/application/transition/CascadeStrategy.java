package com.ryuqq.lifecycle.application.transition;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;

import java.time.LocalDateTime;

/**
 * 핵심 변경 이후 실행되는 cascade 전략.
 *
 * <p>반환값이 없으며, 부수효과는 {@link CascadeContext#spawn}으로 만든 추가
 * {@link StatusTransitionPipeline} 실행(또는 관계 저장소 호출)뿐입니다.
 * 전달받은 엔티티 객체를 직접 변경하지 않습니다.</p>
 *
 * <p>구현은 보통 대상 전이가 아니면 즉시 반환합니다:</p>
 * <pre>
 * (entity, date, transition, cascade) -> {
 *     if (transition != Transition.EMPLOY) {
 *         return;
 *     }
 *     ...
 * }
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface CascadeStrategy {

    /**
     * cascade 실행.
     *
     * @param entity 방금 전이된 엔티티
     * @param date 유효일
     * @param transition 적용된 전이
     * @param cascade 현재 cascade 체인 컨텍스트 (중첩 파이프라인 생성용)
     */
    void cascade(RosterEntity entity, LocalDateTime date, Transition transition, CascadeContext cascade);
}
