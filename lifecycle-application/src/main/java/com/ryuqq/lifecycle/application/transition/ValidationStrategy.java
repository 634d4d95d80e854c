package com.ryuqq.lifecycle.application.transition;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.Transition;

/**
 * 전이를 거부(veto)할 수 있는 사용자 정의 검증.
 *
 * <p>거부 시 {@link com.ryuqq.lifecycle.core.exception.ValidationException}을 던집니다.
 * 기본 검증(ensureCanBe*) 이후 등록 순서대로 실행되며, 첫 실패에서 중단됩니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValidationStrategy {

    /**
     * 검증 실행.
     *
     * @param entity 대상 엔티티
     * @param transition 시도하는 전이
     */
    void validate(RosterEntity entity, Transition transition);
}
