package com.ryuqq.lifecycle.core.statemachine;

import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

/**
 * 엔티티의 생명주기 상태 (엔티티의 상태 기간 레코드로부터 파생).
 *
 * <p><strong>파생 우선순위 (첫 일치):</strong></p>
 * <pre>
 * RETIRED → INJURED → SUSPENDED → EMPLOYED → FUTURE_EMPLOYED → RELEASED → UNEMPLOYED
 * </pre>
 *
 * <p>새 엔티티의 초기 상태는 UNEMPLOYED입니다. RETIRED/RELEASED도 종료 상태가 아니며
 * employ로 다시 열 수 있습니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum RosterState {

    UNEMPLOYED("unemployed"),
    FUTURE_EMPLOYED("scheduled for future employment"),
    EMPLOYED("employed"),
    SUSPENDED("suspended"),
    INJURED("injured"),
    RETIRED("retired"),
    RELEASED("released");

    private final String description;

    RosterState(String description) {
        this.description = description;
    }

    /**
     * 메시지용 상태 설명.
     *
     * @return 설명 (예: "unemployed")
     */
    public String description() {
        return description;
    }

    /**
     * 엔티티의 현재 상태 파생.
     *
     * @param entity 대상 엔티티
     * @return 현재 상태
     * @throws IllegalArgumentException entity가 null인 경우
     */
    public static RosterState of(RosterEntity entity) {
        if (entity == null) {
            throw new IllegalArgumentException("entity cannot be null");
        }
        if (Capabilities.isRetired(entity)) {
            return RETIRED;
        }
        if (Capabilities.isInjured(entity)) {
            return INJURED;
        }
        if (Capabilities.isSuspended(entity)) {
            return SUSPENDED;
        }
        if (Capabilities.isEmployed(entity)) {
            return EMPLOYED;
        }
        if (Capabilities.hasFutureEmployment(entity)) {
            return FUTURE_EMPLOYED;
        }
        if (Capabilities.isReleased(entity)) {
            return RELEASED;
        }
        return UNEMPLOYED;
    }
}
