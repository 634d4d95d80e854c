package com.ryuqq.lifecycle.application.collection;

import com.ryuqq.lifecycle.core.capability.Capabilities;
import com.ryuqq.lifecycle.core.capability.RosterEntity;

import java.util.function.Predicate;

/**
 * 상태별 집계 버킷.
 *
 * <p>하나의 엔티티가 여러 버킷에 속할 수 있습니다 (예: 정지 중이면서 고용 중).</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public enum StatusBucket {

    EMPLOYED("employed", Capabilities::isEmployed),
    UNEMPLOYED("unemployed", Capabilities::isUnemployed),
    SUSPENDED("suspended", Capabilities::isSuspended),
    INJURED("injured", Capabilities::isInjured),
    RETIRED("retired", Capabilities::isRetired),
    AVAILABLE("available", Capabilities::isAvailable);

    private final String key;
    private final Predicate<RosterEntity> membership;

    StatusBucket(String key, Predicate<RosterEntity> membership) {
        this.key = key;
        this.membership = membership;
    }

    public String key() {
        return key;
    }

    public boolean contains(RosterEntity entity) {
        return membership.test(entity);
    }
}
