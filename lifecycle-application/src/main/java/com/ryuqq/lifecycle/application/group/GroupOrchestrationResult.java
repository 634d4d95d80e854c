package com.ryuqq.lifecycle.application.group;

import com.ryuqq.lifecycle.core.capability.MemberGroup;

import java.util.List;
import java.util.Optional;

/**
 * 그룹 오케스트레이션 결과.
 *
 * @param groups 작업이 만들어 낸 그룹 (중복 제거, 생성 순서)
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public record GroupOrchestrationResult(List<MemberGroup> groups) {

    public GroupOrchestrationResult {
        if (groups == null) {
            throw new IllegalArgumentException("groups cannot be null");
        }
        groups = List.copyOf(groups);
    }

    /**
     * 단일 결과 그룹 (merge, split의 경우).
     *
     * @return 첫 번째 그룹 (없으면 empty)
     */
    public Optional<MemberGroup> primary() {
        return groups.isEmpty() ? Optional.empty() : Optional.of(groups.get(0));
    }

    public boolean isSingle() {
        return groups.size() == 1;
    }
}
