package com.ryuqq.lifecycle.core.capability;

import java.util.Optional;

/**
 * 스테이블에 소속될 수 있는 엔티티 (레슬러, 태그팀, 매니저).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface BelongsToGroup extends RosterEntity {

    /**
     * 현재 소속된 스테이블.
     *
     * @return 소속 그룹 (없으면 empty)
     */
    Optional<MemberGroup> currentGroup();
}
