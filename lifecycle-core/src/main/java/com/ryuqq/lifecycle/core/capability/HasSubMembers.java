package com.ryuqq.lifecycle.core.capability;

import java.util.List;

/**
 * 하위 멤버를 가지는 그룹 엔티티.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 * @see HasWrestlers
 * @see HasTagTeams
 * @see MemberGroup
 */
public interface HasSubMembers extends RosterEntity {

    /**
     * 현재 소속된 모든 하위 멤버.
     *
     * @return 멤버 목록 (없으면 빈 리스트)
     */
    List<RosterEntity> currentMembers();
}
