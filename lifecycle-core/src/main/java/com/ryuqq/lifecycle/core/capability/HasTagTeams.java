package com.ryuqq.lifecycle.core.capability;

import java.util.List;

/**
 * 태그팀을 멤버로 가지는 그룹 (스테이블).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface HasTagTeams extends HasSubMembers {

    List<RosterEntity> currentTagTeams();

    @Override
    default List<RosterEntity> currentMembers() {
        return currentTagTeams();
    }
}
