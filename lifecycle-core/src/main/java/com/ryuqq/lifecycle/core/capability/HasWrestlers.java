package com.ryuqq.lifecycle.core.capability;

import java.util.List;

/**
 * 레슬러를 멤버로 가지는 그룹 (태그팀, 스테이블).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface HasWrestlers extends HasSubMembers {

    List<RosterEntity> currentWrestlers();

    @Override
    default List<RosterEntity> currentMembers() {
        return currentWrestlers();
    }
}
