package com.ryuqq.lifecycle.core.capability;

import java.util.ArrayList;
import java.util.List;

/**
 * 팀들의 그룹 (스테이블).
 *
 * <p>레슬러, 태그팀, 매니저를 멤버로 가집니다. 병합/분할/이동의 대상입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface MemberGroup extends HasWrestlers, HasTagTeams, HasManagers {

    /**
     * 레슬러 → 태그팀 → 매니저 순서의 전체 멤버.
     *
     * @return 전체 멤버 목록
     */
    @Override
    default List<RosterEntity> currentMembers() {
        List<RosterEntity> members = new ArrayList<>(currentWrestlers());
        members.addAll(currentTagTeams());
        members.addAll(currentManagers());
        return members;
    }

    /**
     * 지정한 종류의 현재 멤버.
     *
     * @param kind 멤버 종류
     * @return 해당 종류의 멤버 목록
     */
    default List<RosterEntity> currentMembers(MemberKind kind) {
        return kind.membersOf(this);
    }
}
