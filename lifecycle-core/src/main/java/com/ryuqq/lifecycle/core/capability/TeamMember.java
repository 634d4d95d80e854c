package com.ryuqq.lifecycle.core.capability;

import java.util.Optional;

/**
 * 태그팀에 소속될 수 있는 엔티티 (레슬러).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface TeamMember extends RosterEntity {

    /**
     * 현재 소속된 태그팀.
     *
     * @return 태그팀 (없으면 empty)
     */
    Optional<HasWrestlers> currentTagTeam();
}
