package com.ryuqq.lifecycle.core.capability;

import java.util.ArrayList;
import java.util.List;

/**
 * 레슬러/태그팀을 관리하는 엔티티 (매니저).
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface ManagesMembers extends RosterEntity {

    List<RosterEntity> currentManagedWrestlers();

    List<RosterEntity> currentManagedTagTeams();

    default List<RosterEntity> currentManagedMembers() {
        List<RosterEntity> managed = new ArrayList<>(currentManagedWrestlers());
        managed.addAll(currentManagedTagTeams());
        return managed;
    }
}
