package com.ryuqq.lifecycle.adapter.inmemory.roster;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.capability.BelongsToGroup;
import com.ryuqq.lifecycle.core.capability.HasManagers;
import com.ryuqq.lifecycle.core.capability.HasWrestlers;
import com.ryuqq.lifecycle.core.capability.Injurable;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.capability.TeamMember;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * 레슬러 뷰: 매니저를 두고, 태그팀과 스테이블에 속할 수 있습니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Wrestler extends RosterMember implements Injurable, HasManagers, BelongsToGroup, TeamMember {

    public Wrestler(InMemoryRosterStore store, EntityKey key) {
        super(store, key);
    }

    @Override
    public boolean isInjured() {
        return injuryActive();
    }

    @Override
    public List<RosterEntity> currentManagers() {
        return store.currentMembers(key(), EntityType.MANAGER);
    }

    @Override
    public Optional<MemberGroup> currentGroup() {
        return store.currentOwners(key(), EntityType.STABLE).stream()
            .map(MemberGroup.class::cast)
            .findFirst();
    }

    @Override
    public Optional<HasWrestlers> currentTagTeam() {
        return store.currentOwners(key(), EntityType.TAG_TEAM).stream()
            .map(HasWrestlers.class::cast)
            .findFirst();
    }
}
