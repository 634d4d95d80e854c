package com.ryuqq.lifecycle.adapter.inmemory.roster;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.capability.BelongsToGroup;
import com.ryuqq.lifecycle.core.capability.HasManagers;
import com.ryuqq.lifecycle.core.capability.HasWrestlers;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * 태그팀 뷰: 고용/정지/은퇴는 가능하지만 부상 capability는 없습니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class TagTeam extends RosterMember implements HasWrestlers, HasManagers, BelongsToGroup {

    public TagTeam(InMemoryRosterStore store, EntityKey key) {
        super(store, key);
    }

    @Override
    public List<RosterEntity> currentWrestlers() {
        return store.currentMembers(key(), EntityType.WRESTLER);
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
}
