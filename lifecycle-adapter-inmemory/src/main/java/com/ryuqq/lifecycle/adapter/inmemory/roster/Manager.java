package com.ryuqq.lifecycle.adapter.inmemory.roster;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.capability.BelongsToGroup;
import com.ryuqq.lifecycle.core.capability.Injurable;
import com.ryuqq.lifecycle.core.capability.ManagesMembers;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.List;
import java.util.Optional;

/**
 * 매니저 뷰.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Manager extends RosterMember implements Injurable, BelongsToGroup, ManagesMembers {

    public Manager(InMemoryRosterStore store, EntityKey key) {
        super(store, key);
    }

    @Override
    public boolean isInjured() {
        return injuryActive();
    }

    @Override
    public List<RosterEntity> currentManagedWrestlers() {
        return store.currentOwners(key(), EntityType.WRESTLER);
    }

    @Override
    public List<RosterEntity> currentManagedTagTeams() {
        return store.currentOwners(key(), EntityType.TAG_TEAM);
    }

    @Override
    public Optional<MemberGroup> currentGroup() {
        return store.currentOwners(key(), EntityType.STABLE).stream()
            .map(MemberGroup.class::cast)
            .findFirst();
    }
}
