package com.ryuqq.lifecycle.adapter.inmemory.roster;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.List;

/**
 * 스테이블 뷰: 레슬러, 태그팀, 매니저를 멤버로 둡니다.
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public final class Stable extends RosterMember implements MemberGroup {

    public Stable(InMemoryRosterStore store, EntityKey key) {
        super(store, key);
    }

    @Override
    public List<RosterEntity> currentWrestlers() {
        return store.currentMembers(key(), EntityType.WRESTLER);
    }

    @Override
    public List<RosterEntity> currentTagTeams() {
        return store.currentMembers(key(), EntityType.TAG_TEAM);
    }

    @Override
    public List<RosterEntity> currentManagers() {
        return store.currentMembers(key(), EntityType.MANAGER);
    }
}
