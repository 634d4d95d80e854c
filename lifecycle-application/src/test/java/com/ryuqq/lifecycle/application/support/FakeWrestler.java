package com.ryuqq.lifecycle.application.support;

import com.ryuqq.lifecycle.core.capability.BelongsToGroup;
import com.ryuqq.lifecycle.core.capability.HasManagers;
import com.ryuqq.lifecycle.core.capability.HasWrestlers;
import com.ryuqq.lifecycle.core.capability.Injurable;
import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.capability.TeamMember;
import com.ryuqq.lifecycle.core.model.EntityType;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class FakeWrestler extends FakeMember implements Injurable, HasManagers, BelongsToGroup, TeamMember {

    public final List<RosterEntity> managers = new ArrayList<>();
    public MemberGroup group;
    public HasWrestlers tagTeam;

    public FakeWrestler(long id, String name) {
        super(EntityType.WRESTLER, id, name);
    }

    @Override
    public boolean isInjured() {
        return injured;
    }

    @Override
    public List<RosterEntity> currentManagers() {
        return List.copyOf(managers);
    }

    @Override
    public Optional<MemberGroup> currentGroup() {
        return Optional.ofNullable(group);
    }

    @Override
    public Optional<HasWrestlers> currentTagTeam() {
        return Optional.ofNullable(tagTeam);
    }
}
