package com.ryuqq.lifecycle.application.support;

import com.ryuqq.lifecycle.core.capability.MemberGroup;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.spi.MembershipRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * fake 엔티티의 리스트와 역참조를 함께 갱신하는 소속 저장소.
 */
public class FakeMembershipRepository implements MembershipRepository {

    private final CallLog calls;
    private final AtomicLong groupIds = new AtomicLong(900);

    public FakeMembershipRepository(CallLog calls) {
        this.calls = calls;
    }

    @Override
    public void addWrestler(RosterEntity owner, RosterEntity wrestler, LocalDateTime date) {
        calls.record("addWrestler", owner, wrestler);
        FakeWrestler member = (FakeWrestler) wrestler;
        if (owner instanceof FakeStable stable) {
            stable.wrestlers.add(member);
            member.group = stable;
        } else if (owner instanceof FakeTagTeam team) {
            team.wrestlers.add(member);
            member.tagTeam = team;
        }
    }

    @Override
    public void removeWrestler(RosterEntity owner, RosterEntity wrestler, LocalDateTime date) {
        calls.record("removeWrestler", owner, wrestler);
        FakeWrestler member = (FakeWrestler) wrestler;
        if (owner instanceof FakeStable stable) {
            stable.wrestlers.remove(member);
            member.group = null;
        } else if (owner instanceof FakeTagTeam team) {
            team.wrestlers.remove(member);
            member.tagTeam = null;
        }
    }

    @Override
    public void addTagTeam(RosterEntity owner, RosterEntity tagTeam, LocalDateTime date) {
        calls.record("addTagTeam", owner, tagTeam);
        FakeStable stable = (FakeStable) owner;
        stable.tagTeams.add(tagTeam);
        ((FakeTagTeam) tagTeam).group = stable;
    }

    @Override
    public void removeTagTeam(RosterEntity owner, RosterEntity tagTeam, LocalDateTime date) {
        calls.record("removeTagTeam", owner, tagTeam);
        ((FakeStable) owner).tagTeams.remove(tagTeam);
        ((FakeTagTeam) tagTeam).group = null;
    }

    @Override
    public void addManager(RosterEntity owner, RosterEntity manager, LocalDateTime date) {
        calls.record("addManager", owner, manager);
        FakeManager fake = (FakeManager) manager;
        managersOf(owner).add(fake);
        if (owner instanceof FakeWrestler) {
            fake.managedWrestlers.add(owner);
        } else if (owner instanceof FakeTagTeam) {
            fake.managedTagTeams.add(owner);
        } else if (owner instanceof FakeStable stable) {
            fake.group = stable;
        }
    }

    @Override
    public void removeManager(RosterEntity owner, RosterEntity manager, LocalDateTime date) {
        calls.record("removeManager", owner, manager);
        FakeManager fake = (FakeManager) manager;
        managersOf(owner).remove(fake);
        fake.managedWrestlers.remove(owner);
        fake.managedTagTeams.remove(owner);
        if (owner instanceof FakeStable) {
            fake.group = null;
        }
    }

    @Override
    public MemberGroup createGroup(String name, LocalDateTime date) {
        FakeStable stable = new FakeStable(groupIds.incrementAndGet(), name);
        calls.record("createGroup", stable, name);
        return stable;
    }

    private static List<RosterEntity> managersOf(RosterEntity owner) {
        if (owner instanceof FakeWrestler wrestler) {
            return wrestler.managers;
        }
        if (owner instanceof FakeTagTeam team) {
            return team.managers;
        }
        return ((FakeStable) owner).managers;
    }
}
