package com.ryuqq.lifecycle.core.capability;

import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

/**
 * 부상 capability가 없는 테스트용 팀 엔티티.
 */
public class FakeTeam implements Employable, Retirable {

    private final EntityKey key;
    public boolean employed;
    public boolean retired;

    public FakeTeam(long id) {
        this.key = EntityKey.of(EntityType.TAG_TEAM, id);
    }

    @Override
    public EntityKey key() {
        return key;
    }

    @Override
    public String name() {
        return "Team " + key.id();
    }

    @Override
    public boolean isEmployed() {
        return employed;
    }

    @Override
    public boolean hasFutureEmployment() {
        return false;
    }

    @Override
    public boolean isReleased() {
        return false;
    }

    @Override
    public boolean isRetired() {
        return retired;
    }
}
