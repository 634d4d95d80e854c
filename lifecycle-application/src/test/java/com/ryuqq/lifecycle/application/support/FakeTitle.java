package com.ryuqq.lifecycle.application.support;

import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityKey;
import com.ryuqq.lifecycle.core.model.EntityType;

/**
 * 생명주기 capability가 하나도 없는 엔티티.
 */
public class FakeTitle implements RosterEntity {

    private final EntityKey key;

    public FakeTitle(long id) {
        this.key = EntityKey.of(EntityType.REFEREE, id);
    }

    @Override
    public EntityKey key() {
        return key;
    }

    @Override
    public String name() {
        return "Title " + key.id();
    }
}
