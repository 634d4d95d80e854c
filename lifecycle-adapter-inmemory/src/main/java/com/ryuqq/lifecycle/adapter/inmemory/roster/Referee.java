package com.ryuqq.lifecycle.adapter.inmemory.roster;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.core.capability.Injurable;
import com.ryuqq.lifecycle.core.model.EntityKey;

public final class Referee extends RosterMember implements Injurable {

    public Referee(InMemoryRosterStore store, EntityKey key) {
        super(store, key);
    }

    @Override
    public boolean isInjured() {
        return injuryActive();
    }
}
