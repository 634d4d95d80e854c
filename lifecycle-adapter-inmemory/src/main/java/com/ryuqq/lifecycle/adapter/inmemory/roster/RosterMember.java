package com.ryuqq.lifecycle.adapter.inmemory.roster;

import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.adapter.inmemory.store.StatusKind;
import com.ryuqq.lifecycle.core.capability.Employable;
import com.ryuqq.lifecycle.core.capability.Retirable;
import com.ryuqq.lifecycle.core.capability.Suspendable;
import com.ryuqq.lifecycle.core.model.EntityKey;

import java.util.Objects;

/**
 * 저장소를 조회하는 로스터 엔티티 뷰의 공통 부분.
 *
 * <p>상태를 직접 들고 있지 않고 매 호출마다 {@link InMemoryRosterStore}를 조회하므로
 * 트랜잭션 롤백 후에도 뷰를 그대로 쓸 수 있습니다. 동등성은 {@link EntityKey} 기준입니다.</p>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public abstract class RosterMember implements Employable, Suspendable, Retirable {

    protected final InMemoryRosterStore store;
    private final EntityKey key;

    protected RosterMember(InMemoryRosterStore store, EntityKey key) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        this.store = store;
        this.key = key;
    }

    @Override
    public EntityKey key() {
        return key;
    }

    @Override
    public String name() {
        return store.name(key);
    }

    @Override
    public boolean isEmployed() {
        return store.isActive(key, StatusKind.EMPLOYMENT);
    }

    @Override
    public boolean hasFutureEmployment() {
        return store.hasFuture(key, StatusKind.EMPLOYMENT);
    }

    @Override
    public boolean isReleased() {
        return !isEmployed() && !hasFutureEmployment() && store.hasEnded(key, StatusKind.EMPLOYMENT);
    }

    @Override
    public boolean isSuspended() {
        return store.isActive(key, StatusKind.SUSPENSION);
    }

    @Override
    public boolean isRetired() {
        return store.isActive(key, StatusKind.RETIREMENT);
    }

    // 부상 capability를 선언한 하위 클래스용
    protected boolean injuryActive() {
        return store.isActive(key, StatusKind.INJURY);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RosterMember other)) {
            return false;
        }
        return key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key);
    }

    @Override
    public String toString() {
        return key.type().label() + "{key=" + key + ", name='" + name() + "'}";
    }
}
