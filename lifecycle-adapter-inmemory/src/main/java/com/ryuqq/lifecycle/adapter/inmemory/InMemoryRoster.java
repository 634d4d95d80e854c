package com.ryuqq.lifecycle.adapter.inmemory;

import com.ryuqq.lifecycle.adapter.inmemory.repository.InMemoryMembershipRepository;
import com.ryuqq.lifecycle.adapter.inmemory.repository.InMemoryRosterRepository;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Manager;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Referee;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Stable;
import com.ryuqq.lifecycle.adapter.inmemory.roster.TagTeam;
import com.ryuqq.lifecycle.adapter.inmemory.roster.Wrestler;
import com.ryuqq.lifecycle.adapter.inmemory.store.InMemoryRosterStore;
import com.ryuqq.lifecycle.adapter.inmemory.store.StatusKind;
import com.ryuqq.lifecycle.adapter.inmemory.transaction.InMemoryTransactionManager;
import com.ryuqq.lifecycle.core.capability.RosterEntity;
import com.ryuqq.lifecycle.core.model.EntityType;
import com.ryuqq.lifecycle.core.spi.MembershipRepository;
import com.ryuqq.lifecycle.core.spi.RepositoryRegistry;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * 인메모리 어댑터 조립 지점.
 *
 * <p>저장소, 유형별 저장소, 소속 저장소, 트랜잭션 관리자를 하나의 Clock으로 묶고,
 * 테스트 픽스처용 엔티티 생성/시드 메서드를 제공합니다. 시드 메서드는 파이프라인을 거치지
 * 않고 저장소에 직접 기록합니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * InMemoryRoster roster = new InMemoryRoster(clock);
 * Wrestler wrestler = roster.wrestler("Ric");
 * roster.seedEmployment(wrestler, start);
 *
 * LifecycleContext context = new LifecycleContext(
 *     roster.registry(), roster.transactionManager(), clock, new LifecycleConfig());
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public class InMemoryRoster {

    private final InMemoryRosterStore store;
    private final MembershipRepository membership;
    private final InMemoryTransactionManager transactionManager;
    private final RepositoryRegistry registry;

    public InMemoryRoster(Clock clock) {
        this.store = new InMemoryRosterStore(clock);
        this.membership = new InMemoryMembershipRepository(store);
        this.transactionManager = new InMemoryTransactionManager(store);
        RepositoryRegistry.Builder builder = RepositoryRegistry.builder().membership(membership);
        for (EntityType type : EntityType.values()) {
            builder.register(new InMemoryRosterRepository(store, type));
        }
        this.registry = builder.build();
    }

    // ===== 엔티티 생성 =====

    public Wrestler wrestler(String name) {
        return store.register(EntityType.WRESTLER, name, key -> new Wrestler(store, key));
    }

    public Manager manager(String name) {
        return store.register(EntityType.MANAGER, name, key -> new Manager(store, key));
    }

    public Referee referee(String name) {
        return store.register(EntityType.REFEREE, name, key -> new Referee(store, key));
    }

    public TagTeam tagTeam(String name) {
        return store.register(EntityType.TAG_TEAM, name, key -> new TagTeam(store, key));
    }

    public Stable stable(String name) {
        return store.register(EntityType.STABLE, name, key -> new Stable(store, key));
    }

    // ===== 상태 시드 =====

    public void seedEmployment(RosterEntity entity, LocalDateTime start) {
        store.openPeriod(entity.key(), StatusKind.EMPLOYMENT, start, null);
    }

    public void seedSuspension(RosterEntity entity, LocalDateTime start) {
        store.openPeriod(entity.key(), StatusKind.SUSPENSION, start, null);
    }

    public void seedInjury(RosterEntity entity, LocalDateTime start) {
        store.openPeriod(entity.key(), StatusKind.INJURY, start, null);
    }

    public void seedRetirement(RosterEntity entity, LocalDateTime start) {
        store.openPeriod(entity.key(), StatusKind.RETIREMENT, start, null);
    }

    /**
     * 과거 고용 후 해고된 상태로 시드.
     */
    public void seedRelease(RosterEntity entity, LocalDateTime employed, LocalDateTime released) {
        store.openPeriod(entity.key(), StatusKind.EMPLOYMENT, employed, null);
        store.closeOpenPeriods(entity.key(), StatusKind.EMPLOYMENT, released);
    }

    public void seedMembership(RosterEntity owner, RosterEntity member, LocalDateTime joined) {
        store.join(owner.key(), member.key(), joined);
    }

    // ===== 배선 =====

    public InMemoryRosterStore store() {
        return store;
    }

    public RepositoryRegistry registry() {
        return registry;
    }

    public MembershipRepository membership() {
        return membership;
    }

    public InMemoryTransactionManager transactionManager() {
        return transactionManager;
    }

    public Clock clock() {
        return store.clock();
    }
}
